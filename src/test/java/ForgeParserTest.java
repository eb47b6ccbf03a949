import com.forge.script.error.ParseError;
import com.forge.script.error.ParseFailure;
import com.forge.script.parser.Lexer;
import com.forge.script.parser.Parser;
import com.forge.script.parser.Statement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ForgeParserTest {

    private static List<Statement.Stmt> parse(String src) {
        return new Parser(new Lexer(src).tokenize()).parse();
    }

    private static List<ParseError> errors(String src) {
        ParseFailure f = assertThrows(ParseFailure.class, () -> parse(src));
        return f.errors();
    }

    @Test
    void parses_a_program() {
        String src = String.join("\n",
                "var xs = [1, 2, 3,];",
                "var m = [\"a\": 1, \"b\": 2];",
                "var f = |a, b| { return a + b; };",
                "for x in 0..3 { if x == 1 { continue; } else if x == 2 { break; } else { print x; } }",
                "while false { }",
                "{ var inner = [0; 4]; }",
                "input xs[0], \"prompt\";",
                "xs[1..2] = [9];",
                ""
        );
        assertEquals(8, parse(src).size());
    }

    @Test
    void two_missing_semicolons_give_exactly_two_errors() {
        String src = String.join("\n",
                "var a = 1",
                "var b = 2",
                "print a + b;"
        );
        List<ParseError> errs = errors(src);
        assertEquals(2, errs.size());

        assertEquals("expected ';', found 'var'", errs.get(0).getMessage());
        assertEquals(2, errs.get(0).span().line);
        assertEquals(List.of("parsing variable declaration"), errs.get(0).trail());

        assertEquals("expected ';', found 'print'", errs.get(1).getMessage());
        assertEquals(3, errs.get(1).span().line);
    }

    @Test
    void missing_semicolons_on_expression_statements_are_each_reported() {
        String src = String.join("\n",
                "var x = 0;",
                "x = 1",
                "x = 2",
                "print x;"
        );
        List<ParseError> errs = errors(src);
        assertEquals(2, errs.size());
        assertEquals("expected ';', found identifier 'x'", errs.get(0).getMessage());
        assertEquals(3, errs.get(0).span().line);
        assertEquals("expected ';', found 'print'", errs.get(1).getMessage());
        assertEquals(4, errs.get(1).span().line);
    }

    @Test
    void trail_lists_innermost_rule_first() {
        ParseError e = errors("var x = [1, 2;").get(0);
        assertEquals("expected ']', found ';'", e.getMessage());
        assertEquals(List.of("parsing list", "parsing variable declaration"), e.trail());
    }

    @Test
    void errors_inside_blocks_recover_locally() {
        String src = String.join("\n",
                "if true {",
                "    print 1",
                "    print 2;",
                "}",
                "print 3 3;"
        );
        List<ParseError> errs = errors(src);
        assertEquals(2, errs.size());
        assertEquals(List.of("parsing print statement", "parsing block", "parsing if-else statement"), errs.get(0).trail());
        assertEquals(5, errs.get(1).span().line);
    }

    @Test
    void assignment_target_must_be_an_lvalue() {
        ParseError e = errors("1 = 2;").get(0);
        assertEquals("expected l-value, found expression", e.getMessage());

        assertEquals("expected l-value, found expression", errors("input 5;").get(0).getMessage());
    }

    @Test
    void break_outside_loop_is_rejected() {
        assertEquals("'break' outside of a loop", errors("break;").get(0).getMessage());
        assertEquals("'continue' outside of a loop",
                errors("while true { var f = || { continue; }; }").get(0).getMessage());
    }

    @Test
    void unknown_cast_type() {
        assertEquals("expected type name (num, str, char, bool or list), found identifier 'float'",
                errors("var x = 1 as float;").get(0).getMessage());
    }

    @Test
    void missing_expression_reports_found_token() {
        ParseError e = errors("var x = ;").get(0);
        assertEquals("expression", e.expected());
        assertEquals("';'", e.found());
    }

    @Test
    void unclosed_block_reports_end_of_input() {
        ParseError e = errors("while true { print 1;").get(0);
        assertEquals("expected '}', found end of input", e.getMessage());
    }

    @Test
    void repl_unit_prefers_a_bare_expression() {
        Parser.ReplUnit expr = new Parser(new Lexer("1 + 2").tokenize()).parseReplUnit();
        assertTrue(expr.isExpression());

        Parser.ReplUnit stmts = new Parser(new Lexer("var x = 1; print x;").tokenize()).parseReplUnit();
        assertFalse(stmts.isExpression());
        assertEquals(2, stmts.statements.size());
    }
}
