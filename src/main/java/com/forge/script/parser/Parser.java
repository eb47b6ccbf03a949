package com.forge.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

import com.forge.debug.Debug;
import com.forge.script.error.ParseError;
import com.forge.script.error.ParseFailure;
import com.forge.script.parser.Statement.Block;
import com.forge.script.parser.Statement.Stmt;

/**
 * Recursive-descent parser.
 *
 * Each grammar rule pushes a label on a context stack so errors can say what was being
 * parsed. The top-level loop and every block loop recover from an error by skipping to
 * the next statement boundary, so one pass reports every independent error.
 */
public class Parser {
    private static final String TAG = "Parser";

    private final List<Token> tokens;
    private final Deque<String> context = new ArrayDeque<>();
    private final List<ParseError> errors = new ArrayList<>();
    private int current = 0;
    private int loopDepth = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    /** A REPL line: either a single expression to echo, or statements to run. */
    public static final class ReplUnit {
        public final Expr.ExprInterface expression;
        public final List<Stmt> statements;

        ReplUnit(Expr.ExprInterface expression, List<Stmt> statements) {
            this.expression = expression;
            this.statements = statements;
        }

        public boolean isExpression() {
            return expression != null;
        }
    }

    /**
     * Parses a whole program.
     *
     * @throws ParseFailure carrying every error found, in source order
     */
    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<>();
        while (!isAtEnd()) {
            int start = current;
            try {
                statements.add(statement());
            } catch (ParseError e) {
                record(e);
                synchronize(start, e);
            }
        }
        if (!errors.isEmpty()) throw new ParseFailure(new ArrayList<>(errors));
        return statements;
    }

    public ReplUnit parseReplUnit() {
        if (!isAtEnd()) {
            try {
                Expr.ExprInterface expr = expression();
                if (isAtEnd() && errors.isEmpty()) return new ReplUnit(expr, null);
            } catch (ParseError e) {
                Debug.get().t(TAG, "not a bare expression: " + e.getMessage());
            }
            // reparse from the start as statements
            current = 0;
            errors.clear();
        }
        return new ReplUnit(null, parse());
    }

    // -------------------------
    // Statements
    // -------------------------

    private Stmt statement() {
        switch (peek().type) {
            case VAR: return within("variable declaration", this::varDeclaration);
            case PRINT: return within("print statement", this::printStatement);
            case IF: return within("if-else statement", this::ifStatement);
            case WHILE: return within("while statement", this::whileStatement);
            case FOR: return within("for statement", this::forStatement);
            case RETURN: return within("return statement", this::returnStatement);
            case INPUT: return within("input statement", this::inputStatement);
            case BREAK:
            case CONTINUE:
                return loopControl();
            case LEFT_BRACE: return block();
            default: return within("expression statement", this::exprStatement);
        }
    }

    private Stmt varDeclaration() {
        Token keyword = advance();
        Token name = consume(TokenType.IDENTIFIER, "variable name");
        consume(TokenType.EQUAL, TokenType.EQUAL.display());
        Expr.ExprInterface init = expression();
        Token semi = consume(TokenType.SEMICOLON, TokenType.SEMICOLON.display());
        return new Statement.VarStmt(name, init, keyword.span.union(semi.span));
    }

    private Stmt printStatement() {
        Token keyword = advance();
        Expr.ExprInterface value = expression();
        consume(TokenType.SEMICOLON, TokenType.SEMICOLON.display());
        return new Statement.PrintStmt(keyword, value);
    }

    private Stmt ifStatement() {
        Token keyword = advance();
        Expr.ExprInterface condition = expression();
        Block thenBranch = block();
        Stmt elseBranch = null;
        if (match(TokenType.ELSE)) {
            elseBranch = check(TokenType.IF) ? ifStatement() : block();
        }
        Span end = elseBranch == null ? thenBranch.span() : elseBranch.span();
        return new Statement.If(condition, thenBranch, elseBranch, keyword.span.union(end));
    }

    private Stmt whileStatement() {
        Token keyword = advance();
        Expr.ExprInterface condition = expression();
        Block body = loopBody();
        return new Statement.While(condition, body, keyword.span.union(body.span()));
    }

    private Stmt forStatement() {
        Token keyword = advance();
        Token variable = consume(TokenType.IDENTIFIER, "loop variable");
        consume(TokenType.IN, TokenType.IN.display());
        Expr.ExprInterface iterable = expression();
        Block body = loopBody();
        return new Statement.For(variable, iterable, body, keyword.span.union(body.span()));
    }

    private Block loopBody() {
        loopDepth++;
        try {
            return block();
        } finally {
            loopDepth--;
        }
    }

    private Stmt returnStatement() {
        Token keyword = advance();
        Expr.ExprInterface value = null;
        if (!check(TokenType.SEMICOLON)) value = expression();
        consume(TokenType.SEMICOLON, TokenType.SEMICOLON.display());
        return new Statement.ReturnStmt(keyword, value);
    }

    private Stmt inputStatement() {
        Token keyword = advance();
        Expr.ExprInterface target = requireLvalue(postfix());
        Expr.ExprInterface prompt = null;
        if (match(TokenType.COMMA)) prompt = expression();
        Token semi = consume(TokenType.SEMICOLON, TokenType.SEMICOLON.display());
        return new Statement.InputStmt(target, prompt, keyword.span.union(semi.span));
    }

    private Stmt loopControl() {
        Token keyword = advance();
        consume(TokenType.SEMICOLON, TokenType.SEMICOLON.display());
        if (loopDepth == 0) {
            // well-formed, so no resynchronisation is needed
            record(new ParseError("'" + keyword.lexeme + "' outside of a loop", keyword.span, trail()));
        }
        if (keyword.type == TokenType.BREAK) return new Statement.BreakStmt(keyword);
        return new Statement.ContinueStmt(keyword);
    }

    private Block block() {
        return within("block", () -> {
            Token open = consume(TokenType.LEFT_BRACE, TokenType.LEFT_BRACE.display());
            List<Stmt> statements = new ArrayList<>();
            while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                int start = current;
                try {
                    statements.add(statement());
                } catch (ParseError e) {
                    record(e);
                    synchronize(start, e);
                }
            }
            Token close = consume(TokenType.RIGHT_BRACE, TokenType.RIGHT_BRACE.display());
            return new Block(statements, open.span.union(close.span));
        });
    }

    private Stmt exprStatement() {
        Expr.ExprInterface expr = expression();
        consume(TokenType.SEMICOLON, TokenType.SEMICOLON.display());
        return new Statement.ExprStmt(expr);
    }

    // -------------------------
    // Expressions
    // -------------------------

    private Expr.ExprInterface expression() { return assignment(); }

    private Expr.ExprInterface assignment() {
        Expr.ExprInterface expr = logical();
        if (peek().type.isAssignment()) {
            Token op = advance();
            Expr.ExprInterface value = logical();
            return new Expr.Assign(requireLvalue(expr), op, value);
        }
        return expr;
    }

    private Expr.ExprInterface logical() {
        Expr.ExprInterface expr = equality();
        while (match(TokenType.AND, TokenType.OR, TokenType.XOR)) {
            Token op = previous();
            Expr.ExprInterface right = equality();
            expr = new Expr.Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface equality() {
        Expr.ExprInterface expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = comparison();
            expr = new Expr.Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = prefix();
        while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = prefix();
            expr = new Expr.Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface prefix() {
        if (match(TokenType.INPUT)) {
            Token keyword = previous();
            return new Expr.InputOf(keyword, prefix());
        }
        if (match(TokenType.CLONE)) {
            Token keyword = previous();
            return new Expr.CloneOf(keyword, prefix());
        }
        if (match(TokenType.MIRROR)) {
            Token keyword = previous();
            return new Expr.MirrorOf(keyword, prefix());
        }
        return range();
    }

    private Expr.ExprInterface range() {
        Expr.ExprInterface expr = additive();
        while (match(TokenType.DOT_DOT)) {
            Expr.ExprInterface hi = additive();
            expr = new Expr.Range(expr, hi);
        }
        return expr;
    }

    private Expr.ExprInterface additive() {
        Expr.ExprInterface expr = multiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = multiplicative();
            expr = new Expr.Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface multiplicative() {
        Expr.ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            expr = new Expr.Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token op = previous();
            return new Expr.Unary(op, unary());
        }
        return cast();
    }

    private Expr.ExprInterface cast() {
        Expr.ExprInterface expr = postfix();
        while (match(TokenType.AS)) {
            Token type = peek();
            if (type.type != TokenType.IDENTIFIER || !isCastType(type.lexeme)) {
                throw error(type, "type name (num, str, char, bool or list)");
            }
            advance();
            expr = new Expr.Cast(expr, type);
        }
        return expr;
    }

    private static boolean isCastType(String name) {
        switch (name) {
            case "num":
            case "str":
            case "char":
            case "bool":
            case "list":
                return true;
            default:
                return false;
        }
    }

    private Expr.ExprInterface postfix() {
        Expr.ExprInterface expr = primary();
        while (true) {
            if (check(TokenType.LEFT_PAREN)) {
                expr = finishCall(expr);
            } else if (check(TokenType.LEFT_BRACKET)) {
                expr = finishIndex(expr);
            } else {
                break;
            }
        }
        return expr;
    }

    private Expr.ExprInterface finishCall(Expr.ExprInterface callee) {
        return within("call arguments", () -> {
            advance();
            List<Expr.ExprInterface> args = new ArrayList<>();
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    args.add(expression());
                } while (match(TokenType.COMMA));
            }
            Token close = consume(TokenType.RIGHT_PAREN, TokenType.RIGHT_PAREN.display());
            return new Expr.Call(callee, args, callee.span().union(close.span));
        });
    }

    private Expr.ExprInterface finishIndex(Expr.ExprInterface target) {
        return within("index", () -> {
            advance();
            Expr.ExprInterface index = expression();
            Token close = consume(TokenType.RIGHT_BRACKET, TokenType.RIGHT_BRACKET.display());
            return new Expr.Index(target, index, target.span().union(close.span));
        });
    }

    private Expr.ExprInterface primary() {
        Token t = peek();
        switch (t.type) {
            case NUMBER:
                advance();
                return new Expr.Literal(Value.number((Double) t.literal), t.span);
            case STRING:
                advance();
                return new Expr.Literal(Value.string((String) t.literal), t.span);
            case CHAR:
                advance();
                return new Expr.Literal(Value.character((Integer) t.literal), t.span);
            case TRUE:
                advance();
                return new Expr.Literal(Value.bool(true), t.span);
            case FALSE:
                advance();
                return new Expr.Literal(Value.bool(false), t.span);
            case NULL:
                advance();
                return new Expr.Literal(Value.nil(), t.span);
            case IDENTIFIER:
                advance();
                return new Expr.Variable(t);
            case LEFT_PAREN: {
                advance();
                Expr.ExprInterface inner = expression();
                consume(TokenType.RIGHT_PAREN, TokenType.RIGHT_PAREN.display());
                return inner;
            }
            case PIPE:
                return within("function", this::functionLiteral);
            case LEFT_BRACKET:
                return bracketLiteral();
            default:
                throw error(t, "expression");
        }
    }

    private Expr.ExprInterface functionLiteral() {
        Token open = advance();
        List<Token> params = new ArrayList<>();
        if (!check(TokenType.PIPE)) {
            do {
                params.add(consume(TokenType.IDENTIFIER, "parameter name"));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.PIPE, TokenType.PIPE.display());

        int savedDepth = loopDepth;
        loopDepth = 0;
        Block body;
        try {
            body = block();
        } finally {
            loopDepth = savedDepth;
        }
        return new Expr.FunctionLiteral(params, body, open.span.union(body.span()));
    }

    /** {@code []}, {@code [:]}, {@code [x; n]}, {@code [k: v, ...]} or {@code [a, b, ...]}. */
    private Expr.ExprInterface bracketLiteral() {
        context.push("list");
        try {
            Token open = advance();
            if (check(TokenType.RIGHT_BRACKET)) {
                Token close = advance();
                return new Expr.ListLiteral(new ArrayList<>(), open.span.union(close.span));
            }
            if (match(TokenType.COLON)) {
                context.pop();
                context.push("map");
                Token close = consume(TokenType.RIGHT_BRACKET, TokenType.RIGHT_BRACKET.display());
                return new Expr.MapLiteral(new ArrayList<>(), new ArrayList<>(), open.span.union(close.span));
            }

            Expr.ExprInterface first = expression();

            if (match(TokenType.SEMICOLON)) {
                Expr.ExprInterface count = expression();
                Token close = consume(TokenType.RIGHT_BRACKET, TokenType.RIGHT_BRACKET.display());
                return new Expr.ListRepeat(first, count, open.span.union(close.span));
            }

            if (match(TokenType.COLON)) {
                context.pop();
                context.push("map");
                List<Expr.ExprInterface> keys = new ArrayList<>();
                List<Expr.ExprInterface> values = new ArrayList<>();
                keys.add(first);
                values.add(expression());
                while (match(TokenType.COMMA)) {
                    if (check(TokenType.RIGHT_BRACKET)) break;
                    keys.add(expression());
                    consume(TokenType.COLON, TokenType.COLON.display());
                    values.add(expression());
                }
                Token close = consume(TokenType.RIGHT_BRACKET, TokenType.RIGHT_BRACKET.display());
                return new Expr.MapLiteral(keys, values, open.span.union(close.span));
            }

            List<Expr.ExprInterface> items = new ArrayList<>();
            items.add(first);
            while (match(TokenType.COMMA)) {
                if (check(TokenType.RIGHT_BRACKET)) break;
                items.add(expression());
            }
            Token close = consume(TokenType.RIGHT_BRACKET, TokenType.RIGHT_BRACKET.display());
            return new Expr.ListLiteral(items, open.span.union(close.span));
        } finally {
            context.pop();
        }
    }

    private Expr.ExprInterface requireLvalue(Expr.ExprInterface expr) {
        if (expr instanceof Expr.Variable || expr instanceof Expr.Index) return expr;
        throw new ParseError("l-value", "expression", expr.span(), trail());
    }

    // -------------------------
    // Recovery
    // -------------------------

    private void record(ParseError e) {
        Debug.get().d(TAG, "parse error at " + e.span().position() + ": " + e.getMessage());
        errors.add(e);
    }

    /**
     * Skips to the next statement boundary: just past a ';', or before a brace or a
     * statement keyword. Always moves at least one token when the failed statement
     * consumed nothing. A statement that only lacks its ';' resumes at the found token,
     * which starts the next statement.
     */
    private void synchronize(int start, ParseError error) {
        if (current > start && TokenType.SEMICOLON.display().equals(error.expected())) return;
        if (current == start) advance();
        while (!isAtEnd()) {
            if (previous().type == TokenType.SEMICOLON) return;
            TokenType t = peek().type;
            if (t == TokenType.RIGHT_BRACE || t == TokenType.LEFT_BRACE || t.startsStatement()) return;
            advance();
        }
    }

    // -------------------------
    // Helpers
    // -------------------------

    private <T> T within(String label, Supplier<T> rule) {
        context.push(label);
        try {
            return rule.get();
        } finally {
            context.pop();
        }
    }

    private List<String> trail() {
        List<String> out = new ArrayList<>(context.size());
        for (String label : context) out.add("parsing " + label);
        return out;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        throw error(peek(), expected);
    }

    private boolean check(TokenType type) {
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(Math.max(0, current - 1)); }

    private ParseError error(Token token, String expected) {
        return new ParseError(expected, token.describe(), token.span, trail());
    }
}
