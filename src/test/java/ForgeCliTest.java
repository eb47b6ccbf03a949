import com.forge.script.ForgeCli;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ForgeCliTest {

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int cli(String stdin, String... args) {
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        ByteArrayInputStream in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        return ForgeCli.run(args, in, out, err);
    }

    private String out() { return outBytes.toString(StandardCharsets.UTF_8); }
    private String err() { return errBytes.toString(StandardCharsets.UTF_8); }

    @Test
    void runs_a_script_file(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("ok.forge");
        Files.writeString(script, "var x = 1;\nprint x + 1;\n");
        assertEquals(ForgeCli.EXIT_OK, cli("", script.toString()));
        assertEquals("2\n", out());
        assertEquals("", err());
    }

    @Test
    void runtime_errors_exit_with_one(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("bad.forge");
        Files.writeString(script, "print nope;\n");
        assertEquals(ForgeCli.EXIT_ERROR, cli("", script.toString()));
        assertTrue(err().startsWith("[ERROR] Runtime error at 1:7"), err());
        assertTrue(err().contains("undefined variable 'nope'"));
    }

    @Test
    void json_diagnostics(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("bad.forge");
        Files.writeString(script, "var x = 1 - \"a\";\n");
        assertEquals(ForgeCli.EXIT_ERROR, cli("", "--json", script.toString()));
        assertTrue(err().contains("\"phase\":\"Runtime\""), err());
        assertTrue(err().trim().startsWith("["));
    }

    @Test
    void unreadable_script_exits_with_three(@TempDir Path dir) {
        assertEquals(ForgeCli.EXIT_READ, cli("", dir.resolve("missing.forge").toString()));
        assertTrue(err().startsWith("Failed to read script file"));
    }

    @Test
    void bad_usage_exits_with_two() {
        assertEquals(ForgeCli.EXIT_USAGE, cli("", "--verbose"));
        assertEquals(ForgeCli.EXIT_USAGE, cli("", "a.forge", "b.forge"));
        assertTrue(err().startsWith("Usage: forge"));
    }

    @Test
    void repl_echoes_expression_results() {
        assertEquals(ForgeCli.EXIT_OK, cli("var x = 40;\nx + 2\n\"s\"\n"));
        assertEquals("> > 42\n> \"s\"\n> \n", out());
    }

    @Test
    void repl_keeps_state_after_an_error() {
        assertEquals(ForgeCli.EXIT_OK, cli("var x = 1;\nx + true\nx\n"));
        assertEquals("> > > 1\n> \n", out());
        assertTrue(err().contains("unsupported operand types for '+': 'num' and 'bool'"), err());
    }

    @Test
    void repl_survives_a_write_into_a_list_the_value_shrank() {
        assertEquals(ForgeCli.EXIT_OK, cli("var L = [1, 2];\nL[1] = pop(L);\nprint 42;\nL\n"));
        assertEquals("> > > 42\n> [1]\n> \n", out());
        assertTrue(err().contains("index 1 out of bounds for list of length 1"), err());
    }
}
