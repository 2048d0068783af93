package minic.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();

    private int run(String... args) {
        return Main.run(args,
                new PrintStream(outBuf, true, StandardCharsets.UTF_8),
                new PrintStream(errBuf, true, StandardCharsets.UTF_8));
    }

    private String out() { return outBuf.toString(StandardCharsets.UTF_8); }

    private String err() { return errBuf.toString(StandardCharsets.UTF_8); }

    @Test
    void inline_source_with_predeclared_variable() {
        int code = run("-e", "if (x > 10) { y = 5; } else { y = 0; }", "-D", "x");
        assertEquals(0, code, err());
        assertTrue(out().contains("[1/4] Lexer: 19 tokens"));
        assertTrue(out().contains("[4/4] Code generator: 12 instructions"));
        assertTrue(out().contains("JMP_FALSE else_label_1"));
    }

    @Test
    void reads_source_file(@TempDir Path dir) throws IOException {
        Path src = dir.resolve("prog.mc");
        Files.writeString(src, "if (a == b) {\n    result = 1;\n} else {\n    result = 0;\n}\n");
        assertEquals(0, run(src.toString(), "-D", "a, b"), err());
        assertTrue(out().contains("symbols [a, b, result]"));
    }

    @Test
    void semantic_error_exit_code() {
        assertEquals(1, run("-e", "if (x > 10) { y = 5; }"));
        assertTrue(err().contains("SEMANTIC"));
        assertTrue(err().contains("Variable 'x' is not defined"));
    }

    @Test
    void lexical_error_exit_code() {
        assertEquals(1, run("-e", "if (x > 10) { y = 5; } $", "-D", "x"));
        assertTrue(err().contains("LEXICAL"));
    }

    @Test
    void predeclared_names_must_be_identifiers() {
        assertEquals(2, run("-e", "if (x > 1) { y = 1; }", "-D", "x,1bad,a b,$"));
        assertTrue(err().contains("Not a variable name: '1bad'"));
        assertFalse(out().contains("symbols"));
    }

    @Test
    void usage_errors() {
        assertEquals(2, run());
        assertTrue(err().contains("Usage"));
        assertEquals(2, run("-x"));
    }

    @Test
    void missing_file(@TempDir Path dir) {
        assertEquals(2, run(dir.resolve("nope.mc").toString()));
        assertTrue(err().contains("Cannot read"));
    }
}
