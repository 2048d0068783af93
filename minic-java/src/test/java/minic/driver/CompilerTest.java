package minic.driver;

import minic.CompileException;
import minic.ast.UnhandledNodeException;
import minic.lexer.LexerException;
import minic.lexer.TokenType;
import minic.parser.ParseException;
import minic.sema.SemanticException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerTest {

    private final Compiler compiler = new Compiler();

    private static CompileException errorOf(Result<?> r) {
        assertFalse(r.isOk());
        return ((Result.Err<?>) r).error();
    }

    @Test
    void compile_runs_all_phases() {
        var c = compiler.compile("if (x > 10) { y = 5; z = y; } else { y = 0; z = 3; }", Map.of("x", "int"))
                .orElseThrow();

        assertEquals(TokenType.EOF, c.tokens().get(c.tokens().size() - 1).type());
        assertEquals(2, c.ast().thenBody().size());
        assertEquals(Map.of("x", "int", "y", "int", "z", "int"), c.symbols());
        assertEquals("CMP temp_1", c.lines().get(3));
        assertEquals("end_label_1:", c.lines().get(c.lines().size() - 1));
    }

    @Test
    void compile_is_repeatable() {
        String src = "if (count < limit) { count = 10; flag = 1; } else { count = 0; flag = 0; }";
        Map<String, String> seed = Map.of("count", "int", "limit", "int");
        var a = compiler.compile(src, seed).orElseThrow();
        var b = compiler.compile(src, seed).orElseThrow();
        assertEquals(a.lines(), b.lines());
        assertEquals(a.symbols(), b.symbols());
    }

    @Test
    void symbols_from_one_run_seed_the_next() {
        var first = compiler.compile("if (a == a) { b = 1; }", Map.of("a", "int")).orElseThrow();
        assertFalse(compiler.compile("if (b != 0) { c = b; }", Map.of()).isOk());
        assertTrue(compiler.compile("if (b != 0) { c = b; }", first.symbols()).isOk());
    }

    @Test
    void lexical_error_is_an_err() {
        var e = errorOf(compiler.compile("if (x > 10) { y = 5; } $", Map.of("x", "int")));
        assertInstanceOf(LexerException.class, e);
        assertEquals(CompileException.Phase.LEXICAL, e.phase());
    }

    @Test
    void syntax_error_is_an_err() {
        var e = errorOf(compiler.compile("if (x > ) { y = 5; }", Map.of("x", "int")));
        assertInstanceOf(ParseException.class, e);
        assertEquals(CompileException.Phase.SYNTAX, e.phase());
    }

    @Test
    void semantic_error_is_an_err() {
        var e = errorOf(compiler.compile("if (x > 10) { y = 5; }", Map.of()));
        assertEquals("x", ((SemanticException) e).variable());
        assertEquals(CompileException.Phase.SEMANTIC, e.phase());
    }

    @Test
    void per_phase_results_compose() {
        Result<List<String>> code = compiler.tokenize("if (a >= 2) { }")
                .flatMap(compiler::parse)
                .flatMap(ast -> compiler.check(ast, Map.of("a", "int")).map(s -> compiler.generate(ast)));
        assertEquals("LOADI 2", code.orElseThrow().get(0));
    }

    @Test
    void err_rethrows_original_exception() {
        var r = compiler.tokenize("#");
        var ex = assertThrows(LexerException.class, r::orElseThrow);
        assertEquals("#", ex.character());
        assertFalse(r.map(tokens -> tokens.size()).isOk());
    }

    @Test
    void internal_errors_are_not_wrapped() {
        assertThrows(UnhandledNodeException.class, () -> compiler.check(null, Map.of()));
    }
}
