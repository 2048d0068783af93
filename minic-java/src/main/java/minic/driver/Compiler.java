package minic.driver;

import minic.CompileException;
import minic.ast.stmt.IfStmt;
import minic.ir.CodeGenerator;
import minic.ir.Insn;
import minic.lexer.Lexer;
import minic.lexer.Token;
import minic.parser.Parser;
import minic.sema.SemanticChecker;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs the four phases and reports user errors as {@link Result.Err} values.
 *
 * <p>Holds no state between calls. Callers that want pre-declared variables to carry over
 * pass the {@link Compilation#symbols()} of one run into the next.
 */
public final class Compiler {

    private final SemanticChecker checker = new SemanticChecker();
    private final CodeGenerator generator = new CodeGenerator();

    public Result<List<Token>> tokenize(String source) {
        return attempt(() -> new Lexer(source).tokenize());
    }

    public Result<IfStmt> parse(List<Token> tokens) {
        return attempt(() -> new Parser(tokens).parseProgram());
    }

    public Result<Map<String, String>> check(IfStmt ast, Map<String, String> symbols) {
        return attempt(() -> checker.check(ast, symbols));
    }

    public List<String> generate(IfStmt ast) {
        return generator.generateLines(ast);
    }

    public Result<Compilation> compile(String source, Map<String, String> symbols) {
        return tokenize(source).flatMap(tokens ->
                parse(tokens).flatMap(ast ->
                        check(ast, symbols).map(updated -> {
                            List<Insn> code = generator.generate(ast);
                            return new Compilation(tokens, ast, updated, code);
                        })));
    }

    private static <T> Result<T> attempt(Supplier<T> phase) {
        try {
            return Result.ok(phase.get());
        } catch (CompileException e) {
            return Result.err(e);
        }
    }
}
