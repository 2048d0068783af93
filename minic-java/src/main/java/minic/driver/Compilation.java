package minic.driver;

import minic.ast.stmt.IfStmt;
import minic.ir.Insn;
import minic.lexer.Token;

import java.util.List;
import java.util.Map;

/**
 * Everything one successful run produced. {@code symbols} is the table to seed the next run with.
 */
public record Compilation(
        List<Token> tokens,
        IfStmt ast,
        Map<String, String> symbols,
        List<Insn> instructions
) {
    public Compilation {
        tokens = List.copyOf(tokens);
        instructions = List.copyOf(instructions);
    }

    public List<String> lines() {
        return instructions.stream().map(Insn::toString).toList();
    }
}
