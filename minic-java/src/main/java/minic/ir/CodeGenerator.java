package minic.ir;

import minic.ast.Node;
import minic.ast.UnhandledNodeException;
import minic.ast.expr.BinaryExpr;
import minic.ast.expr.IntLiteral;
import minic.ast.expr.VarExpr;
import minic.ast.stmt.AssignStmt;
import minic.ast.stmt.IfStmt;

import java.util.List;

/**
 * Lowers a checked AST to accumulator-style three-address code.
 *
 * <p>Every expression leaves its value in the accumulator. A binary comparison evaluates
 * its right operand first, spills it to a fresh temporary, then evaluates the left operand
 * and compares against the temporary:
 * <pre>
 *   x &gt; 10   =&gt;   LOADI 10, STORE temp_1, LOAD x, CMP temp_1
 * </pre>
 *
 * <p>The generator keeps no state between calls; each {@link #generate} gets its own
 * {@link Emitter}, so temp and label numbering restarts at 1.
 */
public final class CodeGenerator {

    public List<Insn> generate(Node node) {
        Emitter out = new Emitter();
        emit(node, out);
        return out.code();
    }

    /** Same as {@link #generate} but rendered one instruction per line. */
    public List<String> generateLines(Node node) {
        return generate(node).stream().map(Insn::toString).toList();
    }

    private void emit(Node node, Emitter out) {
        if (node instanceof IntLiteral n) {
            out.loadI(n.value());
            return;
        }
        if (node instanceof VarExpr v) {
            out.load(v.name());
            return;
        }
        if (node instanceof AssignStmt a) {
            emit(a.value(), out);
            out.store(a.name());
            return;
        }
        if (node instanceof BinaryExpr b) {
            emit(b.right(), out);
            String temp = out.newTemp();
            out.store(temp);
            emit(b.left(), out);
            out.cmp(temp);
            return;
        }
        if (node instanceof IfStmt i) {
            emitIf(i, out);
            return;
        }
        throw new UnhandledNodeException("CodeGenerator", node);
    }

    private void emitIf(IfStmt i, Emitter out) {
        Label elseL = out.newLabel("else_label");
        Label endL = out.newLabel("end_label");

        emit(i.condition(), out);
        out.jmpF(elseL);

        for (AssignStmt s : i.thenBody()) emit(s, out);
        out.jmp(endL);

        // bound even without an else body so both jump targets exist
        out.bind(elseL);
        if (i.hasElse()) {
            for (AssignStmt s : i.elseBody()) emit(s, out);
        }
        out.bind(endL);
    }
}
