package minic.sema;

import minic.ast.Node;
import minic.ast.UnhandledNodeException;
import minic.ast.expr.BinaryExpr;
import minic.ast.expr.IntLiteral;
import minic.ast.expr.VarExpr;
import minic.ast.stmt.AssignStmt;
import minic.ast.stmt.IfStmt;
import minic.types.PrimitiveType;

import java.util.Map;

/**
 * Checks that every variable is assigned before it is read.
 *
 * <p>Both branches of an if statement are walked in order against the same table, and
 * their definitions are not merged: a name assigned only in the then-branch is already
 * defined when the else-branch is checked, and stays defined afterwards.
 */
public final class SemanticChecker {

    /**
     * Checks {@code node} starting from {@code symbols} and returns the resulting table:
     * the input entries plus every assignment target. The input map is left untouched.
     *
     * @throws SemanticException on the first read of an undefined variable, in pre-order
     */
    public Map<String, String> check(Node node, Map<String, String> symbols) {
        SymbolTable table = new SymbolTable(symbols);
        check(node, table);
        return table.snapshot();
    }

    public void check(Node node, SymbolTable table) {
        if (node instanceof IntLiteral) {
            return;
        }
        if (node instanceof VarExpr v) {
            if (!table.isDefined(v.name())) throw new SemanticException(v.name());
            return;
        }
        if (node instanceof BinaryExpr b) {
            check(b.left(), table);
            check(b.right(), table);
            return;
        }
        if (node instanceof AssignStmt a) {
            // right side first: "x = x;" with x undefined must fail
            check(a.value(), table);
            table.define(a.name(), PrimitiveType.INT);
            return;
        }
        if (node instanceof IfStmt i) {
            check(i.condition(), table);
            for (AssignStmt s : i.thenBody()) check(s, table);
            if (i.hasElse()) {
                for (AssignStmt s : i.elseBody()) check(s, table);
            }
            return;
        }
        throw new UnhandledNodeException("SemanticChecker", node);
    }
}
