package minic.ast.stmt;

import minic.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public record IfStmt(
        Expr condition,
        List<AssignStmt> thenBody,
        List<AssignStmt> elseBody   // null when there is no else clause
) implements Stmt {

    public IfStmt {
        Objects.requireNonNull(condition, "condition");
        thenBody = List.copyOf(thenBody);
        elseBody = elseBody == null ? null : List.copyOf(elseBody);
    }

    public boolean hasElse() {
        return elseBody != null;
    }
}
