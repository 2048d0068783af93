package minic.ast.stmt;

import minic.ast.expr.Expr;

import java.util.Objects;

public record AssignStmt(String name, Expr value) implements Stmt {
    public AssignStmt {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
