package minic.ast.expr;

import java.util.Objects;

public record VarExpr(String name) implements Expr {
    public VarExpr {
        Objects.requireNonNull(name, "name");
    }
}
