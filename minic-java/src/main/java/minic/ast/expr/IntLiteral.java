package minic.ast.expr;

public record IntLiteral(int value) implements Expr {}
