package minic.ast;

/**
 * Common supertype of {@link minic.ast.expr.Expr} and {@link minic.ast.stmt.Stmt}.
 * Nodes are immutable and own their children.
 */
public interface Node {}
