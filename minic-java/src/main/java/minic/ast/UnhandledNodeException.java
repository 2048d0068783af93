package minic.ast;

/**
 * A tree walker met a node kind it has no rule for. This is a compiler defect, not bad input.
 */
public final class UnhandledNodeException extends IllegalStateException {
    public UnhandledNodeException(String walker, Node node) {
        super(walker + " has no rule for " + (node == null ? "null" : node.getClass().getSimpleName()));
    }
}
