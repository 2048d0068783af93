package minic;

/**
 * Base class for the errors a user can cause with bad input.
 * Each one is fatal for the phase that raised it.
 */
public abstract class CompileException extends RuntimeException {

    public enum Phase {
        LEXICAL,
        SYNTAX,
        SEMANTIC
    }

    private final Phase phase;

    protected CompileException(Phase phase, String message) {
        super(message);
        this.phase = phase;
    }

    public Phase phase() {
        return phase;
    }
}
