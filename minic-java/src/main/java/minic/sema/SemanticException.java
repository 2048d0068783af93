package minic.sema;

import minic.CompileException;

public final class SemanticException extends CompileException {

    private final String variable;

    public SemanticException(String variable) {
        super(Phase.SEMANTIC, "Variable '" + variable + "' is not defined");
        this.variable = variable;
    }

    public String variable() {
        return variable;
    }
}
