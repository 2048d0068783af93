package minic.lexer;

import minic.CompileException;

public final class LexerException extends CompileException {

    private final int codePoint;
    private final int offset;

    public LexerException(int codePoint, int offset) {
        super(Phase.LEXICAL, "Unexpected character '" + Character.toString(codePoint) + "' at offset " + offset);
        this.codePoint = codePoint;
        this.offset = offset;
    }

    /** The whole offending character, surrogate pairs included. */
    public String character() {
        return Character.toString(codePoint);
    }

    public int codePoint() {
        return codePoint;
    }

    /** UTF-16 index into the source. */
    public int offset() {
        return offset;
    }
}
