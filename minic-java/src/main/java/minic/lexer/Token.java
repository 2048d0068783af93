package minic.lexer;

/**
 * A lexeme together with its kind. {@code lexeme} is null only for {@link TokenType#EOF}.
 */
public record Token(TokenType type, String lexeme) {

    public static Token eof() {
        return new Token(TokenType.EOF, null);
    }

    @Override
    public String toString() {
        if (lexeme == null) return type.name();
        return type + "('" + lexeme + "')";
    }
}
