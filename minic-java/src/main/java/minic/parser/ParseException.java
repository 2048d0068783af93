package minic.parser;

import minic.CompileException;
import minic.lexer.TokenType;

import java.util.List;
import java.util.stream.Collectors;

public final class ParseException extends CompileException {

    private final List<TokenType> expected;
    private final TokenType found;

    public ParseException(List<TokenType> expected, TokenType found) {
        super(Phase.SYNTAX, "Expected " + describe(expected) + ", found " + found);
        this.expected = List.copyOf(expected);
        this.found = found;
    }

    public ParseException(String message, TokenType found) {
        super(Phase.SYNTAX, message);
        this.expected = List.of();
        this.found = found;
    }

    /** Token kinds that would have been accepted; empty when the token kind was right but its text was not. */
    public List<TokenType> expected() {
        return expected;
    }

    public TokenType found() {
        return found;
    }

    private static String describe(List<TokenType> types) {
        return types.stream().map(TokenType::name).collect(Collectors.joining(" or "));
    }
}
