package minic.lexer;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Lexer {

    private record Rule(TokenType type, Pattern pattern) {}

    private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_]\\w*");
    private static final Set<String> KEYWORDS = Set.of("if", "else");

    // order matters: keywords before ID, two-char operators before '<' and '>'
    private static final List<Rule> rules = List.of(
            new Rule(TokenType.IF, Pattern.compile("\\bif\\b")),
            new Rule(TokenType.ELSE, Pattern.compile("\\belse\\b")),
            new Rule(TokenType.NUMBER, Pattern.compile("\\d+")),
            new Rule(TokenType.ID, IDENTIFIER),
            new Rule(TokenType.OP, Pattern.compile("==|!=|<=|>=|<|>")),
            new Rule(TokenType.ASSIGN, Pattern.compile("=")),
            new Rule(TokenType.SEMI, Pattern.compile(";")),
            new Rule(TokenType.LPAREN, Pattern.compile("\\(")),
            new Rule(TokenType.RPAREN, Pattern.compile("\\)")),
            new Rule(TokenType.LBRACE, Pattern.compile("\\{")),
            new Rule(TokenType.RBRACE, Pattern.compile("\\}"))
    );

    private static final Pattern SKIP = Pattern.compile("[ \\t\\r\\n]+");

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;

    public Lexer(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /** True when {@code name} would lex as a single ID token. */
    public static boolean isIdentifier(String name) {
        return IDENTIFIER.matcher(name).matches() && !KEYWORDS.contains(name);
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            if (skipWhitespace()) continue;

            Token next = matchRule();
            if (next == null) throw error();
            tokens.add(next);
        }

        tokens.add(Token.eof());
        return tokens;
    }

    // ================= helpers =================

    private boolean skipWhitespace() {
        Matcher m = matcherAt(SKIP);
        if (!m.lookingAt()) return false;
        pos = m.end();
        return true;
    }

    private Token matchRule() {
        for (Rule rule : rules) {
            Matcher m = matcherAt(rule.pattern());
            if (m.lookingAt()) {
                pos = m.end();
                return new Token(rule.type(), m.group());
            }
        }
        return null;
    }

    // transparent bounds let \b see the character before pos
    private Matcher matcherAt(Pattern p) {
        return p.matcher(source)
                .region(pos, source.length())
                .useTransparentBounds(true)
                .useAnchoringBounds(false);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private LexerException error() {
        return new LexerException(source.codePointAt(pos), pos);
    }
}
