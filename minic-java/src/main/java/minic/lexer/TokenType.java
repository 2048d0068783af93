package minic.lexer;

public enum TokenType {

    // keywords
    IF,
    ELSE,

    // literals
    NUMBER,
    ID,

    // operators
    OP,
    ASSIGN,

    // symbols
    SEMI,
    LPAREN, RPAREN,
    LBRACE, RBRACE,

    EOF
}
