package minic.parser;

import minic.ast.expr.BinaryExpr;
import minic.ast.expr.Expr;
import minic.ast.expr.IntLiteral;
import minic.ast.expr.VarExpr;
import minic.ast.stmt.AssignStmt;
import minic.ast.stmt.IfStmt;
import minic.lexer.Token;
import minic.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser, one method per grammar rule, one token of lookahead.
 *
 * <pre>
 * program    := ifStmt EOF
 * ifStmt     := IF '(' condition ')' '{' block '}' [ ELSE '{' block '}' ]
 * condition  := ID OP (ID | NUMBER)
 * block      := assignment*
 * assignment := ID '=' (ID | NUMBER) ';'
 * </pre>
 */
public final class Parser {
    private final List<Token> tokens;
    private int pos = 0;

    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = List.copyOf(tokens);
    }

    // ---------- entry ----------
    public IfStmt parseProgram() {
        IfStmt program = parseIf();
        consume(TokenType.EOF);
        return program;
    }

    // ---------- statements ----------
    private IfStmt parseIf() {
        consume(TokenType.IF);
        consume(TokenType.LPAREN);
        BinaryExpr cond = parseCondition();
        consume(TokenType.RPAREN);

        consume(TokenType.LBRACE);
        List<AssignStmt> thenB = parseBlock();
        consume(TokenType.RBRACE);

        List<AssignStmt> elseB = null;
        if (check(TokenType.ELSE)) {
            consume(TokenType.ELSE);
            consume(TokenType.LBRACE);
            elseB = parseBlock();
            consume(TokenType.RBRACE);
        }
        return new IfStmt(cond, thenB, elseB);
    }

    private List<AssignStmt> parseBlock() {
        List<AssignStmt> stmts = new ArrayList<>();
        while (check(TokenType.ID)) {
            stmts.add(parseAssignment());
        }
        return stmts;
    }

    private AssignStmt parseAssignment() {
        Token name = consume(TokenType.ID);
        consume(TokenType.ASSIGN);
        Expr value = parseOperand();
        consume(TokenType.SEMI);
        return new AssignStmt(name.lexeme(), value);
    }

    // ---------- expressions ----------
    private BinaryExpr parseCondition() {
        Token left = consume(TokenType.ID);
        Token op = consume(TokenType.OP);
        Expr right = parseOperand();
        return new BinaryExpr(new VarExpr(left.lexeme()), toOperator(op), right);
    }

    private Expr parseOperand() {
        Token t = consumeAny(TokenType.ID, TokenType.NUMBER);
        if (t.type() == TokenType.NUMBER) return new IntLiteral(toInt(t));
        return new VarExpr(t.lexeme());
    }

    private static BinaryExpr.Operator toOperator(Token op) {
        try {
            return BinaryExpr.Operator.fromSymbol(op.lexeme());
        } catch (IllegalArgumentException e) {
            throw new ParseException("Unknown comparison operator '" + op.lexeme() + "'", op.type());
        }
    }

    private static int toInt(Token number) {
        try {
            return Integer.parseInt(number.lexeme());
        } catch (NumberFormatException e) {
            throw new ParseException("Integer literal out of range: " + number.lexeme(), number.type());
        }
    }

    // ---------- token helpers ----------

    /** The only place the cursor moves. */
    private Token consume(TokenType type) {
        Token t = peek();
        if (t.type() != type) throw new ParseException(List.of(type), t.type());
        pos++;
        return t;
    }

    private Token consumeAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return consume(type);
        }
        throw new ParseException(List.of(types), peek().type());
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    // stays on EOF once reached
    private Token peek() {
        return tokens.get(Math.min(pos, tokens.size() - 1));
    }
}
