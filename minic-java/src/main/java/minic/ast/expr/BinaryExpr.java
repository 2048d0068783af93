package minic.ast.expr;

import java.util.Objects;

public record BinaryExpr(
        Expr left,
        Operator op,
        Expr right
) implements Expr {

    public BinaryExpr {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(right, "right");
    }

    /** Comparison operators; {@link #symbol()} is the source spelling. */
    public enum Operator {
        EQ("=="), NE("!="),
        LT("<"), GT(">"),
        LE("<="), GE(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) return op;
            }
            throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
        }
    }
}
