package gr.imsi.athenarc.illustrator.model;

/**
 * How a constraint compares the target edge with its expression.
 */
public enum Relation {
    /** Always assign. */
    EQUAL("="),
    /** Move the edge up to the expression when it is below it. */
    AT_LEAST(">="),
    /** Move the edge down to the expression when it is above it. */
    AT_MOST("<=");

    private final String symbol;

    Relation(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static Relation fromSymbol(String symbol) {
        for (Relation relation : values()) {
            if (relation.symbol.equals(symbol)) {
                return relation;
            }
        }
        throw new IllegalArgumentException("Unknown constraint relation: " + symbol);
    }
}
