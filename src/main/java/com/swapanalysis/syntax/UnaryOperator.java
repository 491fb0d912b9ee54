package com.swapanalysis.syntax;

public enum UnaryOperator {
    NEG("-", false),
    POS("+", false),
    NOT("!", false),
    COMPL("~", false),
    PRE_INC("++", true),
    PRE_DEC("--", true),
    POST_INC("++", true),
    POST_DEC("--", true);

    private final String symbol;
    private final boolean mutating;

    UnaryOperator(String symbol, boolean mutating) {
        this.symbol = symbol;
        this.mutating = mutating;
    }

    public String symbol() {
        return symbol;
    }

    /** Increment and decrement write to their operand. */
    public boolean isMutating() {
        return mutating;
    }

    public boolean isPostfix() {
        return this == POST_INC || this == POST_DEC;
    }
}
