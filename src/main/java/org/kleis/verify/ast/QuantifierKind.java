package org.kleis.verify.ast;

public enum QuantifierKind {

    FOR_ALL("∀"),
    EXISTS("∃");

    private final String symbol;

    QuantifierKind(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public QuantifierKind dual() {
        return switch (this) {
            case FOR_ALL -> EXISTS;
            case EXISTS -> FOR_ALL;
        };
    }
}
