package com.stockinsights.common.exception;

public class SymbolNotFoundException extends InsightsException {
    private final String symbol;

    public SymbolNotFoundException(String symbol) {
        super(ErrorKind.SYMBOL_NOT_FOUND, "No data found for symbol '" + symbol + "'");
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
