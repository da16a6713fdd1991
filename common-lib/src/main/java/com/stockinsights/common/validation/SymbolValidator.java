package com.stockinsights.common.validation;

import com.stockinsights.common.exception.ErrorKind;
import com.stockinsights.common.exception.ValidationException;

import java.util.Locale;

public final class SymbolValidator {

    private SymbolValidator() {}

    /**
     * @return the trimmed, upper-cased ticker
     * @throws ValidationException {@link ErrorKind#INVALID_SYMBOL} when missing or blank
     */
    public static String normalize(String raw) {
        if (raw == null) {
            throw new ValidationException(ErrorKind.INVALID_SYMBOL, "'symbol' field is required");
        }
        String symbol = raw.trim().toUpperCase(Locale.ROOT);
        if (symbol.isEmpty()) {
            throw new ValidationException(ErrorKind.INVALID_SYMBOL, "'symbol' cannot be empty");
        }
        return symbol;
    }
}
