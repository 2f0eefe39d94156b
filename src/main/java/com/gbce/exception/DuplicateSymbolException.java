package com.gbce.exception;

import java.util.Map;

/** Thrown when a stock is registered under a symbol the exchange already holds. */
public class DuplicateSymbolException extends BaseException {

    public DuplicateSymbolException(String symbol) {
        super(ErrorCode.DUPLICATE_SYMBOL, String.format("Stock %s already exists", symbol), Map.of("symbol", symbol));
    }
}
