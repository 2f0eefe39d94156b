package com.gbce.exception;

import java.util.Map;

/** Thrown when no stock is listed under the requested symbol. */
public class StockNotFoundException extends BaseException {

    public StockNotFoundException(String symbol) {
        super(ErrorCode.NOT_FOUND, String.format("Stock %s is not listed", symbol), Map.of("symbol", symbol));
    }
}
