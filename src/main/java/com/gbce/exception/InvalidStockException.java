package com.gbce.exception;

import java.util.Map;

/**
 * Raised while constructing a stock with an invalid symbol, par value, last dividend
 * or fixed dividend rate. Nothing is registered when this is thrown.
 */
public class InvalidStockException extends BaseException {

    public InvalidStockException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public InvalidStockException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
