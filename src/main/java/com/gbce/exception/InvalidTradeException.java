package com.gbce.exception;

import java.util.Map;

/** Raised for a non-positive trade quantity or price. The ledger is left unchanged. */
public class InvalidTradeException extends BaseException {

    public InvalidTradeException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_TRADE, message, details);
    }
}
