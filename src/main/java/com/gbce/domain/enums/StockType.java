package com.gbce.domain.enums;

/**
 * Stock classification driving the dividend yield formula.
 * COMMON: yield is based on the last dividend paid.
 * PREFERRED: yield is based on a fixed rate applied to par value.
 */
public enum StockType {
    COMMON,
    PREFERRED
}
