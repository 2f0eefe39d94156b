package com.gbce.domain.enums;

/** Buy or sell indicator of a recorded trade. Has no effect on VWSP or the index. */
public enum TradeIndicator {
    BUY,
    SELL
}
