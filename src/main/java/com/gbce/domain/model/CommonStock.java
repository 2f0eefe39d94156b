package com.gbce.domain.model;

import com.gbce.domain.enums.StockType;
import com.gbce.domain.vo.Money;
import java.math.BigDecimal;
import java.time.Clock;

/** Common stock: the yield is based on the last dividend paid. */
public class CommonStock extends Stock {

    public CommonStock(String symbol, Money lastDividend, Money parValue, Clock clock) {
        super(symbol, lastDividend, parValue, clock);
    }

    @Override
    public StockType getType() {
        return StockType.COMMON;
    }

    @Override
    protected BigDecimal dividendAmount() {
        return getLastDividend().toBigDecimal();
    }
}
