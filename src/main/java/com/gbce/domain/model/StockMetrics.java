package com.gbce.domain.model;

import com.gbce.domain.enums.StockType;
import com.gbce.domain.vo.Money;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Point-in-time view of one stock's metrics at a quoted price.
 *
 * <p>{@code peRatio} and {@code volumeWeightedStockPrice} are null when undefined
 * (no dividend paid, no trades in the window). {@code dividendYield} is always set.
 */
@Data
@Builder
public class StockMetrics {

    private String symbol;
    private StockType type;
    private Money price;
    private BigDecimal dividendYield;
    private BigDecimal peRatio;
    private BigDecimal volumeWeightedStockPrice;
    private int tradeCount;
}
