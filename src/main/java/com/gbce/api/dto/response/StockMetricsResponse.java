package com.gbce.api.dto.response;

import com.gbce.domain.enums.StockType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Metrics of one stock at a quoted price. {@code dividendYield} is a percentage;
 * {@code volumeWeightedStockPrice} is in pounds. Null fields are undefined.
 */
@Data
@Builder
public class StockMetricsResponse {

    private String symbol;
    private StockType type;
    private long pricePennies;
    private BigDecimal dividendYield;
    private BigDecimal peRatio;
    private BigDecimal volumeWeightedStockPrice;
    private int tradeCount;
}
