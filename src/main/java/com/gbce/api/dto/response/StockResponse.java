package com.gbce.api.dto.response;

import com.gbce.domain.enums.StockType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StockResponse {

    private String symbol;
    private StockType type;
    private long lastDividendPennies;
    private long parValuePennies;

    /** Only set for preferred stocks. */
    private BigDecimal fixedDividendRate;

    private int tradeCount;
}
