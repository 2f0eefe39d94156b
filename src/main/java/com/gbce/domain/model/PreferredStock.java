package com.gbce.domain.model;

import com.gbce.domain.enums.StockType;
import com.gbce.domain.vo.Money;
import com.gbce.exception.InvalidStockException;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;
import lombok.Getter;

/**
 * Preferred stock: pays a fixed fraction of par value, so the yield is
 * {@code fixedDividendRate * parValue * 100 / price}.
 */
@Getter
public class PreferredStock extends Stock {

    /** Fraction of par value in (0, 1], e.g. 0.02 for 2%. */
    private final BigDecimal fixedDividendRate;

    public PreferredStock(String symbol, Money lastDividend, BigDecimal fixedDividendRate, Money parValue, Clock clock) {
        super(symbol, lastDividend, parValue, clock);
        if (fixedDividendRate == null
                || fixedDividendRate.signum() <= 0
                || fixedDividendRate.compareTo(BigDecimal.ONE) > 0) {
            throw new InvalidStockException(
                    "Fixed dividend rate must be in (0, 1]",
                    Map.of("symbol", symbol, "fixedDividendRate", String.valueOf(fixedDividendRate)));
        }
        this.fixedDividendRate = fixedDividendRate;
    }

    @Override
    public StockType getType() {
        return StockType.PREFERRED;
    }

    @Override
    protected BigDecimal dividendAmount() {
        return fixedDividendRate.multiply(getParValue().toBigDecimal());
    }
}
