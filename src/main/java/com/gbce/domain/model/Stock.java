package com.gbce.domain.model;

import com.gbce.domain.enums.StockType;
import com.gbce.domain.enums.TradeIndicator;
import com.gbce.domain.vo.Decimals;
import com.gbce.domain.vo.Money;
import com.gbce.exception.InvalidStockException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * A listed stock together with the ledger of its trades.
 *
 * <p>Common and preferred stocks differ only in how the dividend used for the yield is
 * derived, see {@link #dividendAmount()}. Everything else (P/E, trade recording, VWSP)
 * is shared here.
 *
 * <p>Symbol, par value and last dividend are fixed at construction. The ledger is the
 * only mutable state and is append-only.
 */
@Getter
public abstract class Stock {

    public static final int MAX_SYMBOL_LENGTH = 10;
    public static final Duration DEFAULT_VWSP_WINDOW = Duration.ofMinutes(5);

    private static final BigDecimal PERCENT = BigDecimal.valueOf(100);

    private final String symbol;
    private final Money parValue;
    private final Money lastDividend;

    @Getter(AccessLevel.NONE)
    private final TradeLedger ledger;

    protected Stock(String symbol, Money lastDividend, Money parValue, Clock clock) {
        if (symbol == null || symbol.isBlank() || symbol.length() > MAX_SYMBOL_LENGTH) {
            throw new InvalidStockException(
                    "Symbol must be 1-" + MAX_SYMBOL_LENGTH + " characters", Map.of("symbol", String.valueOf(symbol)));
        }
        if (parValue == null || !parValue.isPositive()) {
            throw new InvalidStockException("Par value must be positive", Map.of("symbol", symbol));
        }
        if (lastDividend == null || lastDividend.isNegative()) {
            throw new InvalidStockException("Last dividend cannot be negative", Map.of("symbol", symbol));
        }
        this.symbol = symbol;
        this.parValue = parValue;
        this.lastDividend = lastDividend;
        this.ledger = new TradeLedger(clock);
    }

    public abstract StockType getType();

    /** Dividend per share in pennies that the yield is computed from. Not rounded. */
    protected abstract BigDecimal dividendAmount();

    /**
     * Dividend yield as a percentage of {@code price}, rounded to 2 digits.
     * A non-positive price yields {@code 0.00} rather than an error.
     */
    public BigDecimal dividendYield(Money price) {
        if (!price.isPositive()) {
            return Decimals.zero();
        }
        return Decimals.divideRounded(dividendAmount().multiply(PERCENT), price.toBigDecimal());
    }

    /**
     * Price over last dividend, unrounded. Empty when the price is not positive or no
     * dividend has been paid.
     */
    public Optional<BigDecimal> peRatio(Money price) {
        if (!price.isPositive() || lastDividend.isZero()) {
            return Optional.empty();
        }
        return Optional.of(Decimals.ratio(price.toBigDecimal(), lastDividend.toBigDecimal()));
    }

    public Trade recordTrade(int quantity, TradeIndicator indicator, Money price) {
        return ledger.record(quantity, indicator, price);
    }

    public Optional<BigDecimal> volumeWeightedStockPrice() {
        return volumeWeightedStockPrice(DEFAULT_VWSP_WINDOW);
    }

    /**
     * Volume weighted stock price in pounds over the trailing {@code window}.
     *
     * <p>VWSP = sum(price_i * qty_i) / sum(qty_i), computed exactly in pennies and rounded
     * once after conversion to pounds. Empty when no trade falls inside the window.
     */
    public Optional<BigDecimal> volumeWeightedStockPrice(Duration window) {
        List<Trade> recent = ledger.tradesSince(window);
        if (recent.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal weightedSum = BigDecimal.ZERO;
        long totalQuantity = 0;
        for (Trade trade : recent) {
            weightedSum = weightedSum.add(trade.getPrice().toBigDecimal().multiply(BigDecimal.valueOf(trade.getQuantity())));
            totalQuantity += trade.getQuantity();
        }

        if (totalQuantity == 0) {
            return Optional.empty();
        }

        BigDecimal pennyQuantity = BigDecimal.valueOf(totalQuantity).multiply(Money.PENNIES_PER_POUND);
        return Optional.of(Decimals.divideRounded(weightedSum, pennyQuantity));
    }

    public List<Trade> getTrades() {
        return ledger.getTrades();
    }

    public List<Trade> getTradesSince(Duration window) {
        return ledger.tradesSince(window);
    }

    public int getTradeCount() {
        return ledger.size();
    }
}
