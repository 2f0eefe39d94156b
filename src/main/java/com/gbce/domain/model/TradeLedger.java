package com.gbce.domain.model;

import com.gbce.domain.enums.TradeIndicator;
import com.gbce.domain.vo.Money;
import com.gbce.exception.InvalidTradeException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Append-only record of the trades in one stock.
 *
 * <p>Appends and reads synchronize on the ledger itself, so concurrent recorders on the
 * same stock are serialized and every query works on a consistent copy. Ledgers of
 * different stocks never share a lock.
 *
 * <p>Timestamps come from the injected {@link Clock}; insertion order therefore matches
 * timestamp order as long as the clock does not run backwards.
 */
public class TradeLedger {

    private final Clock clock;
    private final List<Trade> trades = new ArrayList<>();

    public TradeLedger(Clock clock) {
        this.clock = clock;
    }

    /**
     * Validates and appends a trade stamped with the current instant.
     *
     * @throws InvalidTradeException if quantity or price is not positive
     */
    public Trade record(int quantity, TradeIndicator indicator, Money price) {
        if (quantity <= 0) {
            throw new InvalidTradeException(
                    "Quantity must be positive", Map.of("quantity", quantity));
        }
        if (price == null || !price.isPositive()) {
            throw new InvalidTradeException(
                    "Price must be positive", Map.of("pricePennies", price != null ? price.getPennies() : "null"));
        }
        if (indicator == null) {
            throw new InvalidTradeException("Trade indicator is required", Map.of());
        }

        // Stamp under the lock so insertion order follows timestamp order.
        synchronized (trades) {
            Trade trade = Trade.builder()
                    .timestamp(clock.instant())
                    .quantity(quantity)
                    .indicator(indicator)
                    .price(price)
                    .build();
            trades.add(trade);
            return trade;
        }
    }

    /**
     * Returns the trades stamped at or after {@code now - window}, in insertion order.
     * The cutoff is re-read from the clock on each call.
     */
    public List<Trade> tradesSince(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        List<Trade> recent = new ArrayList<>();
        synchronized (trades) {
            for (Trade trade : trades) {
                if (!trade.getTimestamp().isBefore(cutoff)) {
                    recent.add(trade);
                }
            }
        }
        return recent;
    }

    /** Snapshot of every trade ever recorded. */
    public List<Trade> getTrades() {
        synchronized (trades) {
            return List.copyOf(trades);
        }
    }

    public int size() {
        synchronized (trades) {
            return trades.size();
        }
    }
}
