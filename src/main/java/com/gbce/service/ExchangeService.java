package com.gbce.service;

import com.gbce.domain.enums.TradeIndicator;
import com.gbce.domain.model.CommonStock;
import com.gbce.domain.model.PreferredStock;
import com.gbce.domain.model.Stock;
import com.gbce.domain.model.StockMetrics;
import com.gbce.domain.model.Trade;
import com.gbce.domain.vo.Money;
import com.gbce.exchange.Exchange;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Application-facing entry point to the {@link Exchange}.
 *
 * <p>Callers work in pennies; this service converts to {@link Money}, records trades,
 * and assembles {@link StockMetrics} snapshots. Errors from the exchange are propagated
 * unchanged.
 */
@Service
public class ExchangeService {

    private static final Logger log = LoggerFactory.getLogger(ExchangeService.class);

    private final Exchange exchange;

    public ExchangeService(Exchange exchange) {
        this.exchange = exchange;
    }

    public CommonStock createCommonStock(String symbol, long lastDividendPennies, long parValuePennies) {
        return exchange.createCommonStock(
                symbol, Money.ofPennies(lastDividendPennies), Money.ofPennies(parValuePennies));
    }

    public PreferredStock createPreferredStock(
            String symbol, long lastDividendPennies, BigDecimal fixedDividendRate, long parValuePennies) {
        return exchange.createPreferredStock(
                symbol, Money.ofPennies(lastDividendPennies), fixedDividendRate, Money.ofPennies(parValuePennies));
    }

    public Stock getStock(String symbol) {
        return exchange.getStock(symbol);
    }

    public List<Stock> getStocks() {
        return exchange.getStocks();
    }

    public Trade recordTrade(String symbol, int quantity, TradeIndicator indicator, long pricePennies) {
        Stock stock = exchange.getStock(symbol);
        Trade trade = stock.recordTrade(quantity, indicator, Money.ofPennies(pricePennies));
        log.info(
                "Recorded {} trade: {} shares of {} @ {}",
                indicator,
                quantity,
                symbol,
                trade.getPrice().toPounds());
        return trade;
    }

    /** Trades of {@code symbol} inside the exchange's VWSP window. */
    public List<Trade> getRecentTrades(String symbol) {
        return exchange.getStock(symbol).getTradesSince(exchange.getVwspWindow());
    }

    /** Dividend yield, P/E and VWSP of {@code symbol} at the given price. */
    public StockMetrics getMetrics(String symbol, long pricePennies) {
        Stock stock = exchange.getStock(symbol);
        Money price = Money.ofPennies(pricePennies);

        StockMetrics metrics = StockMetrics.builder()
                .symbol(stock.getSymbol())
                .type(stock.getType())
                .price(price)
                .dividendYield(stock.dividendYield(price))
                .peRatio(stock.peRatio(price).orElse(null))
                .volumeWeightedStockPrice(
                        stock.volumeWeightedStockPrice(exchange.getVwspWindow()).orElse(null))
                .tradeCount(stock.getTradeCount())
                .build();

        log.debug(
                "Metrics for {} @ {}p: yield={}, pe={}, vwsp={}",
                symbol,
                pricePennies,
                metrics.getDividendYield(),
                metrics.getPeRatio(),
                metrics.getVolumeWeightedStockPrice());
        return metrics;
    }

    public Duration getVwspWindow() {
        return exchange.getVwspWindow();
    }

    public Optional<BigDecimal> getAllShareIndex() {
        return exchange.allShareIndex();
    }
}
