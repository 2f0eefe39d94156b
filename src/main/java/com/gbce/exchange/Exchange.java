package com.gbce.exchange;

import com.gbce.domain.model.CommonStock;
import com.gbce.domain.model.PreferredStock;
import com.gbce.domain.model.Stock;
import com.gbce.domain.vo.Decimals;
import com.gbce.domain.vo.Money;
import com.gbce.exception.DuplicateSymbolException;
import com.gbce.exception.StockNotFoundException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of listed stocks keyed by symbol, and the source of the all-share index.
 *
 * <p>The exchange owns its stocks: they are only created through the factory methods
 * below and are never removed or re-keyed. Registration is serialized on the registry
 * map; the index reads each stock's ledger independently and does not need a global
 * snapshot across stocks.
 *
 * <p>Each instance is independent, so tests and callers can hold as many as they need.
 */
public class Exchange {

    private static final Logger log = LoggerFactory.getLogger(Exchange.class);

    private final Clock clock;
    private final Duration vwspWindow;
    private final Map<String, Stock> stocksBySymbol = new LinkedHashMap<>();

    public Exchange(Clock clock) {
        this(clock, Stock.DEFAULT_VWSP_WINDOW);
    }

    public Exchange(Clock clock, Duration vwspWindow) {
        this.clock = clock;
        this.vwspWindow = vwspWindow;
    }

    /**
     * Creates and registers a common stock.
     *
     * @throws DuplicateSymbolException if the symbol is already listed
     * @throws com.gbce.exception.InvalidStockException if the stock attributes are invalid
     */
    public CommonStock createCommonStock(String symbol, Money lastDividend, Money parValue) {
        return register(symbol, () -> new CommonStock(symbol, lastDividend, parValue, clock));
    }

    /**
     * Creates and registers a preferred stock paying {@code fixedDividendRate} of par value.
     *
     * @throws DuplicateSymbolException if the symbol is already listed
     * @throws com.gbce.exception.InvalidStockException if the stock attributes are invalid
     */
    public PreferredStock createPreferredStock(
            String symbol, Money lastDividend, BigDecimal fixedDividendRate, Money parValue) {
        return register(
                symbol, () -> new PreferredStock(symbol, lastDividend, fixedDividendRate, parValue, clock));
    }

    private <T extends Stock> T register(String symbol, Supplier<T> factory) {
        T stock;
        synchronized (stocksBySymbol) {
            if (stocksBySymbol.containsKey(symbol)) {
                throw new DuplicateSymbolException(symbol);
            }
            stock = factory.get();
            stocksBySymbol.put(symbol, stock);
        }
        log.info(
                "Stock registered: symbol={}, type={}, lastDividend={}p, parValue={}p",
                stock.getSymbol(),
                stock.getType(),
                stock.getLastDividend().getPennies(),
                stock.getParValue().getPennies());
        return stock;
    }

    /** @throws StockNotFoundException if no stock is listed under {@code symbol} */
    public Stock getStock(String symbol) {
        Stock stock;
        synchronized (stocksBySymbol) {
            stock = stocksBySymbol.get(symbol);
        }
        if (stock == null) {
            throw new StockNotFoundException(symbol);
        }
        return stock;
    }

    public boolean hasStock(String symbol) {
        synchronized (stocksBySymbol) {
            return stocksBySymbol.containsKey(symbol);
        }
    }

    /** Listed stocks in registration order. */
    public List<Stock> getStocks() {
        synchronized (stocksBySymbol) {
            return new ArrayList<>(stocksBySymbol.values());
        }
    }

    public List<String> getStockSymbols() {
        synchronized (stocksBySymbol) {
            return new ArrayList<>(stocksBySymbol.keySet());
        }
    }

    public Duration getVwspWindow() {
        return vwspWindow;
    }

    /**
     * All-share index: geometric mean of the VWSP of every stock traded within the window.
     *
     * <p>Stocks without a positive VWSP are left out. The mean is taken in log space,
     * {@code exp(mean(ln(vwsp_i)))}, so no intermediate product is formed.
     *
     * @return the index rounded to 2 digits, or empty if no stock qualifies
     */
    public Optional<BigDecimal> allShareIndex() {
        double logSum = 0.0;
        int count = 0;
        for (Stock stock : getStocks()) {
            Optional<BigDecimal> vwsp = stock.volumeWeightedStockPrice(vwspWindow);
            if (vwsp.isPresent() && vwsp.get().signum() > 0) {
                logSum += Math.log(vwsp.get().doubleValue());
                count++;
            }
        }

        if (count == 0) {
            log.debug("All-share index undefined: no stock traded in the last {}", vwspWindow);
            return Optional.empty();
        }

        double geometricMean = Math.exp(logSum / count);
        BigDecimal index = Decimals.round(BigDecimal.valueOf(geometricMean));
        log.debug("All-share index computed: value={}, constituents={}", index, count);
        return Optional.of(index);
    }
}
