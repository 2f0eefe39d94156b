package com.gbce.exchange;

import com.gbce.domain.vo.Money;
import com.gbce.exception.DuplicateSymbolException;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Lists the GBCE sample stocks once the application has started.
 *
 * <p>All values are in pennies:
 * <ul>
 *   <li>TEA: common, last dividend 0, par 10000</li>
 *   <li>POP: common, last dividend 8, par 10000</li>
 *   <li>ALE: common, last dividend 23, par 6000</li>
 *   <li>GIN: preferred, last dividend 8, fixed 2%, par 10000</li>
 *   <li>JOE: common, last dividend 13, par 25000</li>
 * </ul>
 *
 * <p>Symbols already listed are skipped. Disabled with {@code gbce.sample-stocks.enabled=false}.
 */
@Component
public class SampleExchangeInitializer implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(SampleExchangeInitializer.class);

    private final Exchange exchange;
    private final boolean enabled;

    public SampleExchangeInitializer(
            Exchange exchange, @Value("${gbce.sample-stocks.enabled:true}") boolean enabled) {
        this.exchange = exchange;
        this.enabled = enabled;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        if (!enabled) {
            log.info("Sample stock seeding disabled");
            return;
        }
        seed();
    }

    /** Registers the sample stocks and returns how many were newly listed. */
    public int seed() {
        int listed = 0;
        listed += listCommon("TEA", 0, 10000);
        listed += listCommon("POP", 8, 10000);
        listed += listCommon("ALE", 23, 6000);
        listed += listPreferred("GIN", 8, new BigDecimal("0.02"), 10000);
        listed += listCommon("JOE", 13, 25000);
        log.info("GBCE sample exchange initialized: {} stocks listed, {} total", listed, exchange.getStockSymbols().size());
        return listed;
    }

    private int listCommon(String symbol, long lastDividend, long parValue) {
        try {
            exchange.createCommonStock(symbol, Money.ofPennies(lastDividend), Money.ofPennies(parValue));
            return 1;
        } catch (DuplicateSymbolException e) {
            log.debug("Sample stock {} already listed, skipping", symbol);
            return 0;
        }
    }

    private int listPreferred(String symbol, long lastDividend, BigDecimal fixedRate, long parValue) {
        try {
            exchange.createPreferredStock(symbol, Money.ofPennies(lastDividend), fixedRate, Money.ofPennies(parValue));
            return 1;
        } catch (DuplicateSymbolException e) {
            log.debug("Sample stock {} already listed, skipping", symbol);
            return 0;
        }
    }
}
