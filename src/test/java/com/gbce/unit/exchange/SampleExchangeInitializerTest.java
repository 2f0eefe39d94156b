package com.gbce.unit.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.gbce.domain.enums.StockType;
import com.gbce.domain.model.PreferredStock;
import com.gbce.domain.vo.Money;
import com.gbce.exception.DuplicateSymbolException;
import com.gbce.exchange.Exchange;
import com.gbce.exchange.SampleExchangeInitializer;
import com.gbce.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.event.ApplicationReadyEvent;

class SampleExchangeInitializerTest {

    private Exchange exchange;

    @BeforeEach
    void setUp() {
        exchange = new Exchange(MutableClock.startingAt("2024-03-01T10:00:00Z"));
    }

    @Test
    void seedsFiveSampleStocks() {
        SampleExchangeInitializer initializer = new SampleExchangeInitializer(exchange, true);

        initializer.onApplicationEvent(mock(ApplicationReadyEvent.class));

        assertThat(exchange.getStockSymbols()).containsExactly("TEA", "POP", "ALE", "GIN", "JOE");
        assertThat(exchange.getStock("ALE").getLastDividend()).isEqualTo(Money.ofPennies(23));
        assertThat(exchange.getStock("ALE").getParValue()).isEqualTo(Money.ofPennies(6000));
        assertThat(exchange.getStock("JOE").getParValue()).isEqualTo(Money.ofPennies(25000));
        assertThat(exchange.getStock("GIN").getType()).isEqualTo(StockType.PREFERRED);
        assertThat(((PreferredStock) exchange.getStock("GIN")).getFixedDividendRate()).isEqualByComparingTo("0.02");
    }

    @Test
    void disabledSeedingListsNothing() {
        SampleExchangeInitializer initializer = new SampleExchangeInitializer(exchange, false);

        initializer.onApplicationEvent(mock(ApplicationReadyEvent.class));

        assertThat(exchange.getStockSymbols()).isEmpty();
    }

    @Test
    void skipsSymbolsAlreadyListed() {
        exchange.createCommonStock("POP", Money.ofPennies(99), Money.ofPennies(500));
        SampleExchangeInitializer initializer = new SampleExchangeInitializer(exchange, true);

        int listed = initializer.seed();

        assertThat(listed).isEqualTo(4);
        assertThat(exchange.getStock("POP").getLastDividend()).isEqualTo(Money.ofPennies(99));
        assertThat(initializer.seed()).isZero();
    }

    @Test
    void symbolListedConcurrentlyDuringSeedingIsSkipped() {
        Exchange racing = mock(Exchange.class);
        when(racing.createCommonStock(eq("POP"), any(Money.class), any(Money.class)))
                .thenThrow(new DuplicateSymbolException("POP"));
        SampleExchangeInitializer initializer = new SampleExchangeInitializer(racing, true);

        assertThatCode(() -> initializer.onApplicationEvent(mock(ApplicationReadyEvent.class)))
                .doesNotThrowAnyException();
        assertThat(initializer.seed()).isEqualTo(4);
    }
}
