package com.gbce.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.gbce.api.controller.IndexController;
import com.gbce.api.controller.StockController;
import com.gbce.config.ApiResponseAdvice;
import com.gbce.exception.GlobalExceptionHandler;
import com.gbce.exchange.Exchange;
import com.gbce.exchange.SampleExchangeInitializer;
import com.gbce.service.ExchangeService;
import com.gbce.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Cross-component test for the trade-to-index flow.
 * Wires a real Exchange seeded with the sample stocks, ExchangeService and both
 * controllers, and drives them over HTTP with a controllable clock.
 */
class ExchangeFlowIntegrationTest {

    private MutableClock clock;
    private Exchange exchange;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        exchange = new Exchange(clock);
        new SampleExchangeInitializer(exchange, true).seed();

        ExchangeService exchangeService = new ExchangeService(exchange);
        mockMvc = MockMvcBuilders.standaloneSetup(
                        new StockController(exchangeService), new IndexController(exchangeService))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private void trade(String symbol, int quantity, String indicator, long pricePennies) throws Exception {
        mockMvc.perform(post("/api/stocks/" + symbol + "/trades")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(
                                "{\"quantity\":%d,\"indicator\":\"%s\",\"pricePennies\":%d}",
                                quantity, indicator, pricePennies)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    @DisplayName("Sample stocks are listed and wrapped in the API envelope")
    void sampleStocksListed() throws Exception {
        mockMvc.perform(get("/api/stocks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.length()").value(5))
                .andExpect(jsonPath("$.data[3].symbol").value("GIN"))
                .andExpect(jsonPath("$.data[3].fixedDividendRate").value(0.02));
    }

    @Test
    @DisplayName("Index is undefined until trades arrive, then tracks the traded VWSPs")
    void tradesDriveIndex() throws Exception {
        mockMvc.perform(get("/api/index"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.allShareIndex").isEmpty())
                .andExpect(jsonPath("$.data.listedStocks").value(5));

        trade("TEA", 1000, "BUY", 9550);
        trade("TEA", 2000, "SELL", 10230);

        mockMvc.perform(get("/api/stocks/TEA/metrics").param("pricePennies", "10000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.dividendYield").value(0.0))
                .andExpect(jsonPath("$.data.peRatio").isEmpty())
                .andExpect(jsonPath("$.data.volumeWeightedStockPrice").value(100.03))
                .andExpect(jsonPath("$.data.tradeCount").value(2));

        // TEA alone: the index is its own VWSP
        assertThat(exchange.allShareIndex()).contains(new BigDecimal("100.03"));

        trade("POP", 100, "BUY", 2000);
        // sqrt(100.03 * 20.00) = 44.728...
        mockMvc.perform(get("/api/index"))
                .andExpect(jsonPath("$.data.allShareIndex").value(44.73));

        clock.advance(Duration.ofMinutes(6));
        trade("GIN", 10, "BUY", 900);

        assertThat(exchange.allShareIndex()).contains(new BigDecimal("9.00"));
        mockMvc.perform(get("/api/stocks/TEA/trades"))
                .andExpect(jsonPath("$.data.length()").value(0));
    }

    @Test
    @DisplayName("Errors surface with the error envelope and leave state unchanged")
    void errorsLeaveStateUnchanged() throws Exception {
        mockMvc.perform(post("/api/stocks/common")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"TEA\",\"lastDividendPennies\":5,\"parValuePennies\":100}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("DUPLICATE_SYMBOL"));

        mockMvc.perform(post("/api/stocks/POP/trades")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity\":10,\"indicator\":\"BUY\",\"pricePennies\":0}"))
                .andExpect(status().isUnprocessableEntity());

        mockMvc.perform(get("/api/stocks/NOPE"))
                .andExpect(status().isNotFound());

        assertThat(exchange.getStock("TEA").getParValue().getPennies()).isEqualTo(10000);
        assertThat(exchange.getStock("POP").getTradeCount()).isZero();
    }
}
