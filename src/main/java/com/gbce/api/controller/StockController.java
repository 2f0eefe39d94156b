package com.gbce.api.controller;

import com.gbce.api.dto.request.CreateCommonStockRequest;
import com.gbce.api.dto.request.CreatePreferredStockRequest;
import com.gbce.api.dto.request.RecordTradeRequest;
import com.gbce.api.dto.response.StockMetricsResponse;
import com.gbce.api.dto.response.StockResponse;
import com.gbce.api.dto.response.TradeResponse;
import com.gbce.mapper.StockDtoMapper;
import com.gbce.service.ExchangeService;
import jakarta.validation.Valid;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for listing stocks, recording trades and reading per-stock metrics.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/stocks/common} -- list a common stock</li>
 *   <li>{@code POST /api/stocks/preferred} -- list a preferred stock</li>
 *   <li>{@code GET /api/stocks} -- all listed stocks</li>
 *   <li>{@code GET /api/stocks/{symbol}} -- one stock</li>
 *   <li>{@code POST /api/stocks/{symbol}/trades} -- record a trade</li>
 *   <li>{@code GET /api/stocks/{symbol}/trades} -- trades inside the VWSP window</li>
 *   <li>{@code GET /api/stocks/{symbol}/metrics?pricePennies=} -- yield, P/E and VWSP</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/stocks")
public class StockController {

    private final ExchangeService exchangeService;
    private final StockDtoMapper stockDtoMapper = Mappers.getMapper(StockDtoMapper.class);

    public StockController(ExchangeService exchangeService) {
        this.exchangeService = exchangeService;
    }

    @PostMapping("/common")
    @ResponseStatus(HttpStatus.CREATED)
    public StockResponse createCommonStock(@RequestBody @Valid CreateCommonStockRequest request) {
        return stockDtoMapper.toResponse(exchangeService.createCommonStock(
                request.getSymbol(), request.getLastDividendPennies(), request.getParValuePennies()));
    }

    @PostMapping("/preferred")
    @ResponseStatus(HttpStatus.CREATED)
    public StockResponse createPreferredStock(@RequestBody @Valid CreatePreferredStockRequest request) {
        return stockDtoMapper.toResponse(exchangeService.createPreferredStock(
                request.getSymbol(),
                request.getLastDividendPennies(),
                request.getFixedDividendRate(),
                request.getParValuePennies()));
    }

    @GetMapping
    public List<StockResponse> getStocks() {
        return stockDtoMapper.toStockResponses(exchangeService.getStocks());
    }

    @GetMapping("/{symbol}")
    public StockResponse getStock(@PathVariable String symbol) {
        return stockDtoMapper.toResponse(exchangeService.getStock(symbol));
    }

    @PostMapping("/{symbol}/trades")
    @ResponseStatus(HttpStatus.CREATED)
    public TradeResponse recordTrade(@PathVariable String symbol, @RequestBody @Valid RecordTradeRequest request) {
        return stockDtoMapper.toResponse(exchangeService.recordTrade(
                symbol, request.getQuantity(), request.getIndicator(), request.getPricePennies()));
    }

    @GetMapping("/{symbol}/trades")
    public List<TradeResponse> getRecentTrades(@PathVariable String symbol) {
        return stockDtoMapper.toTradeResponses(exchangeService.getRecentTrades(symbol));
    }

    @GetMapping("/{symbol}/metrics")
    public StockMetricsResponse getMetrics(@PathVariable String symbol, @RequestParam long pricePennies) {
        return stockDtoMapper.toResponse(exchangeService.getMetrics(symbol, pricePennies));
    }
}
