package com.gbce.api.controller;

import com.gbce.api.dto.response.IndexResponse;
import com.gbce.service.ExchangeService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** {@code GET /api/index} -- the GBCE all-share index over the configured VWSP window. */
@RestController
@RequestMapping("/api/index")
public class IndexController {

    private final ExchangeService exchangeService;

    public IndexController(ExchangeService exchangeService) {
        this.exchangeService = exchangeService;
    }

    @GetMapping
    public IndexResponse getAllShareIndex() {
        return IndexResponse.builder()
                .allShareIndex(exchangeService.getAllShareIndex().orElse(null))
                .listedStocks(exchangeService.getStocks().size())
                .windowMinutes(exchangeService.getVwspWindow().toMinutes())
                .build();
    }
}
