package com.gbce.mapper;

import com.gbce.api.dto.response.StockMetricsResponse;
import com.gbce.api.dto.response.StockResponse;
import com.gbce.api.dto.response.TradeResponse;
import com.gbce.domain.model.PreferredStock;
import com.gbce.domain.model.Stock;
import com.gbce.domain.model.StockMetrics;
import com.gbce.domain.model.Trade;
import java.math.BigDecimal;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from exchange domain objects to API response DTOs.
 *
 * <p>{@link com.gbce.domain.vo.Money} values are flattened to their penny count.
 */
@Mapper
public interface StockDtoMapper {

    @Mapping(source = "lastDividend.pennies", target = "lastDividendPennies")
    @Mapping(source = "parValue.pennies", target = "parValuePennies")
    @Mapping(target = "fixedDividendRate", expression = "java(fixedDividendRate(stock))")
    StockResponse toResponse(Stock stock);

    List<StockResponse> toStockResponses(List<Stock> stocks);

    @Mapping(source = "price.pennies", target = "pricePennies")
    TradeResponse toResponse(Trade trade);

    List<TradeResponse> toTradeResponses(List<Trade> trades);

    @Mapping(source = "price.pennies", target = "pricePennies")
    StockMetricsResponse toResponse(StockMetrics metrics);

    default BigDecimal fixedDividendRate(Stock stock) {
        if (stock instanceof PreferredStock) {
            return ((PreferredStock) stock).getFixedDividendRate();
        }
        return null;
    }
}
