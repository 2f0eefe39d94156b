package com.gbce.api.dto.request;

import com.gbce.domain.enums.TradeIndicator;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordTradeRequest {

    @NotNull(message = "Quantity is required")
    private Integer quantity;

    @NotNull(message = "Indicator is required")
    private TradeIndicator indicator;

    @NotNull(message = "Price is required")
    private Long pricePennies;
}
