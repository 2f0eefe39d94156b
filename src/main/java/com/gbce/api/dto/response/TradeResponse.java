package com.gbce.api.dto.response;

import com.gbce.domain.enums.TradeIndicator;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TradeResponse {

    private Instant timestamp;
    private int quantity;
    private TradeIndicator indicator;
    private long pricePennies;
}
