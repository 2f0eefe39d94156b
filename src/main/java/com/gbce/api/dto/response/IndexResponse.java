package com.gbce.api.dto.response;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** GBCE all-share index. {@code allShareIndex} is null when no stock traded in the window. */
@Data
@Builder
public class IndexResponse {

    private BigDecimal allShareIndex;
    private int listedStocks;
    private long windowMinutes;
}
