package com.gbce.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for listing a preferred stock. Monetary values are in pennies. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePreferredStockRequest {

    @NotBlank(message = "Symbol is required")
    private String symbol;

    @NotNull(message = "Last dividend is required")
    private Long lastDividendPennies;

    /** Fraction of par value, e.g. 0.02 for 2%. */
    @NotNull(message = "Fixed dividend rate is required")
    private BigDecimal fixedDividendRate;

    @NotNull(message = "Par value is required")
    private Long parValuePennies;
}
