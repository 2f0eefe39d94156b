package com.gbce.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for listing a common stock. Monetary values are in pennies.
 * Range checks (symbol length, positive par value) are enforced by the domain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateCommonStockRequest {

    @NotBlank(message = "Symbol is required")
    private String symbol;

    @NotNull(message = "Last dividend is required")
    private Long lastDividendPennies;

    @NotNull(message = "Par value is required")
    private Long parValuePennies;
}
