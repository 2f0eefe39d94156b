package com.gbce.domain.model;

import com.gbce.domain.enums.TradeIndicator;
import com.gbce.domain.vo.Money;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * An executed trade in a single stock. Trades are supplied from outside the exchange
 * (there is no matching engine) and are never edited once recorded.
 */
@Value
@Builder
public class Trade {

    /** Stamped from the ledger's clock at the moment of recording. */
    Instant timestamp;

    int quantity;
    TradeIndicator indicator;
    Money price;
}
