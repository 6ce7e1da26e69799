package com.cred.freestyle.arbitrage.api.dto;

import com.cred.freestyle.arbitrage.domain.model.OfferHistory;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * @author Arbitrage Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OfferHistoryResponse {

    private Long price;
    private String currency;
    private Boolean inStock;
    private Instant recordedAt;

    public static OfferHistoryResponse fromEntity(OfferHistory history) {
        return new OfferHistoryResponse(history.getPrice(), history.getCurrency(),
                history.getInStock(), history.getRecordedAt());
    }
}
