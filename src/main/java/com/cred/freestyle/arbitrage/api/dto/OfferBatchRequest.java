package com.cred.freestyle.arbitrage.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Batch of offer observations. Records are validated one by one so that a bad record is
 * reported in the response instead of failing the batch.
 *
 * @author Arbitrage Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OfferBatchRequest {

    @NotEmpty(message = "At least one offer is required")
    @Size(max = 500, message = "At most 500 offers per batch")
    private List<OfferRequest> offers;
}
