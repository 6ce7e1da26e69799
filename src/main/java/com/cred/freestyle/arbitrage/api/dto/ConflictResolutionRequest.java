package com.cred.freestyle.arbitrage.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @author Arbitrage Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConflictResolutionRequest {

    /**
     * true writes the observed value into the canonical size, false dismisses it.
     */
    @NotNull(message = "Accept flag is required")
    private Boolean accept;
}
