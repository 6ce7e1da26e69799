package com.cred.freestyle.arbitrage.api.dto;

import com.cred.freestyle.arbitrage.domain.model.SizeConflict;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * @author Arbitrage Team
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SizeConflictResponse {

    private String conflictId;
    private String canonicalSizeId;
    private String standard;
    private BigDecimal storedValue;
    private BigDecimal observedValue;
    private String observedSource;
    private String status;
    private Instant detectedAt;
    private Instant resolvedAt;
    private String resolvedBy;

    public static SizeConflictResponse fromEntity(SizeConflict conflict) {
        SizeConflictResponse response = new SizeConflictResponse();
        response.setConflictId(conflict.getSizeConflictId());
        response.setCanonicalSizeId(conflict.getCanonicalSizeId());
        response.setStandard(conflict.getStandard().name());
        response.setStoredValue(conflict.getStoredValue());
        response.setObservedValue(conflict.getObservedValue());
        response.setObservedSource(conflict.getObservedSource());
        response.setStatus(conflict.getStatus().name());
        response.setDetectedAt(conflict.getDetectedAt());
        response.setResolvedAt(conflict.getResolvedAt());
        response.setResolvedBy(conflict.getResolvedBy());
        return response;
    }
}
