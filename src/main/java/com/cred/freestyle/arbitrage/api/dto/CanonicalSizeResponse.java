package com.cred.freestyle.arbitrage.api.dto;

import com.cred.freestyle.arbitrage.domain.model.CanonicalSize;
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
public class CanonicalSizeResponse {

    private String canonicalSizeId;
    private String gender;
    private Integer ordinal;
    private String label;
    private BigDecimal us;
    private BigDecimal eu;
    private BigDecimal uk;
    private BigDecimal cm;
    private BigDecimal jp;
    private BigDecimal kr;
    private String validationSource;
    private Instant lastValidatedAt;

    /**
     * How the size was resolved; only set on resolve responses.
     */
    private String method;
    private String sizeAliasId;

    public static CanonicalSizeResponse fromEntity(CanonicalSize size) {
        CanonicalSizeResponse response = new CanonicalSizeResponse();
        response.setCanonicalSizeId(size.getCanonicalSizeId());
        response.setGender(size.getGender().name());
        response.setOrdinal(size.getOrdinal());
        response.setLabel(size.label());
        response.setUs(size.getUsSize());
        response.setEu(size.getEuSize());
        response.setUk(size.getUkSize());
        response.setCm(size.getCmSize());
        response.setJp(size.getJpSize());
        response.setKr(size.getKrSize());
        response.setValidationSource(size.getValidationSource());
        response.setLastValidatedAt(size.getLastValidatedAt());
        return response;
    }
}
