package com.cred.freestyle.arbitrage.api.dto;

import com.cred.freestyle.arbitrage.domain.model.SizeAlias;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * @author Arbitrage Team
 */
@Data
@NoArgsConstructor
public class SizeAliasResponse {

    private String sizeAliasId;
    private String standard;
    private BigDecimal value;
    private String gender;
    private String brand;
    private String category;
    private String canonicalSizeId;
    private Instant createdAt;

    public static SizeAliasResponse fromEntity(SizeAlias alias) {
        SizeAliasResponse response = new SizeAliasResponse();
        response.setSizeAliasId(alias.getSizeAliasId());
        response.setStandard(alias.getFromStandard().name());
        response.setValue(alias.getFromValue());
        response.setGender(alias.getGender().name());
        response.setBrand(alias.getBrand());
        response.setCategory(alias.getCategory());
        response.setCanonicalSizeId(alias.getCanonicalSizeId());
        response.setCreatedAt(alias.getCreatedAt());
        return response;
    }
}
