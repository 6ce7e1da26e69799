package com.cred.freestyle.arbitrage.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * @author Arbitrage Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SizeConversionResponse {

    private String canonicalSizeId;
    private String standard;
    private BigDecimal value;
}
