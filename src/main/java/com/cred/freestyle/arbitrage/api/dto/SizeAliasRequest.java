package com.cred.freestyle.arbitrage.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a brand or category specific size mapping.
 *
 * @author Arbitrage Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SizeAliasRequest {

    @NotBlank(message = "Standard is required")
    private String standard;

    @NotBlank(message = "Value is required")
    private String value;

    @NotBlank(message = "Gender is required")
    private String gender;

    private String brand;

    private String category;

    @NotBlank(message = "Canonical size ID is required")
    private String canonicalSizeId;
}
