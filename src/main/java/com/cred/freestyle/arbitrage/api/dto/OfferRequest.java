package com.cred.freestyle.arbitrage.api.dto;

import com.cred.freestyle.arbitrage.domain.model.Gender;
import com.cred.freestyle.arbitrage.domain.model.Offer;
import com.cred.freestyle.arbitrage.domain.model.OfferKind;
import com.cred.freestyle.arbitrage.domain.model.OfferObservation;
import com.cred.freestyle.arbitrage.domain.model.SizeStandard;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Request DTO for recording an offer observation.
 *
 * @author Arbitrage Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OfferRequest {

    @NotBlank(message = "Product ID is required")
    @Size(max = Offer.MAX_PRODUCT_ID_LENGTH, message = "Product ID must be at most 100 characters")
    private String productId;

    @NotBlank(message = "Source is required")
    @Size(max = Offer.MAX_SOURCE_LENGTH, message = "Source must be at most 50 characters")
    private String source;

    @NotBlank(message = "Source native ID is required")
    @Size(max = Offer.MAX_SOURCE_NATIVE_ID_LENGTH, message = "Source native ID must be at most 200 characters")
    private String sourceNativeId;

    @NotNull(message = "Offer kind is required")
    private OfferKind offerKind;

    /**
     * Minor units.
     */
    @NotNull(message = "Price is required")
    @Positive(message = "Price must be positive")
    private Long price;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "[A-Za-z]{3}", message = "Currency must be an ISO 4217 code")
    private String currency;

    private Boolean inStock;

    @Min(value = 0, message = "Stock quantity must not be negative")
    private Integer stockQty;

    private String sizeStandard;

    @Size(max = Offer.MAX_RAW_SIZE_VALUE_LENGTH, message = "Size value must be at most 20 characters")
    private String sizeValue;

    private String gender;

    @Size(max = Offer.MAX_BRAND_LENGTH, message = "Brand must be at most 100 characters")
    private String brand;

    private String category;

    private Map<String, String> additionalSizes;

    private Instant observedAt;

    /**
     * @throws IllegalArgumentException if a size standard or gender code is unknown
     */
    public OfferObservation toObservation() {
        Map<SizeStandard, String> additional = new EnumMap<>(SizeStandard.class);
        if (additionalSizes != null) {
            additionalSizes.forEach((standard, value) -> additional.put(SizeStandard.fromCode(standard), value));
        }
        return OfferObservation.builder()
                .productId(productId)
                .source(source)
                .sourceNativeId(sourceNativeId)
                .offerKind(offerKind)
                .price(price)
                .currency(currency)
                .inStock(inStock == null || inStock)
                .stockQty(stockQty)
                .sizeStandard(isBlank(sizeStandard) ? null : SizeStandard.fromCode(sizeStandard))
                .sizeValue(sizeValue)
                .gender(isBlank(gender) ? null : Gender.fromCode(gender))
                .brand(brand)
                .category(category)
                .additionalSizes(additional)
                .observedAt(observedAt)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
