package com.cred.freestyle.arbitrage.service.alert;

import com.cred.freestyle.arbitrage.domain.model.Offer;
import com.cred.freestyle.arbitrage.domain.model.Opportunity;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Identity of an opportunity for delivery deduplication.
 *
 * fingerprint = sha256_hex(productId|canonicalSizeId|retailOfferId|resaleOfferId|priceBucket)
 * priceBucket = retailPrice / bucket ":" resalePrice / bucket (integer division, minor units)
 *
 * A price move inside the bucket keeps the fingerprint, so the same deal is not re-sent;
 * a larger move produces a new fingerprint and is delivered again.
 *
 * @author Arbitrage Team
 */
@Component
public class OpportunityFingerprinter {

    private final long priceBucket;

    public OpportunityFingerprinter(@Value("${arbitrage.alerts.delivery.price-bucket:500}") long priceBucket) {
        if (priceBucket <= 0) {
            throw new IllegalArgumentException("Price bucket must be positive");
        }
        this.priceBucket = priceBucket;
    }

    public String fingerprint(Opportunity opportunity) {
        Offer retail = opportunity.getRetailOffer();
        Offer resale = opportunity.getResaleOffer();
        String key = String.join("|",
                opportunity.getProductId(),
                opportunity.getCanonicalSizeId() != null ? opportunity.getCanonicalSizeId() : Offer.SIZELESS,
                retail.getOfferId(),
                resale.getOfferId(),
                (retail.getPrice() / priceBucket) + ":" + (resale.getPrice() / priceBucket));
        return sha256Hex(key);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
