package com.cred.freestyle.arbitrage.domain.model;

import lombok.Value;

/**
 * Result of resolving a raw size notation against the size index.
 *
 * @author Arbitrage Team
 */
@Value
public class ResolvedSize {

    CanonicalSize canonicalSize;

    /**
     * Alias that produced the match, or null when the default conversion was used.
     */
    SizeAlias alias;

    Method method;

    public String getCanonicalSizeId() {
        return canonicalSize.getCanonicalSizeId();
    }

    public String getSizeAliasId() {
        return alias != null ? alias.getSizeAliasId() : null;
    }

    public enum Method {
        ALIAS_BRAND_CATEGORY,
        ALIAS_BRAND,
        ALIAS_CATEGORY,
        DEFAULT_CONVERSION
    }
}
