package com.cred.freestyle.arbitrage.exception;

/**
 * Exception thrown when a size mapping cannot be applied because it contradicts the index,
 * e.g. a reconciliation that would break ordering with neighbouring sizes.
 *
 * @author Arbitrage Team
 */
public class SizeConflictException extends SizeResolutionException {

    private final String canonicalSizeId;

    public SizeConflictException(String canonicalSizeId, String reason) {
        super(String.format("Size conflict on %s: %s", canonicalSizeId, reason));
        this.canonicalSizeId = canonicalSizeId;
    }

    public String getCanonicalSizeId() {
        return canonicalSizeId;
    }
}
