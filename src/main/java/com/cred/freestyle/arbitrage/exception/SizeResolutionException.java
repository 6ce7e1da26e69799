package com.cred.freestyle.arbitrage.exception;

/**
 * Base class for failures of the size index.
 *
 * @author Arbitrage Team
 */
public abstract class SizeResolutionException extends RuntimeException {

    protected SizeResolutionException(String message) {
        super(message);
    }
}
