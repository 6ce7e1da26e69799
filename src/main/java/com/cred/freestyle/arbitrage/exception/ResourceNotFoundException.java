package com.cred.freestyle.arbitrage.exception;

/**
 * Exception thrown when a requested resource (offer, alert rule, size alias, ...) does not exist
 * or is not visible to the caller.
 *
 * @author Arbitrage Team
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(String.format("%s %s not found", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
