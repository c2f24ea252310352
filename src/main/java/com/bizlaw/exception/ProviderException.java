package com.bizlaw.exception;

/**
 * Search provider call failed (network error or malformed payload).
 * Always recovered at the scoped-query level by the orchestrator.
 */
public class ProviderException extends BizLawException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
