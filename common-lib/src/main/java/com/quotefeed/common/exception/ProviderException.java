package com.quotefeed.common.exception;

/**
 * Raised by a provider adapter when it cannot produce a usable quote or history:
 * transport error, non-2xx status, unparsable or empty payload, non-positive price.
 */
public class ProviderException extends RuntimeException {
    private final String providerName;

    public ProviderException(String providerName, String message) {
        super("[" + providerName + "] " + message);
        this.providerName = providerName;
    }

    public ProviderException(String providerName, String message, Throwable cause) {
        super("[" + providerName + "] " + message, cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
