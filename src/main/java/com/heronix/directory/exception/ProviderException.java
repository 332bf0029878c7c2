package com.heronix.directory.exception;

import lombok.Getter;

/**
 * Failure reported by a regional provider endpoint.
 *
 * Carries the raw provider error code (e.g. ResourceNotFoundException) and HTTP
 * status so that {@code ErrorClassifier} can place it in the error taxonomy.
 */
@Getter
public class ProviderException extends RuntimeException {

    /**
     * Region the failing call was sent to
     */
    private final String region;

    /**
     * Provider error code, null when the transport failed before a response
     */
    private final String errorCode;

    /**
     * HTTP status of the response, 0 when there was none
     */
    private final int httpStatus;

    public ProviderException(String region, String errorCode, int httpStatus, String message) {
        super(message);
        this.region = region;
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public ProviderException(String region, String errorCode, int httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.region = region;
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public static ProviderException missingCredentials(String region) {
        return new ProviderException(region, "MissingAuthenticationTokenException", 0,
                "No provider credentials configured");
    }
}
