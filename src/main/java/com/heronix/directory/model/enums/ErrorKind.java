package com.heronix.directory.model.enums;

import org.springframework.http.HttpStatus;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed taxonomy of fatal directory errors.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    /**
     * Caller supplied malformed input, detected before any provider call
     */
    VALIDATION("validation", HttpStatus.BAD_REQUEST),

    /**
     * Missing or expired provider credentials. Shared by all regions.
     */
    AUTH("auth", HttpStatus.UNAUTHORIZED),

    /**
     * Provider denied access
     */
    PERMISSION("permission", HttpStatus.FORBIDDEN),

    /**
     * Resource missing at the provider
     */
    NOT_FOUND("not_found", HttpStatus.NOT_FOUND),

    /**
     * Any other provider-side failure
     */
    SERVER_ERROR("server_error", HttpStatus.SERVICE_UNAVAILABLE);

    /**
     * Wire name used in error envelopes
     */
    private final String code;

    /**
     * HTTP status returned to API callers
     */
    private final HttpStatus httpStatus;

    /**
     * Only credential failures abort a multi-region operation.
     */
    public boolean isGlobal() {
        return this == AUTH;
    }
}
