package com.heronix.directory.service;

import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import org.springframework.stereotype.Component;

import com.heronix.directory.exception.DirectoryException;
import com.heronix.directory.exception.ProviderException;
import com.heronix.directory.model.enums.ErrorKind;

/**
 * Maps provider failures to the directory error taxonomy.
 *
 * Error codes take precedence over HTTP status; the status decides only when the
 * code is missing or unknown. Anything unrecognised is a server error.
 */
@Component
public class ErrorClassifier {

    private static final Set<String> AUTH_CODES = Set.of(
            "UnrecognizedClientException",
            "ExpiredTokenException",
            "ExpiredToken",
            "InvalidSignatureException",
            "IncompleteSignature",
            "InvalidClientTokenId",
            "MissingAuthenticationTokenException"
    );

    private static final Set<String> PERMISSION_CODES = Set.of(
            "AccessDeniedException",
            "AccessDenied"
    );

    private static final Set<String> NOT_FOUND_CODES = Set.of(
            "ResourceNotFoundException",
            "NotFoundException"
    );

    public ErrorKind classify(ProviderException e) {
        String code = e.getErrorCode();
        if (code != null) {
            if (AUTH_CODES.contains(code)) {
                return ErrorKind.AUTH;
            }
            if (PERMISSION_CODES.contains(code)) {
                return ErrorKind.PERMISSION;
            }
            if (NOT_FOUND_CODES.contains(code)) {
                return ErrorKind.NOT_FOUND;
            }
        }

        return switch (e.getHttpStatus()) {
            case 401 -> ErrorKind.AUTH;
            case 403 -> ErrorKind.PERMISSION;
            case 404 -> ErrorKind.NOT_FOUND;
            default -> ErrorKind.SERVER_ERROR;
        };
    }

    /**
     * Classify any failure raised while calling a region, unwrapping executor wrappers.
     * Timeouts and unknown exceptions are server errors.
     */
    public ErrorKind classify(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof ProviderException provider) {
            return classify(provider);
        }
        if (cause instanceof DirectoryException directory) {
            return directory.getKind();
        }
        return ErrorKind.SERVER_ERROR;
    }

    public boolean isTimeout(Throwable failure) {
        return unwrap(failure) instanceof TimeoutException;
    }

    /**
     * One-line description of a failure for warnings and error messages.
     */
    public String describe(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof TimeoutException) {
            return "timed out";
        }
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    public DirectoryException toDirectoryException(Throwable failure, String context) {
        Throwable cause = unwrap(failure);
        if (cause instanceof DirectoryException directory) {
            return directory;
        }
        return new DirectoryException(classify(cause), context + ": " + describe(cause), cause);
    }

    private Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
