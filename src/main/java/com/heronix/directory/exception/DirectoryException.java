package com.heronix.directory.exception;

import com.heronix.directory.model.enums.ErrorKind;

import lombok.Getter;

/**
 * Fatal failure of a directory call, classified by {@link ErrorKind}.
 */
@Getter
public class DirectoryException extends RuntimeException {

    private final ErrorKind kind;

    public DirectoryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DirectoryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static DirectoryException validation(String message) {
        return new DirectoryException(ErrorKind.VALIDATION, message);
    }
}
