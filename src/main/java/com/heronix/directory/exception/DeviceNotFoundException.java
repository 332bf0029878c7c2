package com.heronix.directory.exception;

import com.heronix.directory.model.enums.ErrorKind;

/**
 * Exception thrown when no region knows a device.
 */
public class DeviceNotFoundException extends DirectoryException {

    public DeviceNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public DeviceNotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}
