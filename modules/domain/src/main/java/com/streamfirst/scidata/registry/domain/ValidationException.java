package com.streamfirst.scidata.registry.domain;

/**
 * Raised for malformed or incomplete input, most often container metadata at upload start.
 */
public class ValidationException extends RegistryException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
