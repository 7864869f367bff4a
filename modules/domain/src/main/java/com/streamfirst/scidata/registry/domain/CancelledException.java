package com.streamfirst.scidata.registry.domain;

/**
 * Raised when the calling thread is interrupted before an operation took effect.
 */
public class CancelledException extends RegistryException {

    public CancelledException(String message, Throwable cause) {
        super(ErrorKind.CANCELLED, message, cause);
    }
}
