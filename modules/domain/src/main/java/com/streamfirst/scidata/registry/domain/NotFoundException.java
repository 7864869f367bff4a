package com.streamfirst.scidata.registry.domain;

/**
 * Raised for an unknown dataset or principal reference.
 */
public class NotFoundException extends RegistryException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException dataset(DatasetId id) {
        return new NotFoundException("Dataset not found: " + id);
    }

    public static NotFoundException principal(Principal principal) {
        return new NotFoundException("Principal not found: " + principal);
    }
}
