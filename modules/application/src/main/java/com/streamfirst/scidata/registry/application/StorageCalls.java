package com.streamfirst.scidata.registry.application;

import com.streamfirst.scidata.registry.domain.RegistryException;
import com.streamfirst.scidata.registry.domain.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Translates unexpected failures of storage collaborators into {@link StorageException}.
 * Typed registry failures pass through unchanged.
 */
@Slf4j
final class StorageCalls {

    private StorageCalls() {
    }

    static <T> T call(String description, Supplier<T> call) {
        try {
            return call.get();
        } catch (RegistryException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Storage call failed: {}", description, e);
            throw new StorageException("Failed to " + description, e);
        }
    }

    static void run(String description, Runnable call) {
        call(description, () -> {
            call.run();
            return null;
        });
    }
}
