package com.streamfirst.scidata.registry.domain;

import java.util.Objects;

/**
 * Type descriptor declared by a container's producer.
 *
 * @param name the container type name (required)
 * @param version the type version, may be null
 * @param id an optional type identifier, may be null
 */
public record ContainerType(String name, String version, String id) {
    public ContainerType {
        Objects.requireNonNull(name, "Container type name cannot be null");
    }

    public static ContainerType named(String name) {
        return new ContainerType(name, null, null);
    }
}
