package com.streamfirst.scidata.registry.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Descriptive and container-format metadata declared by the producer of a container. Frozen
 * together with the dataset once it is complete.
 */
@Value
@Builder(toBuilder = true)
public class DatasetMetadata {
    /** Identifier declared by the container itself, if any */
    DatasetId containerId;

    String title;
    String author;
    String organization;
    String email;
    String comment;
    String description;
    String license;
    String doi;
    String timestamp;

    @NonNull
    @Builder.Default
    List<String> keywords = List.of();

    /** Producer considers the content final; informational only */
    boolean staticContainer;

    /** Version of the container data model, e.g. "0.5.1" */
    String modelVersion;

    ContainerType containerType;

    /** When the producer created the container */
    Instant created;

    /** When the producer last modified the container */
    Instant modified;
}
