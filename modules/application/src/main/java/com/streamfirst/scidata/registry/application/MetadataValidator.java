package com.streamfirst.scidata.registry.application;

import com.streamfirst.scidata.registry.domain.DatasetMetadata;
import com.streamfirst.scidata.registry.domain.ModelVersion;
import com.streamfirst.scidata.registry.domain.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Validates container metadata at upload start according to the container data model version.
 *
 * <p>Every supported model version requires title, author, email, model version and container
 * type name. Versions older than {@link ModelVersion#MINIMUM_SUPPORTED} are rejected. The
 * optional publication fields (doi, license, timestamp) are kept for every supported version.
 */
@Slf4j
public class MetadataValidator {

    /**
     * @return the metadata as it will be stored
     * @throws ValidationException describing the first problem found
     */
    public DatasetMetadata validate(DatasetMetadata metadata) {
        if (metadata == null) {
            throw new ValidationException("Metadata is required");
        }
        ModelVersion version = ModelVersion.parse(metadata.getModelVersion());
        if (version.isBefore(ModelVersion.MINIMUM_SUPPORTED)) {
            throw new ValidationException("Container model version " + version
                + " is not supported; the minimum model version is " + ModelVersion.MINIMUM_SUPPORTED);
        }

        require("title", metadata.getTitle());
        require("author", metadata.getAuthor());
        require("email", metadata.getEmail());
        if (!metadata.getEmail().contains("@")) {
            throw new ValidationException("Attribute 'email' is not an e-mail address: " + metadata.getEmail());
        }
        if (metadata.getContainerType() == null || metadata.getContainerType().name().isBlank()) {
            throw new ValidationException("Attribute 'containerType' with a name is required");
        }
        for (String keyword : metadata.getKeywords()) {
            if (keyword == null || keyword.isBlank()) {
                throw new ValidationException("Keywords must not be blank");
            }
        }

        log.debug("Metadata of '{}' valid for model version {}", metadata.getTitle(), version);
        return metadata.toBuilder()
            .keywords(List.copyOf(metadata.getKeywords()))
            .build();
    }

    private static void require(String attribute, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Attribute '" + attribute + "' is required");
        }
    }
}
