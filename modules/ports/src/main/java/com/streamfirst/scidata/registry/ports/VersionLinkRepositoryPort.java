package com.streamfirst.scidata.registry.ports;

import com.streamfirst.scidata.registry.domain.DatasetId;

import java.util.Optional;

/**
 * Port for the stored "replaces" links between dataset versions, indexed in both directions so
 * that direct neighbours are found without walking the chain.
 */
public interface VersionLinkRepositoryPort {

    /**
     * Records that {@code successor} replaces {@code predecessor}.
     *
     * @param successor the new version
     * @param predecessor the version it supersedes
     * @throws IllegalStateException if either side already has a link in that direction
     */
    void link(DatasetId successor, DatasetId predecessor);

    /**
     * @param id a dataset version
     * @return the version it replaces, or empty
     */
    Optional<DatasetId> predecessorOf(DatasetId id);

    /**
     * @param id a dataset version
     * @return the version that replaces it, or empty
     */
    Optional<DatasetId> successorOf(DatasetId id);
}
