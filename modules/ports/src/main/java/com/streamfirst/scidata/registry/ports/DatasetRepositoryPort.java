package com.streamfirst.scidata.registry.ports;

import com.streamfirst.scidata.registry.domain.Dataset;
import com.streamfirst.scidata.registry.domain.DatasetId;

import java.util.List;
import java.util.Optional;

/**
 * Port for persisting dataset snapshots.
 * The registry writes a dataset only while holding that dataset's lock, so implementations
 * need per-call atomicity but no cross-call transactions.
 */
public interface DatasetRepositoryPort {

    /**
     * Inserts or replaces the stored snapshot of a dataset.
     *
     * @param dataset the snapshot to store
     */
    void save(Dataset dataset);

    /**
     * Removes the stored snapshot of a dataset, if any. The registry only does this to discard a
     * dataset whose creation could not be finished.
     *
     * @param id the dataset identifier
     */
    void delete(DatasetId id);

    /**
     * @param id the dataset identifier
     * @return the latest stored snapshot, or empty if unknown
     */
    Optional<Dataset> findById(DatasetId id);

    /**
     * @param id the dataset identifier
     * @return true if a record exists for the identifier
     */
    default boolean exists(DatasetId id) {
        return findById(id).isPresent();
    }

    /**
     * Returns a point-in-time copy of all stored snapshots, in no particular order.
     *
     * @return all datasets, including incomplete and invalidated ones
     */
    List<Dataset> findAll();
}
