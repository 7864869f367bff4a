package com.streamfirst.scidata.registry.ports;

import com.streamfirst.scidata.registry.domain.DatasetId;
import com.streamfirst.scidata.registry.domain.PermissionEntry;

import java.util.Set;

/**
 * Port for the stored permission entries of every dataset.
 */
public interface PermissionRepositoryPort {

    /**
     * @param datasetId the dataset
     * @return the explicit entries of the dataset, empty if none
     */
    Set<PermissionEntry> entriesFor(DatasetId datasetId);

    /**
     * @param entry the entry to look for
     * @return true if exactly this entry is stored
     */
    default boolean contains(PermissionEntry entry) {
        return entriesFor(entry.datasetId()).contains(entry);
    }

    /**
     * Atomically replaces the complete entry set of one dataset. Readers observe either the old
     * or the new set, never a mix.
     *
     * @param datasetId the dataset
     * @param entries the new entry set; every entry must belong to the dataset
     * @throws IllegalArgumentException if an entry belongs to another dataset
     */
    void replaceEntries(DatasetId datasetId, Set<PermissionEntry> entries);
}
