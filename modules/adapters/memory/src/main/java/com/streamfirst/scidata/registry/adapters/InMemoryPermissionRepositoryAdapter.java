package com.streamfirst.scidata.registry.adapters;

import com.streamfirst.scidata.registry.domain.DatasetId;
import com.streamfirst.scidata.registry.domain.PermissionEntry;
import com.streamfirst.scidata.registry.ports.PermissionRepositoryPort;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of PermissionRepositoryPort.
 * Each dataset's entries are held as one immutable set that is swapped as a whole.
 */
@Slf4j
public class InMemoryPermissionRepositoryAdapter implements PermissionRepositoryPort {

    private final Map<DatasetId, Set<PermissionEntry>> entries = new ConcurrentHashMap<>();

    @Override
    public Set<PermissionEntry> entriesFor(DatasetId datasetId) {
        return entries.getOrDefault(datasetId, Set.of());
    }

    @Override
    public void replaceEntries(DatasetId datasetId, Set<PermissionEntry> newEntries) {
        for (PermissionEntry entry : newEntries) {
            if (!entry.datasetId().equals(datasetId)) {
                throw new IllegalArgumentException(
                    "Entry " + entry + " does not belong to dataset " + datasetId);
            }
        }
        if (newEntries.isEmpty()) {
            entries.remove(datasetId);
        } else {
            entries.put(datasetId, Set.copyOf(newEntries));
        }
        log.debug("Stored {} permission entries for dataset {}", newEntries.size(), datasetId);
    }
}
