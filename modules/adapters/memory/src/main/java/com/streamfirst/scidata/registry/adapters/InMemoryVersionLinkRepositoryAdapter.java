package com.streamfirst.scidata.registry.adapters;

import com.streamfirst.scidata.registry.domain.DatasetId;
import com.streamfirst.scidata.registry.ports.VersionLinkRepositoryPort;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of VersionLinkRepositoryPort keeping a forward and a backward index.
 * Both indexes change together under the adapter's monitor.
 */
@Slf4j
public class InMemoryVersionLinkRepositoryAdapter implements VersionLinkRepositoryPort {

    // successor -> predecessor
    private final Map<DatasetId, DatasetId> predecessors = new HashMap<>();

    // predecessor -> successor
    private final Map<DatasetId, DatasetId> successors = new HashMap<>();

    @Override
    public synchronized void link(DatasetId successor, DatasetId predecessor) {
        if (predecessors.containsKey(successor)) {
            throw new IllegalStateException(
                "Dataset " + successor + " already replaces " + predecessors.get(successor));
        }
        if (successors.containsKey(predecessor)) {
            throw new IllegalStateException(
                "Dataset " + predecessor + " is already replaced by " + successors.get(predecessor));
        }
        predecessors.put(successor, predecessor);
        successors.put(predecessor, successor);
        log.debug("Linked {} -> {}", successor, predecessor);
    }

    @Override
    public synchronized Optional<DatasetId> predecessorOf(DatasetId id) {
        return Optional.ofNullable(predecessors.get(id));
    }

    @Override
    public synchronized Optional<DatasetId> successorOf(DatasetId id) {
        return Optional.ofNullable(successors.get(id));
    }
}
