package com.streamfirst.scidata.registry.adapters;

import com.streamfirst.scidata.registry.domain.Dataset;
import com.streamfirst.scidata.registry.domain.DatasetId;
import com.streamfirst.scidata.registry.ports.DatasetRepositoryPort;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of DatasetRepositoryPort for testing and development.
 * Snapshots are immutable, so storing the reference is enough.
 * Data is lost when the application stops - not suitable for production use.
 */
@Slf4j
public class InMemoryDatasetRepositoryAdapter implements DatasetRepositoryPort {

    private final Map<DatasetId, Dataset> datasets = new ConcurrentHashMap<>();

    @Override
    public void save(Dataset dataset) {
        datasets.put(dataset.getId(), dataset);
        log.debug("Saved {}", dataset);
    }

    @Override
    public void delete(DatasetId id) {
        if (datasets.remove(id) != null) {
            log.debug("Deleted dataset {}", id);
        }
    }

    @Override
    public Optional<Dataset> findById(DatasetId id) {
        return Optional.ofNullable(datasets.get(id));
    }

    @Override
    public List<Dataset> findAll() {
        return new ArrayList<>(datasets.values());
    }
}
