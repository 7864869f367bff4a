package com.streamfirst.scidata.registry.adapters.state.file;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.streamfirst.scidata.registry.adapters.state.file.RegistryStateDocument.DatasetDocument;
import com.streamfirst.scidata.registry.adapters.state.file.RegistryStateDocument.LinkDocument;
import com.streamfirst.scidata.registry.adapters.state.file.RegistryStateDocument.PermissionDocument;
import com.streamfirst.scidata.registry.domain.Dataset;
import com.streamfirst.scidata.registry.domain.DatasetId;
import com.streamfirst.scidata.registry.domain.PermissionEntry;
import com.streamfirst.scidata.registry.domain.StorageException;
import com.streamfirst.scidata.registry.ports.DatasetRepositoryPort;
import com.streamfirst.scidata.registry.ports.PermissionRepositoryPort;
import com.streamfirst.scidata.registry.ports.VersionLinkRepositoryPort;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable implementation of the three registry state repositories backed by one JSON file.
 *
 * <p>The full state is held in memory and written after every mutation: first to a temporary file
 * next to the state file, which is then moved into place atomically, so a crash leaves either the
 * old or the new state on disk. If writing fails the in-memory change is rolled back and a
 * {@link StorageException} is raised. The state file is loaded when the store is opened.
 */
@Slf4j
public class JsonFileRegistryStore
    implements DatasetRepositoryPort, PermissionRepositoryPort, VersionLinkRepositoryPort {

    public static final String STATE_FILE_NAME = "registry-state.json";

    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Getter
    private final Path stateFile;

    private final Map<DatasetId, Dataset> datasets = new LinkedHashMap<>();
    private final Map<DatasetId, Set<PermissionEntry>> permissions = new LinkedHashMap<>();
    private final Map<DatasetId, DatasetId> predecessors = new LinkedHashMap<>();
    private final Map<DatasetId, DatasetId> successors = new HashMap<>();

    private JsonFileRegistryStore(Path stateFile) {
        this.stateFile = stateFile;
    }

    /**
     * Opens the store in a directory, creating the directory if needed and loading any existing
     * state file.
     *
     * @throws StorageException if the directory cannot be created or the state file cannot be read
     */
    public static JsonFileRegistryStore open(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException("Cannot create state directory " + directory, e);
        }
        JsonFileRegistryStore store = new JsonFileRegistryStore(directory.resolve(STATE_FILE_NAME));
        store.load();
        return store;
    }

    // --- DatasetRepositoryPort ---

    @Override
    public synchronized void save(Dataset dataset) {
        Dataset previous = datasets.put(dataset.getId(), dataset);
        persistOrRollback(() -> restore(datasets, dataset.getId(), previous));
        log.debug("Saved {}", dataset);
    }

    @Override
    public synchronized void delete(DatasetId id) {
        Dataset previous = datasets.remove(id);
        if (previous == null) {
            return;
        }
        persistOrRollback(() -> datasets.put(id, previous));
        log.debug("Deleted dataset {}", id);
    }

    @Override
    public synchronized Optional<Dataset> findById(DatasetId id) {
        return Optional.ofNullable(datasets.get(id));
    }

    @Override
    public synchronized List<Dataset> findAll() {
        return new ArrayList<>(datasets.values());
    }

    // --- PermissionRepositoryPort ---

    @Override
    public synchronized Set<PermissionEntry> entriesFor(DatasetId datasetId) {
        return permissions.getOrDefault(datasetId, Set.of());
    }

    @Override
    public synchronized void replaceEntries(DatasetId datasetId, Set<PermissionEntry> entries) {
        for (PermissionEntry entry : entries) {
            if (!entry.datasetId().equals(datasetId)) {
                throw new IllegalArgumentException(
                    "Entry " + entry + " does not belong to dataset " + datasetId);
            }
        }
        Set<PermissionEntry> previous = entries.isEmpty()
            ? permissions.remove(datasetId)
            : permissions.put(datasetId, Set.copyOf(entries));
        persistOrRollback(() -> restore(permissions, datasetId, previous));
        log.debug("Stored {} permission entries for dataset {}", entries.size(), datasetId);
    }

    // --- VersionLinkRepositoryPort ---

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
        persistOrRollback(() -> {
            predecessors.remove(successor);
            successors.remove(predecessor);
        });
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

    // --- persistence ---

    private void load() {
        if (!Files.exists(stateFile)) {
            log.info("No state file at {}, starting empty", stateFile);
            return;
        }
        RegistryStateDocument document;
        try {
            document = mapper.readValue(stateFile.toFile(), RegistryStateDocument.class);
        } catch (IOException e) {
            throw new StorageException("Cannot read state file " + stateFile, e);
        }
        if (document.formatVersion() > RegistryStateDocument.FORMAT_VERSION) {
            throw new StorageException("State file " + stateFile + " has unsupported format version "
                + document.formatVersion());
        }

        for (DatasetDocument dataset : nullToEmpty(document.datasets())) {
            Dataset restored = dataset.toDataset();
            datasets.put(restored.getId(), restored);
        }
        Map<DatasetId, Set<PermissionEntry>> loaded = new HashMap<>();
        for (PermissionDocument permission : nullToEmpty(document.permissions())) {
            PermissionEntry entry = permission.toEntry();
            loaded.computeIfAbsent(entry.datasetId(), k -> new HashSet<>()).add(entry);
        }
        loaded.forEach((id, entries) -> permissions.put(id, Set.copyOf(entries)));
        for (LinkDocument link : nullToEmpty(document.links())) {
            DatasetId successor = DatasetId.of(link.successor());
            DatasetId predecessor = DatasetId.of(link.predecessor());
            if (!datasets.containsKey(successor) || !datasets.containsKey(predecessor)) {
                log.warn("Dropping version link {} -> {} from {}: dataset record missing",
                         successor, predecessor, stateFile);
                continue;
            }
            predecessors.put(successor, predecessor);
            successors.put(predecessor, successor);
        }
        log.info("Loaded {} datasets, {} permission entries and {} version links from {}",
                 datasets.size(), permissions.values().stream().mapToInt(Set::size).sum(),
                 predecessors.size(), stateFile);
    }

    private void persistOrRollback(Runnable rollback) {
        try {
            write(snapshot());
        } catch (IOException e) {
            rollback.run();
            log.error("Failed to write state file {}", stateFile, e);
            throw new StorageException("Failed to write state file " + stateFile, e);
        }
    }

    private RegistryStateDocument snapshot() {
        List<PermissionDocument> permissionDocuments = new ArrayList<>();
        permissions.values().forEach(entries -> entries.forEach(e -> permissionDocuments.add(PermissionDocument.from(e))));
        List<LinkDocument> linkDocuments = new ArrayList<>();
        predecessors.forEach((successor, predecessor) ->
            linkDocuments.add(new LinkDocument(successor.value(), predecessor.value())));
        return new RegistryStateDocument(
            RegistryStateDocument.FORMAT_VERSION,
            datasets.values().stream().map(DatasetDocument::from).toList(),
            permissionDocuments,
            linkDocuments);
    }

    private void write(RegistryStateDocument document) throws IOException {
        Path temp = Files.createTempFile(stateFile.getParent(), STATE_FILE_NAME, ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(mapper.writeValueAsBytes(document));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(temp, stateFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static <K, V> void restore(Map<K, V> map, K key, V previous) {
        if (previous == null) {
            map.remove(key);
        } else {
            map.put(key, previous);
        }
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
