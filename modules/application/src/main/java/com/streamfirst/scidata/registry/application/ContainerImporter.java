package com.streamfirst.scidata.registry.application;

import com.streamfirst.scidata.registry.domain.ContainerArchive;
import com.streamfirst.scidata.registry.domain.Dataset;
import com.streamfirst.scidata.registry.domain.DatasetId;
import com.streamfirst.scidata.registry.domain.Principal;
import com.streamfirst.scidata.registry.domain.ValidationException;
import com.streamfirst.scidata.registry.ports.ContainerReaderPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Imports a packaged container in one call: begins the upload with the container's declared
 * identifier and predecessor, stores every member and completes the dataset.
 *
 * <p>The archive itself is the trusted payload, so the completion digest is computed from the
 * member bytes. If a step after the upload start fails the dataset stays incomplete and the error
 * propagates. Importing the same container again resumes that upload when the requester owns it:
 * members already in the manifest are skipped and the rest are stored before completing.
 */
@Slf4j
@RequiredArgsConstructor
public class ContainerImporter {

    private final ContainerReaderPort reader;
    private final DatasetRegistry registry;
    private final HashVerifier hashVerifier;

    public Dataset importContainer(Principal requester, InputStream container) {
        ContainerArchive archive = reader.read(container);
        log.debug("Importing container '{}' with {} members for {}",
                  archive.metadata().getTitle(), archive.members().size(), requester);

        Optional<Dataset> resumable = Optional.ofNullable(archive.metadata().getContainerId())
            .flatMap(declared -> registry.findResumable(declared, requester));
        Dataset resumed = resumable.orElse(null);
        DatasetId id;
        if (resumed != null) {
            id = resumed.getId();
            if (!Objects.equals(resumed.getReplaces(), archive.replaces())) {
                throw new ValidationException("Container " + id + " declares predecessor " + archive.replaces()
                    + " but its unfinished upload replaces " + resumed.getReplaces());
            }
            log.info("Resuming import of dataset {}: {} of {} members already stored",
                     id, resumed.getContent().size(), archive.members().size());
        } else {
            id = registry.beginUpload(requester, archive.metadata(), archive.replaces());
        }

        Map<String, byte[]> payload = new LinkedHashMap<>();
        for (ContainerArchive.Member member : archive.members()) {
            byte[] bytes = member.bytes();
            payload.put(member.name(), bytes);
            if (resumed != null && resumed.file(member.name()).isPresent()) {
                continue;
            }
            registry.uploadFile(id, requester, member.name(), bytes, member.preview());
        }
        Dataset completed = registry.completeUpload(id, requester, hashVerifier.digestOf(payload));
        log.info("Imported container as dataset {}", id);
        return completed;
    }
}
