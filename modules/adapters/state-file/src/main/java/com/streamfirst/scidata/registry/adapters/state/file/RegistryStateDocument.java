package com.streamfirst.scidata.registry.adapters.state.file;

import com.streamfirst.scidata.registry.domain.ContainerType;
import com.streamfirst.scidata.registry.domain.ContentReference;
import com.streamfirst.scidata.registry.domain.Dataset;
import com.streamfirst.scidata.registry.domain.DatasetId;
import com.streamfirst.scidata.registry.domain.DatasetMetadata;
import com.streamfirst.scidata.registry.domain.FileEntry;
import com.streamfirst.scidata.registry.domain.Operation;
import com.streamfirst.scidata.registry.domain.PermissionEntry;
import com.streamfirst.scidata.registry.domain.Principal;

import java.time.Instant;
import java.util.List;

/**
 * On-disk layout of the registry state file. Kept separate from the domain types so that the
 * domain carries no serialization concerns.
 */
record RegistryStateDocument(
    int formatVersion,
    List<DatasetDocument> datasets,
    List<PermissionDocument> permissions,
    List<LinkDocument> links
) {
    static final int FORMAT_VERSION = 1;

    record DatasetDocument(
        String id,
        MetadataDocument metadata,
        String owner,
        long size,
        Instant uploadTime,
        Instant storageTime,
        boolean complete,
        String hash,
        String replaces,
        List<FileDocument> content,
        boolean invalidated
    ) {
        static DatasetDocument from(Dataset dataset) {
            return new DatasetDocument(
                dataset.getId().value(),
                MetadataDocument.from(dataset.getMetadata()),
                dataset.getOwner(),
                dataset.getSize(),
                dataset.getUploadTime(),
                dataset.getStorageTime(),
                dataset.isComplete(),
                dataset.getHash(),
                dataset.getReplaces() == null ? null : dataset.getReplaces().value(),
                dataset.getContent().stream().map(FileDocument::from).toList(),
                dataset.isInvalidated());
        }

        Dataset toDataset() {
            return Dataset.builder()
                .id(DatasetId.of(id))
                .metadata(metadata.toMetadata())
                .owner(owner)
                .size(size)
                .uploadTime(uploadTime)
                .storageTime(storageTime)
                .complete(complete)
                .hash(hash)
                .replaces(replaces == null ? null : DatasetId.of(replaces))
                .content(content == null ? List.of() : content.stream().map(FileDocument::toEntry).toList())
                .invalidated(invalidated)
                .build();
        }
    }

    record MetadataDocument(
        String containerId,
        String title,
        String author,
        String organization,
        String email,
        String comment,
        String description,
        String license,
        String doi,
        String timestamp,
        List<String> keywords,
        boolean staticContainer,
        String modelVersion,
        ContainerType containerType,
        Instant created,
        Instant modified
    ) {
        static MetadataDocument from(DatasetMetadata m) {
            return new MetadataDocument(
                m.getContainerId() == null ? null : m.getContainerId().value(),
                m.getTitle(), m.getAuthor(), m.getOrganization(), m.getEmail(), m.getComment(),
                m.getDescription(), m.getLicense(), m.getDoi(), m.getTimestamp(), m.getKeywords(),
                m.isStaticContainer(), m.getModelVersion(), m.getContainerType(), m.getCreated(),
                m.getModified());
        }

        DatasetMetadata toMetadata() {
            return DatasetMetadata.builder()
                .containerId(containerId == null ? null : DatasetId.of(containerId))
                .title(title)
                .author(author)
                .organization(organization)
                .email(email)
                .comment(comment)
                .description(description)
                .license(license)
                .doi(doi)
                .timestamp(timestamp)
                .keywords(keywords == null ? List.of() : List.copyOf(keywords))
                .staticContainer(staticContainer)
                .modelVersion(modelVersion)
                .containerType(containerType)
                .created(created)
                .modified(modified)
                .build();
        }
    }

    record FileDocument(String name, long size, String reference, String preview) {
        static FileDocument from(FileEntry entry) {
            return new FileDocument(entry.name(), entry.size(), entry.reference().key(), entry.preview());
        }

        FileEntry toEntry() {
            return new FileEntry(name, size, new ContentReference(reference), preview);
        }
    }

    record PermissionDocument(String dataset, Principal.Kind kind, String principal, Operation operation) {
        static PermissionDocument from(PermissionEntry entry) {
            return new PermissionDocument(entry.datasetId().value(), entry.principal().kind(),
                entry.principal().name(), entry.operation());
        }

        PermissionEntry toEntry() {
            return new PermissionEntry(DatasetId.of(dataset), new Principal(kind, principal), operation);
        }
    }

    record LinkDocument(String successor, String predecessor) {
    }
}
