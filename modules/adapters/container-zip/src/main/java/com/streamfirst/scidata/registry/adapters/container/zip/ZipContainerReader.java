package com.streamfirst.scidata.registry.adapters.container.zip;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.scidata.registry.domain.ContainerArchive;
import com.streamfirst.scidata.registry.domain.ContainerType;
import com.streamfirst.scidata.registry.domain.DatasetId;
import com.streamfirst.scidata.registry.domain.DatasetMetadata;
import com.streamfirst.scidata.registry.domain.ValidationException;
import com.streamfirst.scidata.registry.ports.ContainerReaderPort;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Reads ZIP based scientific data containers.
 *
 * <p>A container holds {@code content.json} (identity and format bookkeeping), {@code meta.json}
 * (descriptive metadata) and any number of payload files. Every member, the two JSON files
 * included, becomes a manifest entry; JSON members up to {@link #MAX_PREVIEW_BYTES} keep their
 * text as inline preview.
 */
@Slf4j
public class ZipContainerReader implements ContainerReaderPort {

    public static final String CONTENT_JSON = "content.json";
    public static final String META_JSON = "meta.json";
    public static final int MAX_PREVIEW_BYTES = 64 * 1024;

    private static final byte[] ZIP_MAGIC = {'P', 'K', 3, 4};
    private static final byte[] HDF5_MAGIC = {(byte) 0x89, 'H', 'D', 'F', '\r', '\n', 0x1a, '\n'};

    private static final DateTimeFormatter SPACED_WITH_ZONE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public ContainerArchive read(InputStream container) {
        byte[] bytes;
        try {
            bytes = container.readAllBytes();
        } catch (IOException e) {
            throw new ValidationException("Cannot read container", e);
        }
        if (startsWith(bytes, HDF5_MAGIC)) {
            throw new ValidationException("HDF5 containers are not supported yet");
        }
        if (!startsWith(bytes, ZIP_MAGIC)) {
            throw new ValidationException("Container format must be zip");
        }

        Map<String, byte[]> members = unzip(bytes);
        JsonNode content = parseJson(members, CONTENT_JSON);
        JsonNode meta = parseJson(members, META_JSON);

        DatasetMetadata metadata = DatasetMetadata.builder()
            .containerId(optionalText(content, "uuid") == null ? null : DatasetId.of(optionalText(content, "uuid")))
            .modelVersion(optionalText(content, "modelVersion"))
            .containerType(containerType(content.get("containerType")))
            .created(timestamp(content, "created"))
            .modified(timestamp(content, "modified"))
            .staticContainer(content.path("static").asBoolean(false))
            .title(optionalText(meta, "title"))
            .author(optionalText(meta, "author"))
            .organization(optionalText(meta, "organization"))
            .email(optionalText(meta, "email"))
            .comment(optionalText(meta, "comment"))
            .description(optionalText(meta, "description"))
            .license(optionalText(meta, "license"))
            .doi(optionalText(meta, "doi"))
            .timestamp(optionalText(meta, "timestamp"))
            .keywords(keywords(meta.get("keywords")))
            .build();
        String replaces = optionalText(content, "replaces");

        List<ContainerArchive.Member> archiveMembers = new ArrayList<>();
        members.forEach((name, data) -> archiveMembers.add(new ContainerArchive.Member(name, data, preview(name, data))));
        log.debug("Read container {} with {} members", metadata.getContainerId(), archiveMembers.size());
        return new ContainerArchive(metadata, replaces == null ? null : DatasetId.of(replaces), archiveMembers);
    }

    private static Map<String, byte[]> unzip(byte[] bytes) {
        Map<String, byte[]> members = new LinkedHashMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bytes))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                if (members.put(entry.getName(), zip.readAllBytes()) != null) {
                    throw new ValidationException("Container has duplicate member " + entry.getName());
                }
            }
        } catch (IOException e) {
            throw new ValidationException("Malformed zip container: " + e.getMessage(), e);
        }
        return members;
    }

    private JsonNode parseJson(Map<String, byte[]> members, String name) {
        byte[] data = members.get(name);
        if (data == null) {
            throw new ValidationException("Container has no " + name);
        }
        try {
            JsonNode node = mapper.readTree(data);
            if (node == null || !node.isObject()) {
                throw new ValidationException(name + " must contain a JSON object");
            }
            return node;
        } catch (IOException e) {
            throw new ValidationException("Malformed " + name + ": " + e.getMessage(), e);
        }
    }

    private static String preview(String name, byte[] data) {
        if (!name.endsWith(".json") || data.length > MAX_PREVIEW_BYTES) {
            return null;
        }
        return new String(data, StandardCharsets.UTF_8);
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    private static ContainerType containerType(JsonNode node) {
        if (node == null || !node.isObject() || optionalText(node, "name") == null) {
            return null;
        }
        return new ContainerType(optionalText(node, "name"), optionalText(node, "version"), optionalText(node, "id"));
    }

    private static List<String> keywords(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> keywords = new ArrayList<>();
        node.forEach(keyword -> keywords.add(keyword.asText()));
        return keywords;
    }

    /**
     * Accepts ISO 8601 with or without offset (the latter read as UTC) and
     * {@code yyyy-MM-dd HH:mm:ss zone}.
     */
    static Instant parseTimestamp(String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            log.trace("'{}' is not an offset date-time", text);
        }
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.trace("'{}' is not a local date-time", text);
        }
        try {
            return ZonedDateTime.parse(text, SPACED_WITH_ZONE).toInstant();
        } catch (DateTimeParseException e) {
            throw new ValidationException("Unrecognized timestamp '" + text + "'", e);
        }
    }

    private static Instant timestamp(JsonNode node, String field) {
        String text = optionalText(node, field);
        return text == null ? null : parseTimestamp(text);
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        return data.length >= prefix.length && Arrays.equals(data, 0, prefix.length, prefix, 0, prefix.length);
    }
}
