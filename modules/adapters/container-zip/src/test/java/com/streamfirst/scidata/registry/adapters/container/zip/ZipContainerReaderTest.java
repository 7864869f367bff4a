package com.streamfirst.scidata.registry.adapters.container.zip;

import com.streamfirst.scidata.registry.domain.ContainerArchive;
import com.streamfirst.scidata.registry.domain.ContainerType;
import com.streamfirst.scidata.registry.domain.DatasetId;
import com.streamfirst.scidata.registry.domain.DatasetMetadata;
import com.streamfirst.scidata.registry.domain.ValidationException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZipContainerReaderTest {

    private static final String CONTENT = """
        {
          "uuid": "5b0c1c1e-7a6e-4f35-9d57-6b3c0f6a2d11",
          "replaces": "11111111-2222-3333-4444-555555555555",
          "modelVersion": "0.5.1",
          "containerType": {"name": "camera-frame", "version": "1.0", "id": "cf-1"},
          "created": "2024-03-01T10:00:00Z",
          "modified": "2024-03-01 11:00:00 UTC",
          "static": true
        }
        """;

    private static final String META = """
        {
          "title": "Frames of run 7",
          "author": "Ada Author",
          "email": "ada@example.org",
          "organization": "Optics Lab",
          "doi": "10.5281/zenodo.1",
          "keywords": ["optics", "camera"]
        }
        """;

    private final ZipContainerReader reader = new ZipContainerReader();

    private static byte[] zip(Map<String, String> members) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, String> member : members.entrySet()) {
                zip.putNextEntry(new ZipEntry(member.getKey()));
                zip.write(member.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return out.toByteArray();
    }

    private static Map<String, String> container() {
        Map<String, String> members = new LinkedHashMap<>();
        members.put(ZipContainerReader.CONTENT_JSON, CONTENT);
        members.put(ZipContainerReader.META_JSON, META);
        members.put("data/frame.bin", "0123456789");
        return members;
    }

    @Test
    void readsMetadataAndMembers() throws IOException {
        ContainerArchive archive = reader.read(new ByteArrayInputStream(zip(container())));

        DatasetMetadata md = archive.metadata();
        assertThat(md.getContainerId()).isEqualTo(DatasetId.of("5b0c1c1e-7a6e-4f35-9d57-6b3c0f6a2d11"));
        assertThat(md.getModelVersion()).isEqualTo("0.5.1");
        assertThat(md.getContainerType()).isEqualTo(new ContainerType("camera-frame", "1.0", "cf-1"));
        assertThat(md.getCreated()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(md.getModified()).isEqualTo(Instant.parse("2024-03-01T11:00:00Z"));
        assertThat(md.isStaticContainer()).isTrue();
        assertThat(md.getTitle()).isEqualTo("Frames of run 7");
        assertThat(md.getOrganization()).isEqualTo("Optics Lab");
        assertThat(md.getDoi()).isEqualTo("10.5281/zenodo.1");
        assertThat(md.getLicense()).isNull();
        assertThat(md.getKeywords()).containsExactly("optics", "camera");
        assertThat(archive.replaces()).isEqualTo(DatasetId.of("11111111-2222-3333-4444-555555555555"));

        assertThat(archive.members()).extracting(ContainerArchive.Member::name)
            .containsExactly("content.json", "meta.json", "data/frame.bin");
        assertThat(archive.members().get(0).preview()).isEqualTo(CONTENT);
        assertThat(archive.members().get(2).preview()).isNull();
        assertThat(archive.members().get(2).bytes()).hasSize(10);
    }

    @Test
    void containerWithoutIdentityStillReads() throws IOException {
        Map<String, String> members = container();
        members.put(ZipContainerReader.CONTENT_JSON, "{\"modelVersion\": \"0.4\"}");

        ContainerArchive archive = reader.read(new ByteArrayInputStream(zip(members)));

        assertThat(archive.metadata().getContainerId()).isNull();
        assertThat(archive.metadata().getContainerType()).isNull();
        assertThat(archive.replaces()).isNull();
    }

    @Test
    void missingContentJsonIsRejected() throws IOException {
        Map<String, String> members = container();
        members.remove(ZipContainerReader.CONTENT_JSON);

        assertThatThrownBy(() -> reader.read(new ByteArrayInputStream(zip(members))))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Container has no content.json");
    }

    @Test
    void malformedJsonIsRejected() throws IOException {
        Map<String, String> members = container();
        members.put(ZipContainerReader.META_JSON, "[1, 2]");

        assertThatThrownBy(() -> reader.read(new ByteArrayInputStream(zip(members))))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("JSON object");
    }

    @Test
    void hdf5IsNotSupportedYet() {
        byte[] hdf5 = {(byte) 0x89, 'H', 'D', 'F', '\r', '\n', 0x1a, '\n', 0, 0};

        assertThatThrownBy(() -> reader.read(new ByteArrayInputStream(hdf5)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("HDF5");
    }

    @Test
    void otherFormatsAreRejected() {
        byte[] text = "just some text".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> reader.read(new ByteArrayInputStream(text)))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Container format must be zip");
    }

    @Test
    void timestampFormats() {
        Instant expected = Instant.parse("2024-03-01T10:00:00Z");

        assertThat(ZipContainerReader.parseTimestamp("2024-03-01T10:00:00Z")).isEqualTo(expected);
        assertThat(ZipContainerReader.parseTimestamp("2024-03-01T12:00:00+02:00")).isEqualTo(expected);
        assertThat(ZipContainerReader.parseTimestamp("2024-03-01T10:00:00")).isEqualTo(expected);
        assertThat(ZipContainerReader.parseTimestamp("2024-03-01 10:00:00 UTC")).isEqualTo(expected);
        assertThatThrownBy(() -> ZipContainerReader.parseTimestamp("yesterday"))
            .isInstanceOf(ValidationException.class);
    }
}
