package com.streamfirst.scidata.registry.application;

import com.streamfirst.scidata.registry.domain.ContainerType;
import com.streamfirst.scidata.registry.domain.DatasetMetadata;
import com.streamfirst.scidata.registry.domain.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static com.streamfirst.scidata.registry.application.RegistryFixture.metadata;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetadataValidatorTest {

    private final MetadataValidator validator = new MetadataValidator();

    @Test
    void acceptsCompleteMetadata() {
        DatasetMetadata md = metadata("frames").toBuilder()
            .doi("10.5281/zenodo.1")
            .license("CC-BY-4.0")
            .keywords(List.of("optics", "camera"))
            .build();

        DatasetMetadata validated = validator.validate(md);

        assertThat(validated.getDoi()).isEqualTo("10.5281/zenodo.1");
        assertThat(validated.getKeywords()).containsExactly("optics", "camera");
    }

    @ParameterizedTest
    @ValueSource(strings = {"0.3", "0.4", "0.5.1"})
    void keepsPublicationFieldsForEverySupportedModel(String version) {
        DatasetMetadata md = metadata("frames").toBuilder()
            .modelVersion(version)
            .doi("10.5281/zenodo.1")
            .license("MIT")
            .timestamp("2020-01-01")
            .build();

        DatasetMetadata validated = validator.validate(md);

        assertThat(validated.getDoi()).isEqualTo("10.5281/zenodo.1");
        assertThat(validated.getLicense()).isEqualTo("MIT");
        assertThat(validated.getTimestamp()).isEqualTo("2020-01-01");
        assertThat(validated.getTitle()).isEqualTo("frames");
    }

    @ParameterizedTest
    @ValueSource(strings = {"0.2", "0.2.9", "0.1"})
    void rejectsUnsupportedModelVersions(String version) {
        assertThatThrownBy(() -> validator.validate(metadata("frames").toBuilder().modelVersion(version).build()))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("not supported");
    }

    @Test
    void minimumModelVersionIsAccepted() {
        assertThat(validator.validate(metadata("frames").toBuilder().modelVersion("0.3").build()).getModelVersion())
            .isEqualTo("0.3");
    }

    @Test
    void rejectsMissingOrMalformedModelVersion() {
        assertThatThrownBy(() -> validator.validate(metadata("frames").toBuilder().modelVersion(null).build()))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.validate(metadata("frames").toBuilder().modelVersion("zero.five").build()))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void requiresCoreAttributes() {
        assertThatThrownBy(() -> validator.validate(metadata(" ")))
            .isInstanceOf(ValidationException.class).hasMessageContaining("title");
        assertThatThrownBy(() -> validator.validate(metadata("frames").toBuilder().author(null).build()))
            .isInstanceOf(ValidationException.class).hasMessageContaining("author");
        assertThatThrownBy(() -> validator.validate(metadata("frames").toBuilder().containerType(null).build()))
            .isInstanceOf(ValidationException.class).hasMessageContaining("containerType");
        assertThatThrownBy(() -> validator.validate(
                metadata("frames").toBuilder().containerType(new ContainerType(" ", "1.0", null)).build()))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void emailMustLookLikeAnAddress() {
        assertThatThrownBy(() -> validator.validate(metadata("frames").toBuilder().email("ada.example.org").build()))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("e-mail");
    }

    @Test
    void keywordsMustNotBeBlank() {
        DatasetMetadata md = metadata("frames").toBuilder().keywords(Arrays.asList("optics", " ")).build();

        assertThatThrownBy(() -> validator.validate(md)).isInstanceOf(ValidationException.class);
    }
}
