package com.vocab.numbering.infra.codec;

import com.vocab.numbering.runtime.model.DuplicatePolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class CodecConfigTest {

    // Loads go through an explicit environment so exported NUMBERER_* variables cannot leak in
    private static final UnaryOperator<String> NO_ENVIRONMENT = name -> null;

    private static UnaryOperator<String> environment(Map<String, String> variables) {
        return variables::get;
    }

    @Test
    @DisplayName("Should default to compact JSON with last-wins duplicates")
    void shouldUseDefaults() {
        CodecConfig config = CodecConfig.defaults();

        assertThat(config.getFormat()).isEqualTo(CodecConfig.Format.JSON);
        assertThat(config.getDuplicatePolicy()).isEqualTo(DuplicatePolicy.LAST_WINS);
        assertThat(config.isPrettyPrint()).isFalse();
    }

    @Test
    @DisplayName("Should load numberer.properties from the classpath by default")
    void shouldLoadDefaultProperties() {
        assumeTrue(System.getenv(CodecConfig.ENV_FORMAT) == null
                && System.getenv(CodecConfig.ENV_DUPLICATE_POLICY) == null
                && System.getenv(CodecConfig.ENV_PRETTY_PRINT) == null,
                "NUMBERER_* environment variables are set");

        CodecConfig config = CodecConfig.loadDefault();

        assertThat(config.getFormat()).isEqualTo(CodecConfig.Format.JSON);
        assertThat(config.getDuplicatePolicy()).isEqualTo(DuplicatePolicy.REJECT);
        assertThat(config.isPrettyPrint()).isTrue();
    }

    @Test
    @DisplayName("Should load settings from a classpath properties file")
    void shouldLoadFromClasspath() {
        CodecConfig config = CodecConfig.loadFromProperties("numberer-test.properties", NO_ENVIRONMENT);

        assertThat(config.getFormat()).isEqualTo(CodecConfig.Format.CBOR);
        assertThat(config.getDuplicatePolicy()).isEqualTo(DuplicatePolicy.REJECT);
    }

    @Test
    @DisplayName("Should load settings from a file system properties file")
    void shouldLoadFromFileSystem() throws IOException {
        Path file = Files.createTempFile("numberer", ".properties");
        try {
            Files.writeString(file, "numberer.codec.pretty.print=true\n");

            CodecConfig config = CodecConfig.loadFromProperties(file.toString(), NO_ENVIRONMENT);

            assertThat(config.isPrettyPrint()).isTrue();
            assertThat(config.getFormat()).isEqualTo(CodecConfig.Format.JSON);
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    @DisplayName("Should not fall back to the file system when the classpath resource is empty")
    void shouldPreferEmptyClasspathResource() throws IOException {
        Path file = Path.of("numberer-shadowed.properties");
        try {
            Files.writeString(file, "numberer.codec.format=CBOR\n");

            CodecConfig config = CodecConfig.loadFromProperties("numberer-shadowed.properties", NO_ENVIRONMENT);

            assertThat(config.getFormat()).isEqualTo(CodecConfig.Format.JSON);
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    @DisplayName("Should ignore invalid enum values and keep the defaults")
    void shouldIgnoreInvalidValues() {
        CodecConfig config = CodecConfig.loadFromProperties("numberer-invalid.properties", NO_ENVIRONMENT);

        assertThat(config.getFormat()).isEqualTo(CodecConfig.Format.JSON);
        assertThat(config.getDuplicatePolicy()).isEqualTo(DuplicatePolicy.LAST_WINS);
        assertThat(config.isPrettyPrint()).isTrue();
    }

    @Test
    @DisplayName("Should fall back to defaults when no file is found")
    void shouldFallBackWhenMissing() {
        CodecConfig config = CodecConfig.loadFromProperties("does-not-exist.properties", NO_ENVIRONMENT);

        assertThat(config.getFormat()).isEqualTo(CodecConfig.Format.JSON);
        assertThat(config.getDuplicatePolicy()).isEqualTo(DuplicatePolicy.LAST_WINS);
    }

    @Test
    @DisplayName("Should let environment variables override the properties file")
    void shouldPreferEnvironmentOverProperties() {
        CodecConfig config = CodecConfig.loadFromProperties("numberer-test.properties",
                environment(Map.of(CodecConfig.ENV_DUPLICATE_POLICY, "last_wins")));

        assertThat(config.getFormat()).isEqualTo(CodecConfig.Format.CBOR);
        assertThat(config.getDuplicatePolicy()).isEqualTo(DuplicatePolicy.LAST_WINS);
    }

    @Test
    @DisplayName("Should apply environment variables in the builder")
    void shouldApplyEnvironmentInBuilder() {
        CodecConfig config = CodecConfig.builder(environment(Map.of(
                        CodecConfig.ENV_FORMAT, " cbor ",
                        CodecConfig.ENV_DUPLICATE_POLICY, "REJECT")))
                .build();

        assertThat(config.getFormat()).isEqualTo(CodecConfig.Format.CBOR);
        assertThat(config.getDuplicatePolicy()).isEqualTo(DuplicatePolicy.REJECT);
        assertThat(config.isPrettyPrint()).isFalse();
    }

    @Test
    @DisplayName("Should let explicit builder calls override environment variables")
    void shouldPreferBuilderCallsOverEnvironment() {
        CodecConfig config = CodecConfig.builder(environment(Map.of(
                        CodecConfig.ENV_FORMAT, "CBOR",
                        CodecConfig.ENV_PRETTY_PRINT, "false")))
                .format(CodecConfig.Format.JSON)
                .prettyPrint(true)
                .build();

        assertThat(config.getFormat()).isEqualTo(CodecConfig.Format.JSON);
        assertThat(config.isPrettyPrint()).isTrue();
    }

    @Test
    @DisplayName("Should ignore invalid environment values")
    void shouldIgnoreInvalidEnvironmentValues() {
        CodecConfig config = CodecConfig.builder(environment(Map.of(
                        CodecConfig.ENV_FORMAT, "YAML",
                        CodecConfig.ENV_DUPLICATE_POLICY, "FIRST_WINS")))
                .build();

        assertThat(config.getFormat()).isEqualTo(CodecConfig.Format.JSON);
        assertThat(config.getDuplicatePolicy()).isEqualTo(DuplicatePolicy.LAST_WINS);
    }

    @Test
    @DisplayName("Should reject pretty printing for binary formats")
    void shouldRejectPrettyCbor() {
        CodecConfig.Builder builder = CodecConfig.defaults().toBuilder()
                .format(CodecConfig.Format.CBOR)
                .prettyPrint(true);

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("CBOR");
    }

    @Test
    @DisplayName("Should reject missing settings")
    void shouldRejectMissingSettings() {
        assertThatThrownBy(() -> CodecConfig.defaults().toBuilder().duplicatePolicy(null).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CodecConfig.defaults().toBuilder().format(null).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should copy every setting through toBuilder")
    void shouldCopyThroughToBuilder() {
        CodecConfig original = CodecConfig.defaults().toBuilder()
                .duplicatePolicy(DuplicatePolicy.REJECT)
                .prettyPrint(true)
                .build();

        CodecConfig copy = original.toBuilder().build();

        assertThat(copy.getDuplicatePolicy()).isEqualTo(DuplicatePolicy.REJECT);
        assertThat(copy.isPrettyPrint()).isTrue();
        assertThat(copy.toString()).contains("REJECT");
    }
}
