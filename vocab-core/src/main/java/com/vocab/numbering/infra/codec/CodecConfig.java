package com.vocab.numbering.infra.codec;

import com.vocab.numbering.runtime.model.DuplicatePolicy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Configuration for {@link NumbererCodec}.
 *
 * <p><b>Environment Variable Override:</b>
 * <pre>
 * NUMBERER_CODEC_FORMAT=CBOR
 * NUMBERER_DUPLICATE_POLICY=REJECT
 * NUMBERER_PRETTY_PRINT=true
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * // Defaults, environment ignored
 * CodecConfig config = CodecConfig.defaults();
 *
 * // numberer.properties from the classpath, env vars on top
 * CodecConfig config = CodecConfig.loadDefault();
 *
 * CodecConfig config = CodecConfig.builder()
 *     .format(CodecConfig.Format.CBOR)
 *     .duplicatePolicy(DuplicatePolicy.REJECT)
 *     .build();
 * }</pre>
 */
public final class CodecConfig {

    private static final Logger logger = Logger.getLogger(CodecConfig.class.getName());

    static final String ENV_FORMAT = "NUMBERER_CODEC_FORMAT";
    static final String ENV_DUPLICATE_POLICY = "NUMBERER_DUPLICATE_POLICY";
    static final String ENV_PRETTY_PRINT = "NUMBERER_PRETTY_PRINT";

    static final String PROP_FORMAT = "numberer.codec.format";
    static final String PROP_DUPLICATE_POLICY = "numberer.codec.duplicate.policy";
    static final String PROP_PRETTY_PRINT = "numberer.codec.pretty.print";

    static final String DEFAULT_PROPERTIES = "numberer.properties";

    /**
     * Supported wire formats.
     */
    public enum Format {
        /** Text, via jackson-databind */
        JSON,

        /** Binary, via jackson-dataformat-cbor */
        CBOR
    }

    private final Format format;
    private final DuplicatePolicy duplicatePolicy;
    private final boolean prettyPrint;

    private CodecConfig(Builder builder) {
        this.format = builder.format;
        this.duplicatePolicy = builder.duplicatePolicy;
        this.prettyPrint = builder.prettyPrint;
        validate();
    }

    /**
     * JSON, last-wins duplicates, compact output. Environment variables are not consulted.
     */
    public static CodecConfig defaults() {
        return new Builder(null).build();
    }

    /**
     * Load configuration from {@code numberer.properties} in the classpath root.
     * Falls back to defaults if the file is not found.
     */
    public static CodecConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    /**
     * Load configuration from a properties file, searched for first in the
     * classpath and then on the file system. Environment variables override
     * the file.
     *
     * @param propertiesPath path to properties file
     * @return configuration loaded from the file
     */
    public static CodecConfig loadFromProperties(String propertiesPath) {
        return loadFromProperties(propertiesPath, System::getenv);
    }

    static CodecConfig loadFromProperties(String propertiesPath, UnaryOperator<String> environment) {
        logger.info("Loading codec configuration from: " + propertiesPath);

        Builder builder = new Builder(null);
        builder.applyProperties(readProperties(propertiesPath));
        builder.applyEnvironment(environment);
        return builder.build();
    }

    /**
     * Builder with defaults and environment variable overrides applied.
     */
    public static Builder builder() {
        return builder(System::getenv);
    }

    static Builder builder(UnaryOperator<String> environment) {
        return new Builder(environment);
    }

    private static Properties readProperties(String propertiesPath) {
        Properties props = new Properties();

        // A classpath resource, even an empty one, shadows a file of the same name
        try (InputStream is = CodecConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
                return props;
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read classpath resource: " + propertiesPath + ". Using defaults.", e);
            return new Properties();
        }

        Path file = Path.of(propertiesPath);
        if (!Files.isRegularFile(file)) {
            logger.warning("Properties file not found: " + propertiesPath + ". Using defaults.");
            return props;
        }
        try (InputStream is = Files.newInputStream(file)) {
            props.load(is);
            logger.info("Loaded " + props.size() + " properties from file: " + file.toAbsolutePath());
            return props;
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read properties file: " + propertiesPath + ". Using defaults.", e);
            return new Properties();
        }
    }

    public Builder toBuilder() {
        return new Builder(null)
                .format(format)
                .duplicatePolicy(duplicatePolicy)
                .prettyPrint(prettyPrint);
    }

    public Format getFormat() {
        return format;
    }

    public DuplicatePolicy getDuplicatePolicy() {
        return duplicatePolicy;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    private void validate() {
        if (format == null) {
            throw new IllegalArgumentException("format must be set");
        }
        if (duplicatePolicy == null) {
            throw new IllegalArgumentException("duplicatePolicy must be set");
        }
        if (prettyPrint && format != Format.JSON) {
            throw new IllegalArgumentException("prettyPrint is only supported for JSON, not " + format);
        }
    }

    @Override
    public String toString() {
        return "CodecConfig{format=" + format
                + ", duplicatePolicy=" + duplicatePolicy
                + ", prettyPrint=" + prettyPrint + "}";
    }

    public static final class Builder {

        private Format format = Format.JSON;
        private DuplicatePolicy duplicatePolicy = DuplicatePolicy.LAST_WINS;
        private boolean prettyPrint = false;

        private Builder(UnaryOperator<String> environment) {
            if (environment != null) {
                applyEnvironment(environment);
            }
        }

        public Builder format(Format format) {
            this.format = format;
            return this;
        }

        public Builder duplicatePolicy(DuplicatePolicy duplicatePolicy) {
            this.duplicatePolicy = duplicatePolicy;
            return this;
        }

        public Builder prettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
            return this;
        }

        public CodecConfig build() {
            return new CodecConfig(this);
        }

        void applyProperties(Properties props) {
            apply(props.getProperty(PROP_FORMAT), props.getProperty(PROP_DUPLICATE_POLICY),
                    props.getProperty(PROP_PRETTY_PRINT), "properties");
        }

        void applyEnvironment(UnaryOperator<String> environment) {
            apply(environment.apply(ENV_FORMAT), environment.apply(ENV_DUPLICATE_POLICY),
                    environment.apply(ENV_PRETTY_PRINT), "environment");
        }

        private void apply(String formatValue, String policyValue, String prettyValue, String source) {
            if (formatValue != null) {
                try {
                    format = Format.valueOf(formatValue.trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    logger.warning("Invalid codec format in " + source + ": " + formatValue);
                }
            }
            if (policyValue != null) {
                try {
                    duplicatePolicy = DuplicatePolicy.valueOf(policyValue.trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    logger.warning("Invalid duplicate policy in " + source + ": " + policyValue);
                }
            }
            if (prettyValue != null) {
                prettyPrint = Boolean.parseBoolean(prettyValue.trim());
            }
        }
    }
}
