/*
 * Copyright (c) 2025 Vocab Numberer
 * Licensed under the Apache License, Version 2.0
 */
package com.vocab.numbering.infra.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.cfg.MapperBuilder;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.vocab.numbering.api.exceptions.NumbererSerializationException;
import com.vocab.numbering.api.model.SerializedNumberer;
import com.vocab.numbering.runtime.model.Numberer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads and writes numberers in their {@link SerializedNumberer} shape.
 *
 * <p>Only {@code values} and {@code start_at} travel; the value-to-id index is
 * rebuilt by {@link Numberer#fromSerialized(SerializedNumberer, com.vocab.numbering.runtime.model.DuplicatePolicy)}
 * using the configured duplicate policy.
 *
 * <p>Payloads with missing, unknown, repeated or mistyped fields are refused,
 * and scalars are never coerced between types. Every codec or I/O failure
 * surfaces as a {@link NumbererSerializationException}.
 *
 * <h2>Thread Safety</h2>
 * <p>Instances are immutable after construction and may be shared.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * NumbererCodec codec = NumbererCodec.json();
 * byte[] bytes = codec.encode(labels);
 * Numberer<String> restored = codec.decode(bytes, String.class);
 * }</pre>
 */
public final class NumbererCodec {
    private static final Logger logger = Logger.getLogger(NumbererCodec.class.getName());

    private final CodecConfig config;
    private final ObjectMapper objectMapper;

    public NumbererCodec(CodecConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.objectMapper = createMapper(config);
        logger.fine("NumbererCodec initialized: " + config);
    }

    public static NumbererCodec json() {
        return new NumbererCodec(CodecConfig.defaults());
    }

    public static NumbererCodec cbor() {
        return new NumbererCodec(CodecConfig.defaults().toBuilder()
                .format(CodecConfig.Format.CBOR)
                .build());
    }

    public CodecConfig getConfig() {
        return config;
    }

    /**
     * Encodes a numberer into the configured format.
     *
     * @param numberer the numberer to encode
     * @return the encoded payload
     */
    public byte[] encode(Numberer<?> numberer) {
        Objects.requireNonNull(numberer, "numberer");
        try {
            byte[] bytes = objectMapper.writeValueAsBytes(numberer.toSerialized());
            logger.fine(() -> "Encoded " + numberer.values().size() + " values as " + bytes.length
                    + " " + config.getFormat() + " bytes");
            return bytes;
        } catch (IOException e) {
            throw new NumbererSerializationException("Failed to encode numberer", e);
        }
    }

    /**
     * Writes a numberer to a stream. The stream is flushed but left open.
     */
    public void write(Numberer<?> numberer, OutputStream out) {
        Objects.requireNonNull(numberer, "numberer");
        Objects.requireNonNull(out, "out");
        try {
            objectMapper.writeValue(out, numberer.toSerialized());
        } catch (IOException e) {
            throw new NumbererSerializationException("Failed to write numberer", e);
        }
    }

    public <T> Numberer<T> decode(byte[] payload, Class<T> valueType) {
        return decode(payload, objectMapper.constructType(valueType));
    }

    /**
     * Decodes a payload whose values have a generic type, e.g. {@code List<String>}.
     *
     * @param payload   the encoded numberer
     * @param valueType Jackson type of a single value
     * @return the restored numberer
     */
    public <T> Numberer<T> decode(byte[] payload, JavaType valueType) {
        Objects.requireNonNull(payload, "payload");
        SerializedNumberer<T> serialized;
        try {
            serialized = objectMapper.readValue(payload, serializedType(valueType));
        } catch (IOException e) {
            logger.log(Level.FINE, "Rejected numberer payload", e);
            throw new NumbererSerializationException("Malformed numberer payload: " + describe(e), e);
        }
        return restore(serialized);
    }

    /**
     * Reads a numberer from a stream. The stream is left open.
     */
    public <T> Numberer<T> read(InputStream in, Class<T> valueType) {
        Objects.requireNonNull(in, "in");
        SerializedNumberer<T> serialized;
        try {
            serialized = objectMapper.readValue(in, serializedType(objectMapper.constructType(valueType)));
        } catch (IOException e) {
            logger.log(Level.FINE, "Rejected numberer stream", e);
            throw new NumbererSerializationException("Malformed numberer payload: " + describe(e), e);
        }
        return restore(serialized);
    }

    /**
     * @return the Jackson type of {@code SerializedNumberer<valueType>}
     */
    public JavaType serializedType(JavaType valueType) {
        return objectMapper.getTypeFactory().constructParametricType(SerializedNumberer.class, valueType);
    }

    private <T> Numberer<T> restore(SerializedNumberer<T> serialized) {
        Numberer<T> numberer = Numberer.fromSerialized(serialized, config.getDuplicatePolicy());
        logger.fine(() -> "Decoded numberer: start_at=" + numberer.startAt() + ", size=" + numberer.size());
        return numberer;
    }

    private static String describe(IOException e) {
        if (e instanceof JsonProcessingException jpe) {
            return jpe.getOriginalMessage();
        }
        return e.getMessage();
    }

    private static ObjectMapper createMapper(CodecConfig config) {
        MapperBuilder<?, ?> builder = switch (config.getFormat()) {
            case JSON -> JsonMapper.builder();
            case CBOR -> CBORMapper.builder();
        };
        builder.enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES);
        builder.enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
        builder.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        // Mistyped scalars fail instead of being coerced: "13" or 13.7 for start_at, 1 or true for a string value
        builder.disable(MapperFeature.ALLOW_COERCION_OF_SCALARS);
        builder.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        builder.withCoercionConfig(LogicalType.Textual, textual -> textual
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail));
        builder.enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION);

        builder.disable(StreamWriteFeature.AUTO_CLOSE_TARGET);
        builder.disable(StreamReadFeature.AUTO_CLOSE_SOURCE);
        if (config.isPrettyPrint()) {
            builder.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return builder.build();
    }
}
