/*
 * Copyright (c) 2025 Vocab Numberer
 * Licensed under the Apache License, Version 2.0
 */
package com.vocab.numbering.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * External representation of a numberer.
 *
 * <p>Only the ordered values and the id offset are carried. The value-to-id
 * index of a numberer holds the same information and is rebuilt on import,
 * so it is never part of this shape.
 *
 * <h2>Wire shape</h2>
 * <pre>
 * { "values": ["hello", "world", "!"], "start_at": 13 }
 * </pre>
 *
 * @param values  values in id order
 * @param startAt id of the first value
 * @param <T>     value type
 */
@JsonPropertyOrder({"values", "start_at"})
public record SerializedNumberer<T>(
    @JsonProperty("values") List<T> values,
    @JsonProperty("start_at") int startAt
) implements Serializable {

    public SerializedNumberer {
        if (values == null) {
            throw new IllegalArgumentException("values must be present");
        }
        if (startAt < 0) {
            throw new IllegalArgumentException("start_at must be non-negative: " + startAt);
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                throw new IllegalArgumentException("values[" + i + "] is null");
            }
        }
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }
}
