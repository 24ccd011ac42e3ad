/*
 * Copyright (c) 2025 Vocab Numberer
 * Licensed under the Apache License, Version 2.0
 */
package com.vocab.numbering.runtime.model;

import com.vocab.numbering.api.INumberer;
import com.vocab.numbering.api.exceptions.NumbererSerializationException;
import com.vocab.numbering.api.model.SerializedNumberer;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Numberer for categorical values, such as feature names or class labels.
 *
 * <p>Keeps two views of the same data: the values in insertion order, and a
 * value-to-id index for constant-time reverse lookup. The index is derived
 * from the value list and {@code startAt}; it is rebuilt on import and never
 * serialized.
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. Callers sharing an instance must synchronize
 * {@link #add} against lookups.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Numberer<String> labels = new Numberer<>(1);   // id 0 reserved
 * int id = labels.add("PERSON");                 // 1
 * labels.add("PERSON");                          // 1 again
 * labels.value(1);                               // Optional[PERSON]
 * }</pre>
 *
 * @param <T> value type; must have consistent {@code equals}/{@code hashCode}
 */
public final class Numberer<T> implements INumberer<T>, Serializable {
    private static final long serialVersionUID = 1L;

    private static final Logger logger = Logger.getLogger(Numberer.class.getName());

    private static final int MISSING = -1;

    private final List<T> values;
    private final Object2IntMap<T> numbers;
    private final int startAt;

    public Numberer() {
        this(0);
    }

    public Numberer(int startAt) {
        if (startAt < 0) {
            throw new IllegalArgumentException("startAt must be non-negative: " + startAt);
        }
        this.values = new ArrayList<>();
        this.numbers = newIndex(0);
        this.startAt = startAt;
    }

    private Numberer(List<T> values, Object2IntMap<T> numbers, int startAt) {
        this.values = values;
        this.numbers = numbers;
        this.startAt = startAt;
    }

    /**
     * Restores a numberer from its serialized form, resolving duplicate
     * values with {@link DuplicatePolicy#LAST_WINS}.
     */
    public static <T> Numberer<T> fromSerialized(SerializedNumberer<T> serialized) {
        return fromSerialized(serialized, DuplicatePolicy.LAST_WINS);
    }

    /**
     * Restores a numberer from its serialized form. The index is rebuilt by
     * mapping {@code values[k]} to {@code k + startAt}.
     *
     * @throws NumbererSerializationException if the values contain a duplicate
     *                                        and the policy is {@link DuplicatePolicy#REJECT}
     */
    public static <T> Numberer<T> fromSerialized(SerializedNumberer<T> serialized, DuplicatePolicy policy) {
        Objects.requireNonNull(serialized, "serialized");
        Objects.requireNonNull(policy, "policy");

        List<T> values = new ArrayList<>(serialized.values());
        int startAt = serialized.startAt();
        if ((long) startAt + values.size() > Integer.MAX_VALUE) {
            throw new NumbererSerializationException(
                    "Id range exceeds int: start_at=" + startAt + ", values=" + values.size());
        }

        Object2IntMap<T> numbers = newIndex(values.size());
        for (int i = 0; i < values.size(); i++) {
            T value = values.get(i);
            int number = i + startAt;
            int previous = numbers.put(value, number);
            if (previous != MISSING) {
                if (policy == DuplicatePolicy.REJECT) {
                    throw new NumbererSerializationException(
                            "Duplicate value '" + value + "' at ids " + previous + " and " + number);
                }
                logger.warning("Duplicate value '" + value + "' at ids " + previous + " and " + number
                        + "; index keeps " + number);
            }
        }
        return new Numberer<>(values, numbers, startAt);
    }

    /**
     * @return the serialized form: the values in id order and the offset
     */
    public SerializedNumberer<T> toSerialized() {
        return new SerializedNumberer<>(values, startAt);
    }

    /**
     * @return an independent copy of this numberer
     */
    public Numberer<T> copy() {
        Object2IntMap<T> numbersCopy = newIndex(numbers.size());
        numbersCopy.putAll(numbers);
        return new Numberer<>(new ArrayList<>(values), numbersCopy, startAt);
    }

    @Override
    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public int size() {
        return values.size() + startAt;
    }

    @Override
    public int add(T value) {
        Objects.requireNonNull(value, "value");
        int existing = numbers.getInt(value);
        if (existing != MISSING) {
            return existing;
        }
        int number = size();
        if (number == Integer.MAX_VALUE) {
            throw new IllegalStateException("Numberer is full: no id left after " + (number - 1));
        }
        values.add(value);
        numbers.put(value, number);
        return number;
    }

    @Override
    public OptionalInt number(Object item) {
        // fastutil's getInt(Object) is the Map.get(Object) contract without boxing
        int number = numbers.getInt(item);
        return number == MISSING ? OptionalInt.empty() : OptionalInt.of(number);
    }

    @Override
    public Optional<T> value(int id) {
        int index = id - startAt;
        if (id < startAt || index >= values.size()) {
            return Optional.empty();
        }
        return Optional.of(values.get(index));
    }

    @Override
    public boolean contains(Object item) {
        return numbers.containsKey(item);
    }

    @Override
    public int startAt() {
        return startAt;
    }

    @Override
    public List<T> values() {
        return Collections.unmodifiableList(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Numberer<?> other)) return false;
        return startAt == other.startAt && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return 31 * values.hashCode() + startAt;
    }

    @Override
    public String toString() {
        return "Numberer{startAt=" + startAt + ", values=" + values + "}";
    }

    private static <T> Object2IntMap<T> newIndex(int expected) {
        Object2IntOpenHashMap<T> index = new Object2IntOpenHashMap<>(expected);
        index.defaultReturnValue(MISSING);
        return index;
    }

    // --- Java serialization: only values and startAt are written ---

    private Object writeReplace() {
        return new SerializationProxy<>(this);
    }

    private void readObject(ObjectInputStream in) throws InvalidObjectException {
        throw new InvalidObjectException("Numberer is restored through its serialization proxy");
    }

    private static final class SerializationProxy<T> implements Serializable {
        private static final long serialVersionUID = 1L;

        private final ArrayList<T> values;
        private final int startAt;

        SerializationProxy(Numberer<T> numberer) {
            this.values = new ArrayList<>(numberer.values);
            this.startAt = numberer.startAt;
        }

        private Object readResolve() throws InvalidObjectException {
            try {
                return fromSerialized(new SerializedNumberer<>(values, startAt));
            } catch (IllegalArgumentException | NumbererSerializationException e) {
                InvalidObjectException invalid = new InvalidObjectException(e.getMessage());
                invalid.initCause(e);
                throw invalid;
            }
        }
    }
}
