/*
 * Copyright (c) 2025 Vocab Numberer
 * Licensed under the Apache License, Version 2.0
 */
package com.vocab.numbering.api;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Contract for assigning dense integer ids to distinct values.
 *
 * <p>Ids are handed out in insertion order starting at {@link #startAt()}.
 * An id, once issued, is never reassigned.
 *
 * @param <T> value type; must have consistent {@code equals}/{@code hashCode}
 */
public interface INumberer<T> {

    /**
     * @return true if no value has been added yet
     */
    boolean isEmpty();

    /**
     * Returns the next id that would be issued, i.e. the number of distinct
     * values plus {@link #startAt()}. Ids below {@code startAt} are treated as
     * reserved by the caller.
     *
     * @return one past the highest issued id
     */
    int size();

    /**
     * Adds a value. If the value has already been encountered, the existing
     * id is returned and the table is left untouched.
     *
     * @param value the value to number
     * @return the id of the value
     */
    int add(T value);

    /**
     * Looks up the id of a value. Any object equal to a stored value is
     * accepted, as with {@link java.util.Map#get(Object)}.
     *
     * @param item the value to look up
     * @return the id, or empty if the value was never added
     */
    OptionalInt number(Object item);

    /**
     * Looks up the value for an id.
     *
     * @param id the id
     * @return the value, or empty if the id is out of range in either direction
     */
    Optional<T> value(int id);

    /**
     * @return the id of the first value
     */
    int startAt();

    /**
     * @return unmodifiable view of the values in id order
     */
    List<T> values();

    default boolean contains(Object item) {
        return number(item).isPresent();
    }
}
