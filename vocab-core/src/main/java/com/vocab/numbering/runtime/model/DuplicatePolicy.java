package com.vocab.numbering.runtime.model;

/**
 * How an import treats a value that occurs more than once in the serialized
 * value list. A numberer built through {@code add} never produces such a list.
 */
public enum DuplicatePolicy {
    /** Accept the list; the index maps the value to its last position. */
    LAST_WINS,

    /** Refuse the list with a {@code NumbererSerializationException}. */
    REJECT
}
