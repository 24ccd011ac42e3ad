package com.vocab.numbering.api.exceptions;

/**
 * Exception thrown when a numberer cannot be written or restored.
 *
 * This is a RuntimeException so that codec failures do not force checked
 * exception handling on callers, while the underlying codec or I/O error is
 * kept as the cause.
 */
public class NumbererSerializationException extends RuntimeException {

    public NumbererSerializationException(String message) {
        super(message);
    }

    public NumbererSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
