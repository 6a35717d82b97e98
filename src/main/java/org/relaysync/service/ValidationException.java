package org.relaysync.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rejected input. {@link #getInvalid()} lists the offending values or field names.
 */
public class ValidationException extends RuntimeException {

    private final List<Object> invalid;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<?> invalid) {
        super(message);
        this.invalid = invalid == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(invalid));
    }

    public List<Object> getInvalid() {
        return invalid;
    }
}
