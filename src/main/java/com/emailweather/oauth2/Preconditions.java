package com.emailweather.oauth2;

import java.util.Collection;

/**
 * Utility class for argument validation.
 */
final class Preconditions {

    private Preconditions() {
        // Utility class
    }

    /**
     * Validates that a string is neither null nor blank.
     *
     * @param value the value to check
     * @param name  the parameter name for the error message
     * @return the value
     * @throws IllegalArgumentException if the value is null or blank
     */
    static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
        return value;
    }

    /**
     * Validates that a reference is not null.
     *
     * @throws IllegalArgumentException if the value is null
     */
    static <T> T requireNonNull(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        return value;
    }

    /**
     * Validates that a collection is neither null nor empty.
     *
     * @throws IllegalArgumentException if the collection is null or empty
     */
    static <C extends Collection<?>> C requireNonEmpty(C value, String name) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
        return value;
    }
}
