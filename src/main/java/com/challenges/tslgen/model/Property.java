package com.challenges.tslgen.model;

import java.util.Objects;

/**
 * A named boolean flag set by choosing certain choices and read by expressions.
 * Two properties are the same property when their names match; the truth value
 * lives in a {@link PropertyTable}.
 */
public record Property(String name) {
    public Property {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Property name cannot be empty");
        }
    }

    public static Property of(String name) {
        return new Property(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
