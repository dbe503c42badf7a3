package com.challenges.tslgen.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * A partition dimension: a named, ordered, non-empty set of mutually exclusive choices.
 */
public record Category(String name, ImmutableList<Choice> choices) {
    public Category {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(choices, "choices");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Category name cannot be empty");
        }
        if (choices.isEmpty()) {
            throw new IllegalArgumentException("Category '" + name + "' has no choices");
        }
    }

    public static Category of(String name, Choice... choices) {
        return new Category(name, Lists.immutable.with(choices));
    }

    public int size() {
        return choices.size();
    }

    public Choice choice(int index) {
        return choices.get(index);
    }

    /**
     * 1-based position of {@code choice} in this category, or 0 when it is absent.
     * Matched by identity, two choices may share a name.
     */
    public int ordinalOf(Choice choice) {
        return choices.detectIndex(each -> each == choice) + 1;
    }

    @Override
    public String toString() {
        return name + " (" + choices.size() + " choices)";
    }
}
