package com.challenges.tslgen.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.primitive.ObjectBooleanHashMap;

/**
 * Truth assignment for properties. Properties that were never assigned read as false.
 *
 * <p>Values change only through {@link #set(Property, boolean)} or through an
 * {@link Assignment} scope, which restores exactly the properties it turned on.
 */
public final class PropertyTable {
    private final ObjectBooleanHashMap<Property> values = new ObjectBooleanHashMap<>();

    public boolean valueOf(Property property) {
        return values.getIfAbsent(property, false);
    }

    public void set(Property property, boolean value) {
        if (value) {
            values.put(property, true);
        } else {
            values.remove(property);
        }
    }

    /**
     * Turns on every given property and returns a scope that turns off, on close,
     * the ones that were off before this call.
     */
    public Assignment assign(Iterable<Property> properties) {
        MutableList<Property> changed = Lists.mutable.empty();
        for (Property property : properties) {
            if (!valueOf(property)) {
                values.put(property, true);
                changed.add(property);
            }
        }
        return new Assignment(changed.toImmutable());
    }

    public void reset() {
        values.clear();
    }

    /** Number of properties currently true. */
    public int trueCount() {
        return values.count(value -> value);
    }

    public boolean allFalse() {
        return trueCount() == 0;
    }

    @Override
    public String toString() {
        return "PropertyTable" + values;
    }

    public final class Assignment implements AutoCloseable {
        private final ImmutableList<Property> changed;
        private boolean closed;

        private Assignment(ImmutableList<Property> changed) {
            this.changed = changed;
        }

        /** Properties this scope switched from false to true. */
        public ImmutableList<Property> changed() {
            return changed;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            for (Property property : changed) {
                values.remove(property);
            }
        }
    }
}
