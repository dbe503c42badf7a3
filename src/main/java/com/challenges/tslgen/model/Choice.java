package com.challenges.tslgen.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;
import java.util.Optional;

/**
 * One option within a category.
 *
 * <p>A choice sets its regular {@code properties} when selected. When it carries a
 * {@code condition}, the condition decides which branch applies: the if-branch sets
 * {@code ifProperties} and generates {@code ifFrameType} frames, the optional
 * else-branch sets {@code elseProperties} and generates {@code elseFrameType} frames.
 * {@code frameType} applies regardless of the condition.
 */
public record Choice(
        String name,
        ImmutableList<Property> properties,
        Expression condition,
        ImmutableList<Property> ifProperties,
        ImmutableList<Property> elseProperties,
        boolean hasElse,
        FrameType frameType,
        FrameType ifFrameType,
        FrameType elseFrameType) {

    public Choice {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(properties, "properties");
        Objects.requireNonNull(ifProperties, "ifProperties");
        Objects.requireNonNull(elseProperties, "elseProperties");
        Objects.requireNonNull(frameType, "frameType");
        Objects.requireNonNull(ifFrameType, "ifFrameType");
        Objects.requireNonNull(elseFrameType, "elseFrameType");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Choice name cannot be empty");
        }
        if (condition == null) {
            if (hasElse) {
                throw new IllegalArgumentException("Choice '" + name + "' has an else branch but no condition");
            }
            if (!ifFrameType.isNormal()) {
                throw new IllegalArgumentException("Choice '" + name + "' sets an if frame type but has no condition");
            }
            if (ifProperties.notEmpty()) {
                throw new IllegalArgumentException("Choice '" + name + "' has if properties but no condition");
            }
        }
        if (!hasElse) {
            if (!elseFrameType.isNormal()) {
                throw new IllegalArgumentException("Choice '" + name + "' sets an else frame type but has no else branch");
            }
            if (elseProperties.notEmpty()) {
                throw new IllegalArgumentException("Choice '" + name + "' has else properties but no else branch");
            }
        }
    }

    public static Choice of(String name) {
        return builder(name).build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public boolean hasCondition() {
        return condition != null;
    }

    public Optional<Expression> conditionIfPresent() {
        return Optional.ofNullable(condition);
    }

    /** True when this choice generates a single or error frame without looking at its condition. */
    public boolean isUnconditionallySpecial() {
        return !frameType.isNormal();
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Mutable builder; the constraint keywords of a choice line arrive one at a time and
     * route to the base, if or else slot depending on what was seen before.
     */
    public static final class Builder {
        private final String name;
        private final MutableList<Property> properties = Lists.mutable.empty();
        private final MutableList<Property> ifProperties = Lists.mutable.empty();
        private final MutableList<Property> elseProperties = Lists.mutable.empty();
        private Expression condition;
        private boolean hasElse;
        private FrameType frameType = FrameType.NORMAL;
        private FrameType ifFrameType = FrameType.NORMAL;
        private FrameType elseFrameType = FrameType.NORMAL;

        private Builder(String name) {
            this.name = name;
        }

        public String name() {
            return name;
        }

        public boolean hasCondition() {
            return condition != null;
        }

        public boolean hasElse() {
            return hasElse;
        }

        public Builder property(Property property) {
            properties.add(property);
            return this;
        }

        public Builder properties(Property... values) {
            properties.addAll(Lists.mutable.with(values));
            return this;
        }

        public Builder condition(Expression expression) {
            this.condition = expression;
            return this;
        }

        public Builder ifProperty(Property property) {
            ifProperties.add(property);
            return this;
        }

        public Builder elseBranch() {
            this.hasElse = true;
            return this;
        }

        public Builder elseProperty(Property property) {
            elseProperties.add(property);
            return this;
        }

        public Builder frameType(FrameType type) {
            this.frameType = type;
            return this;
        }

        public Builder ifFrameType(FrameType type) {
            this.ifFrameType = type;
            return this;
        }

        public Builder elseFrameType(FrameType type) {
            this.elseFrameType = type;
            return this;
        }

        /** Sends a property to the slot the most recent constraint opened: else, then if, then regular. */
        public Builder routedProperty(Property property) {
            if (hasElse) {
                return elseProperty(property);
            }
            if (condition != null) {
                return ifProperty(property);
            }
            return property(property);
        }

        /** Sends a frame type to the slot the most recent constraint opened: else, then if, then base. */
        public Builder routedFrameType(FrameType type) {
            if (hasElse) {
                return elseFrameType(type);
            }
            if (condition != null) {
                return ifFrameType(type);
            }
            return frameType(type);
        }

        public Choice build() {
            return new Choice(
                    name,
                    properties.toImmutable(),
                    condition,
                    ifProperties.toImmutable(),
                    elseProperties.toImmutable(),
                    hasElse,
                    frameType,
                    ifFrameType,
                    elseFrameType);
        }
    }
}
