package com.challenges.tslgen.model;

import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Objects;

/**
 * Boolean formula over properties. Every node carries its own negation flag, so
 * {@code !(A || B)} is an {@link Or} node with {@code negated = true}.
 *
 * <p>Evaluation only reads the given {@link PropertyTable}.
 */
public sealed interface Expression {

    boolean negated();

    /** Value of this node, its own negation applied. */
    boolean evaluate(PropertyTable table);

    /** The same node with its negation flag flipped. */
    Expression negate();

    static Expression of(Property property) {
        return new Leaf(property, false);
    }

    static Expression not(Property property) {
        return new Leaf(property, true);
    }

    static Expression and(Expression left, Expression right) {
        return new And(left, right, false);
    }

    static Expression or(Expression left, Expression right) {
        return new Or(left, right, false);
    }

    default ImmutableSet<Property> properties() {
        MutableSet<Property> collected = Sets.mutable.empty();
        collectProperties(this, collected);
        return collected.toImmutable();
    }

    private static void collectProperties(Expression node, MutableSet<Property> into) {
        if (node instanceof Leaf leaf) {
            into.add(leaf.property());
        } else if (node instanceof Binary binary) {
            collectProperties(binary.left(), into);
            collectProperties(binary.right(), into);
        }
    }

    record Leaf(Property property, boolean negated) implements Expression {
        public Leaf {
            Objects.requireNonNull(property, "property");
        }

        @Override
        public boolean evaluate(PropertyTable table) {
            return table.valueOf(property) ^ negated;
        }

        @Override
        public Expression negate() {
            return new Leaf(property, !negated);
        }

        @Override
        public String toString() {
            return negated ? "!" + property.name() : property.name();
        }
    }

    /** Shared shape of the two operator nodes. */
    sealed interface Binary extends Expression permits And, Or {
        Expression left();

        Expression right();

        String symbol();
    }

    record And(Expression left, Expression right, boolean negated) implements Binary {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public boolean evaluate(PropertyTable table) {
            boolean a = left.evaluate(table);
            boolean b = right.evaluate(table);
            return (a && b) ^ negated;
        }

        @Override
        public Expression negate() {
            return new And(left, right, !negated);
        }

        @Override
        public String symbol() {
            return "&&";
        }

        @Override
        public String toString() {
            return Rendering.render(this);
        }
    }

    record Or(Expression left, Expression right, boolean negated) implements Binary {
        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public boolean evaluate(PropertyTable table) {
            boolean a = left.evaluate(table);
            boolean b = right.evaluate(table);
            return (a || b) ^ negated;
        }

        @Override
        public Expression negate() {
            return new Or(left, right, !negated);
        }

        @Override
        public String symbol() {
            return "||";
        }

        @Override
        public String toString() {
            return Rendering.render(this);
        }
    }

    final class Rendering {
        private Rendering() {
        }

        static String render(Binary node) {
            String body = operand(node.left()) + " " + node.symbol() + " " + operand(node.right());
            return node.negated() ? "!(" + body + ")" : body;
        }

        // Nested binary operands are always parenthesized so the text re-parses to the same tree.
        private static String operand(Expression operand) {
            if (operand instanceof Binary binary && !binary.negated()) {
                return "(" + binary + ")";
            }
            return operand.toString();
        }
    }
}
