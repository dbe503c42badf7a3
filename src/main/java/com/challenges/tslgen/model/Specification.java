package com.challenges.tslgen.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Objects;
import java.util.Optional;

/**
 * A parsed category-partition specification: the categories in declaration order and
 * every property any choice defines, keyed by name.
 */
public record Specification(ImmutableList<Category> categories, ImmutableMap<String, Property> properties) {
    public Specification {
        Objects.requireNonNull(categories, "categories");
        Objects.requireNonNull(properties, "properties");
    }

    /** Builds a specification from categories, collecting the properties their choices set. */
    public static Specification of(Iterable<Category> categories) {
        ImmutableList<Category> list = Lists.immutable.ofAll(categories);
        MutableMap<String, Property> properties = Maps.mutable.empty();
        for (Category category : list) {
            for (Choice choice : category.choices()) {
                choice.properties().forEachWith(Specification::register, properties);
                choice.ifProperties().forEachWith(Specification::register, properties);
                choice.elseProperties().forEachWith(Specification::register, properties);
            }
        }
        return new Specification(list, properties.toImmutable());
    }

    public static Specification of(Category... categories) {
        return of(Lists.immutable.with(categories));
    }

    private static void register(Property property, MutableMap<String, Property> into) {
        into.put(property.name(), property);
    }

    public Optional<Property> property(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    public boolean isEmpty() {
        return categories.isEmpty();
    }

    public int totalChoiceCount() {
        return (int) categories.sumOfInt(Category::size);
    }

    public int maxCategoryNameLength() {
        return categories.collectInt(category -> category.name().length()).maxIfEmpty(0);
    }
}
