package com.challenges.tslgen.generator;

import com.challenges.tslgen.model.Category;
import com.challenges.tslgen.model.Choice;
import com.challenges.tslgen.model.FrameType;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.tuple.Tuples;

import java.util.Objects;
import java.util.Optional;

/**
 * One generated test case.
 *
 * <p>A normal frame has one entry per category, in category order, whose choice is
 * {@code null} when the category contributed nothing, and a key of dot-joined 1-based
 * choice indices. A single or error frame has exactly one entry and no key; its
 * branch tells which side of a conditional choice produced it, or is {@code null}
 * when the choice was tagged unconditionally.
 */
public record Frame(
        int number,
        FrameType type,
        String key,
        ImmutableList<Pair<Category, Choice>> entries,
        Branch branch) {

    public Frame {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(entries, "entries");
        if (type.isNormal() && key == null) {
            throw new IllegalArgumentException("Normal frame " + number + " needs a key");
        }
        if (!type.isNormal() && (key != null || entries.size() != 1)) {
            throw new IllegalArgumentException(type + " frame " + number + " must hold exactly one entry and no key");
        }
        if (type.isNormal() && branch != null) {
            throw new IllegalArgumentException("Normal frame " + number + " cannot follow a branch");
        }
    }

    static Frame normal(int number, String key, ImmutableList<Pair<Category, Choice>> entries) {
        return new Frame(number, FrameType.NORMAL, key, entries, null);
    }

    static Frame special(int number, FrameType type, Category category, Choice choice, Branch branch) {
        return new Frame(number, type, null, Lists.immutable.with(Tuples.pair(category, choice)), branch);
    }

    public boolean isNormal() {
        return type.isNormal();
    }

    public Optional<String> keyIfPresent() {
        return Optional.ofNullable(key);
    }

    public Optional<Branch> branchIfPresent() {
        return Optional.ofNullable(branch);
    }

    /** Choice selected for {@code category}, empty when absent from this frame or when no choice applied. */
    public Optional<Choice> choiceFor(Category category) {
        Pair<Category, Choice> entry = entries.detect(each -> each.getOne() == category);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.getTwo());
    }

    /** Choice names in entry order, {@code null} where a category contributed nothing. */
    public ImmutableList<String> choiceNames() {
        return entries.collect(entry -> entry.getTwo() == null ? null : entry.getTwo().name());
    }
}
