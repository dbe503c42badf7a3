package com.challenges.tslgen.generator;

import com.challenges.tslgen.model.Category;
import com.challenges.tslgen.model.Choice;
import com.challenges.tslgen.model.Expression;
import com.challenges.tslgen.model.Property;
import com.challenges.tslgen.model.PropertyTable;
import com.challenges.tslgen.model.Specification;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.tuple.Tuples;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Derives test frames from categories of choices.
 *
 * <p>Single and error frames come first, one per choice tagged that way and one per
 * conditional branch tagged that way. Normal frames follow: a depth-first walk over the
 * categories in declaration order picks at most one selectable choice per category,
 * turning on the properties it sets for the deeper categories and turning them off
 * again before trying the next choice.
 *
 * <p>Each {@link #generate()} call works on its own {@link PropertyTable}, so a generator
 * can be reused and produces the same frames every time.
 */
public class FrameGenerator {
    private static final Logger log = LoggerFactory.getLogger(FrameGenerator.class);

    private final ImmutableList<Category> categories;
    private final GeneratorOptions options;

    public FrameGenerator(Specification specification) {
        this(specification.categories(), GeneratorOptions.defaults());
    }

    public FrameGenerator(Specification specification, GeneratorOptions options) {
        this(specification.categories(), options);
    }

    public FrameGenerator(Iterable<Category> categories) {
        this(categories, GeneratorOptions.defaults());
    }

    public FrameGenerator(Iterable<Category> categories, GeneratorOptions options) {
        Objects.requireNonNull(categories, "categories");
        this.categories = Lists.immutable.ofAll(categories);
        this.options = Objects.requireNonNull(options, "options");
        if (this.categories.anySatisfy(Objects::isNull)) {
            throw new IllegalArgumentException("categories must not contain null");
        }
    }

    public ImmutableList<Category> categories() {
        return categories;
    }

    public GeneratorResult generate() {
        PropertyTable table = new PropertyTable();
        MutableList<Frame> frames = Lists.mutable.empty();

        extractSpecialFrames(table, frames);
        int special = frames.size();
        log.debug("Extracted {} single/error frames from {} categories", special, categories.size());

        NormalFrameSearch search = new NormalFrameSearch(table, frames);
        search.run();
        log.debug("Enumerated {} normal frames in {} search steps", frames.size() - special, search.steps);

        return new GeneratorResult(frames.toImmutable());
    }

    private void extractSpecialFrames(PropertyTable table, MutableList<Frame> frames) {
        ImmutableSet<Property> baseline = baselineProperties();

        for (Category category : categories) {
            for (Choice choice : category.choices()) {
                if (choice.isUnconditionallySpecial()) {
                    frames.add(Frame.special(frames.size() + 1, choice.frameType(), category, choice, null));
                }
                if (!choice.hasCondition()) {
                    continue;
                }

                boolean holds;
                try (PropertyTable.Assignment ignored = table.assign(baseline)) {
                    holds = choice.condition().evaluate(table);
                }

                if (holds && !choice.ifFrameType().isNormal()) {
                    frames.add(Frame.special(frames.size() + 1, choice.ifFrameType(), category, choice, Branch.IF));
                } else if (!holds && choice.hasElse() && !choice.elseFrameType().isNormal()) {
                    frames.add(Frame.special(frames.size() + 1, choice.elseFrameType(), category, choice, Branch.ELSE));
                }
            }
        }
    }

    /** Regular properties of every choice that has no condition. */
    private ImmutableSet<Property> baselineProperties() {
        return categories
                .flatCollect(Category::choices)
                .reject(Choice::hasCondition)
                .flatCollect(Choice::properties)
                .toSet()
                .toImmutable();
    }

    /**
     * Whether {@code choice} can take part in a normal frame given the properties turned
     * on by the choices selected so far.
     */
    static boolean isSelectable(Choice choice, PropertyTable table) {
        if (!choice.frameType().isNormal()) {
            return false;
        }
        Expression condition = choice.condition();
        if (condition == null) {
            return true;
        }
        if (condition.evaluate(table)) {
            return choice.ifFrameType().isNormal();
        }
        return choice.hasElse() && choice.elseFrameType().isNormal();
    }

    /** Properties selecting {@code choice} turns on; only meaningful when it is selectable. */
    static ImmutableList<Property> propertiesToSet(Choice choice, PropertyTable table) {
        Expression condition = choice.condition();
        if (condition == null) {
            return choice.properties();
        }
        return condition.evaluate(table) ? choice.ifProperties() : choice.elseProperties();
    }

    private final class NormalFrameSearch {
        private final PropertyTable table;
        private final MutableList<Frame> frames;
        // 1-based choice index per category, 0 for no selection
        private final int[] selection;
        private long steps;

        NormalFrameSearch(PropertyTable table, MutableList<Frame> frames) {
            this.table = table;
            this.frames = frames;
            this.selection = new int[categories.size()];
        }

        void run() {
            search(0);
        }

        private void search(int depth) {
            steps++;
            if (options.isBounded() && steps > options.maxSteps()) {
                throw new GenerationLimitExceededException(options.maxSteps());
            }
            if (depth == categories.size()) {
                emit();
                return;
            }

            Category category = categories.get(depth);
            boolean selectedAny = false;
            for (int i = 0; i < category.size(); i++) {
                Choice choice = category.choice(i);
                if (!isSelectable(choice, table)) {
                    continue;
                }
                selectedAny = true;
                try (PropertyTable.Assignment ignored = table.assign(propertiesToSet(choice, table))) {
                    selection[depth] = i + 1;
                    search(depth + 1);
                } finally {
                    selection[depth] = 0;
                }
            }

            if (!selectedAny) {
                selection[depth] = 0;
                search(depth + 1);
            }
        }

        private void emit() {
            MutableList<Pair<Category, Choice>> entries = Lists.mutable.empty();
            StringBuilder key = new StringBuilder();
            for (int i = 0; i < categories.size(); i++) {
                Category category = categories.get(i);
                int ordinal = selection[i];
                entries.add(Tuples.pair(category, ordinal == 0 ? null : category.choice(ordinal - 1)));
                if (i > 0) {
                    key.append('.');
                }
                key.append(ordinal);
            }
            frames.add(Frame.normal(frames.size() + 1, key.toString(), entries.toImmutable()));
        }
    }
}
