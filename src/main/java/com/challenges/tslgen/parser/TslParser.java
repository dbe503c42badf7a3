package com.challenges.tslgen.parser;

import com.challenges.tslgen.model.Category;
import com.challenges.tslgen.model.Choice;
import com.challenges.tslgen.model.FrameType;
import com.challenges.tslgen.model.Property;
import com.challenges.tslgen.model.Specification;
import com.challenges.tslgen.parser.TslParseException.ErrorType;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads Test Specification Language text.
 *
 * <pre>
 * # File
 *   Size:
 *       Empty.        [property emptyfile]
 *       Not empty.
 *   Occurrences:
 *       None.         [if !emptyfile] [property noOccurrences]
 *       Many.         [if !emptyfile] [single]
 * </pre>
 *
 * Lines starting with {@code #} and lines ending with {@code :} open a category; other
 * lines containing a period are choices of the current category, named up to and
 * including the first period and followed by bracketed constraints. Any other line is
 * ignored. Categories left without choices are dropped.
 *
 * <p>A parser instance keeps the properties defined so far; use a new one per source.
 */
public class TslParser {
    private static final Logger log = LoggerFactory.getLogger(TslParser.class);

    private static final Pattern CONSTRAINT = Pattern.compile("\\[(.*?)]");

    private static final String SINGLE = "single";
    private static final String ERROR = "error";
    private static final String PROPERTY = "property";
    private static final String IF = "if";
    private static final String ELSE = "else";

    private final MutableMap<String, Property> properties = Maps.mutable.empty();

    public Specification parse(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TslParseException(ErrorType.FILE_SYSTEM, "Cannot read " + path + ": " + e.getMessage(), e);
        }
        log.debug("Parsing {}", path);
        return parse(content);
    }

    public Specification parse(String content) {
        MutableList<PendingCategory> pending = Lists.mutable.empty();
        PendingCategory current = null;

        String[] lines = content.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String raw = lines[i];
            String line = raw.trim();
            if (line.isEmpty()) {
                continue;
            }

            if (line.startsWith("#")) {
                current = openCategory(line.substring(1).replace(":", "").trim(), lineNumber, raw);
                pending.add(current);
            } else if (line.endsWith(":")) {
                current = openCategory(line.substring(0, line.length() - 1).trim(), lineNumber, raw);
                pending.add(current);
            } else if (line.contains(".")) {
                if (current == null) {
                    throw new TslParseException(ErrorType.SYNTAX,
                            "Choice must be preceded by a category", lineNumber, 0, raw);
                }
                current.choices.add(parseChoice(line, lineNumber, raw));
            } else {
                log.debug("Ignoring line {}: {}", lineNumber, line);
            }
        }

        MutableList<Category> categories = pending
                .select(category -> category.choices.notEmpty())
                .collect(category -> new Category(category.name, category.choices.toImmutable()));
        if (categories.isEmpty()) {
            throw new TslParseException(ErrorType.SYNTAX, "No categories with choices found");
        }

        log.debug("Parsed {} categories and {} properties", categories.size(), properties.size());
        return new Specification(categories.toImmutable(), properties.toImmutable());
    }

    private PendingCategory openCategory(String name, int lineNumber, String raw) {
        if (name.isEmpty()) {
            throw new TslParseException(ErrorType.SYNTAX, "Category name cannot be empty", lineNumber, 0, raw);
        }
        if (name.length() > TslLimits.MAX_CATEGORY_NAME_LENGTH) {
            throw new TslParseException(ErrorType.SYNTAX, "Category name \"" + name + "\" exceeds maximum length of "
                    + TslLimits.MAX_CATEGORY_NAME_LENGTH + " characters", lineNumber, 0, raw);
        }
        return new PendingCategory(name);
    }

    private Choice parseChoice(String line, int lineNumber, String raw) {
        int period = line.indexOf('.');
        String name = line.substring(0, period + 1).trim();
        if (name.equals(".")) {
            throw new TslParseException(ErrorType.SYNTAX, "Choice name cannot be empty", lineNumber, 0, raw);
        }
        if (name.length() > TslLimits.MAX_CHOICE_NAME_LENGTH) {
            throw new TslParseException(ErrorType.SYNTAX, "Choice name \"" + name + "\" exceeds maximum length of "
                    + TslLimits.MAX_CHOICE_NAME_LENGTH + " characters", lineNumber, 0, raw);
        }

        int indent = raw.indexOf(line.charAt(0));
        String rest = line.substring(period + 1);
        Choice.Builder builder = Choice.builder(name);

        Matcher matcher = CONSTRAINT.matcher(rest);
        int consumed = 0;
        while (matcher.find()) {
            String between = rest.substring(consumed, matcher.start());
            if (!between.isBlank()) {
                throw new TslParseException(ErrorType.SYNTAX, "Constraints must be enclosed in square brackets",
                        lineNumber, indent + period + 2 + consumed, raw);
            }
            // 1-based column of the text just inside the '['
            int column = indent + period + 1 + matcher.start(1) + 1;
            applyConstraint(builder, matcher.group(1).trim(), lineNumber, column, raw);
            consumed = matcher.end();
        }
        if (!rest.substring(consumed).isBlank()) {
            throw new TslParseException(ErrorType.SYNTAX, "Constraints must be enclosed in square brackets",
                    lineNumber, indent + period + 2 + consumed, raw);
        }

        return builder.build();
    }

    private void applyConstraint(Choice.Builder choice, String constraint, int lineNumber, int column, String raw) {
        if (constraint.isEmpty()) {
            throw new TslParseException(ErrorType.CONSTRAINT, "Empty constraint", lineNumber, column, raw);
        }

        if (constraint.equals(SINGLE)) {
            choice.routedFrameType(FrameType.SINGLE);
        } else if (constraint.equals(ERROR)) {
            choice.routedFrameType(FrameType.ERROR);
        } else if (constraint.equals(ELSE)) {
            if (!choice.hasCondition()) {
                throw new TslParseException(ErrorType.CONSTRAINT,
                        "\"else\" constraint requires a preceding \"if\" constraint", lineNumber, column, raw);
            }
            choice.elseBranch();
        } else if (isKeyword(constraint, PROPERTY)) {
            String names = constraint.substring(PROPERTY.length()).trim();
            if (names.isEmpty()) {
                throw new TslParseException(ErrorType.PROPERTY,
                        "Property name missing after \"property\" keyword", lineNumber, column, raw);
            }
            for (String name : names.split(",")) {
                if (!name.isBlank()) {
                    choice.routedProperty(defineProperty(name.trim(), lineNumber, raw));
                }
            }
        } else if (isKeyword(constraint, IF)) {
            String text = constraint.substring(IF.length()).trim();
            if (text.isEmpty()) {
                throw new TslParseException(ErrorType.EXPRESSION,
                        "Expression missing after \"if\" keyword", lineNumber, column, raw);
            }
            if (choice.hasCondition()) {
                throw new TslParseException(ErrorType.CONSTRAINT,
                        "Choice already has an \"if\" constraint", lineNumber, column, raw);
            }
            int textOffset = column - 1 + constraint.indexOf(text);
            try {
                choice.condition(new ExpressionParser(properties).parse(text));
            } catch (TslParseException e) {
                throw e.atLine(lineNumber, textOffset, raw);
            }
        } else {
            throw new TslParseException(ErrorType.CONSTRAINT, "Unknown constraint: " + constraint
                    + " (valid constraints are single, error, property, if and else)", lineNumber, column, raw);
        }
    }

    // "property" and "if" must be followed by a blank so that e.g. [iffy] stays unknown
    private static boolean isKeyword(String constraint, String keyword) {
        return constraint.equals(keyword)
                || constraint.startsWith(keyword) && Character.isWhitespace(constraint.charAt(keyword.length()));
    }

    private Property defineProperty(String name, int lineNumber, String raw) {
        if (name.length() > TslLimits.MAX_PROPERTY_NAME_LENGTH) {
            throw new TslParseException(ErrorType.PROPERTY, "Property name \"" + name + "\" exceeds maximum length of "
                    + TslLimits.MAX_PROPERTY_NAME_LENGTH + " characters", lineNumber, 0, raw);
        }
        return properties.getIfAbsentPut(name, () -> Property.of(name));
    }

    private static final class PendingCategory {
        private final String name;
        private final MutableList<Choice> choices = Lists.mutable.empty();

        PendingCategory(String name) {
            this.name = name;
        }
    }
}
