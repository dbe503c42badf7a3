package com.challenges.tslgen.parser;

import com.challenges.tslgen.model.Category;
import com.challenges.tslgen.model.Choice;
import com.challenges.tslgen.model.FrameType;
import com.challenges.tslgen.model.Property;
import com.challenges.tslgen.model.PropertyTable;
import com.challenges.tslgen.model.Specification;
import com.challenges.tslgen.parser.TslParseException.ErrorType;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.URISyntaxException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class TslParserTest {

    // ============================================================
    // Test Infrastructure
    // ============================================================

    static Path sample(String name) {
        try {
            return Path.of(TslParserTest.class.getResource("/samples/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    private Specification parse(String content) {
        return new TslParser().parse(content);
    }

    private Choice choice(Specification specification, String category, String choice) {
        return specification.categories()
                .detect(each -> each.name().equals(category))
                .choices()
                .detect(each -> each.name().equals(choice));
    }

    private TslParseException parseError(String content) {
        return assertThrows(TslParseException.class, () -> parse(content));
    }

    // ============================================================
    // Structure
    // ============================================================

    @Test
    public void testSimpleSample() {
        Specification specification = new TslParser().parse(sample("simple_file.tsl"));

        // "# File" has no choices of its own and is dropped
        assertEquals(Lists.immutable.with("Size", "Number of occurrences of the pattern in the file",
                        "Number of occurrences of the pattern in one line", "Position of the pattern in the file"),
                specification.categories().collect(Category::name));
        assertEquals(Lists.immutable.with("Empty.", "Not empty."),
                specification.categories().get(0).choices().collect(Choice::name));
        assertEquals(2, specification.properties().size());
        assertTrue(specification.property("emptyfile").isPresent());
        assertTrue(specification.property("noOccurences").isPresent());
    }

    @Test
    public void testHeadersAndColonCategories() {
        Specification specification = parse("""
                # Parameters:
                  First. [property a]
                Mode:
                  On.
                  Off.
                """);

        assertEquals(Lists.immutable.with("Parameters", "Mode"), specification.categories().collect(Category::name));
        assertEquals(2, specification.categories().get(1).size());
    }

    @Test
    public void testLinesWithoutPeriodAreIgnored() {
        Specification specification = parse("""
                Size:
                  just a note
                  Small.
                """);
        assertEquals(1, specification.categories().get(0).size());
    }

    @Test
    public void testChoiceNameKeepsPeriod() {
        Specification specification = parse("Size:\n  Not empty.   [property full]\n");
        Choice choice = specification.categories().get(0).choice(0);
        assertEquals("Not empty.", choice.name());
        assertEquals(Lists.immutable.with(Property.of("full")), choice.properties());
    }

    @Test
    public void testPropertiesAreSharedByName() {
        Specification specification = parse("""
                A:
                  One. [property p]
                  Two. [property p, q]
                """);
        Category category = specification.categories().get(0);
        assertSame(category.choice(0).properties().get(0), category.choice(1).properties().get(0));
        assertEquals(Lists.immutable.with(Property.of("p"), Property.of("q")), category.choice(1).properties());
    }

    // ============================================================
    // Constraint routing
    // ============================================================

    @Test
    public void testConstraintRoutingFromAllConstraintsSample() {
        Specification specification = new TslParser().parse(sample("all_constraints.tsl"));

        Choice ifError = choice(specification, "ErrorExample1", "Simple If Error.");
        assertTrue(ifError.hasCondition());
        assertEquals(FrameType.ERROR, ifError.ifFrameType());
        assertEquals(FrameType.NORMAL, ifError.frameType());

        Choice ifElseError = choice(specification, "ErrorExample3", "If Else Error.");
        assertEquals(Lists.immutable.with(Property.of("Cool")), ifElseError.ifProperties());
        assertTrue(ifElseError.hasElse());
        assertEquals(FrameType.ERROR, ifElseError.elseFrameType());
        assertEquals(FrameType.NORMAL, ifElseError.ifFrameType());

        Choice singleIf = choice(specification, "ErrorExample7", "Single If.");
        assertEquals(FrameType.SINGLE, singleIf.frameType());
        assertEquals(Lists.immutable.with(Property.of("RandQuoted")), singleIf.ifProperties());

        Choice propertyList = choice(specification, "ErrorExample8", "Property List.");
        assertEquals(Lists.immutable.with(Property.of("Oh"), Property.of("Yeah")), propertyList.properties());

        Choice mixed = choice(specification, "ErrorExample9", "Property If Error.");
        assertEquals(Lists.immutable.with(Property.of("Long")), mixed.properties());
        assertEquals(FrameType.ERROR, mixed.ifFrameType());
        assertEquals(Lists.immutable.with(Property.of("Zero")), mixed.elseProperties());
    }

    @Test
    public void testConditionUsesParsedPrecedence() {
        Specification specification = new TslParser().parse(sample("all_constraints.tsl"));
        Choice choice = choice(specification, "Example6", "If A and B or C.");
        PropertyTable table = new PropertyTable();
        table.set(specification.property("C").orElseThrow(), true);
        assertTrue(choice.condition().evaluate(table));
        assertEquals("(A && B) || C", choice.condition().toString());
    }

    // ============================================================
    // Errors
    // ============================================================

    @Test
    public void testUndefinedPropertyReportsLineAndColumn() {
        TslParseException e = parseError("""
                # Complex expressions

                  Category:
                    Choice1.          [if A && B || C]
                """);
        assertEquals(ErrorType.PROPERTY, e.type());
        assertEquals(4, e.lineNumber());
        assertEquals(27, e.columnNumber());
        assertEquals("    Choice1.          [if A && B || C]", e.lineContent());
    }

    @Test
    public void testPropertyMustBeDefinedBeforeUse() {
        TslParseException e = parseError("""
                First:
                  Uses. [if later]
                Second:
                  Defines. [property later]
                """);
        assertEquals(ErrorType.PROPERTY, e.type());
        assertEquals(2, e.lineNumber());
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
        "X. [else];                    CONSTRAINT; requires a preceding",
        "X. [maybe];                   CONSTRAINT; Unknown constraint: maybe",
        "X. [];                        CONSTRAINT; Empty constraint",
        "X. [property];                PROPERTY;   Property name missing",
        "X. [if];                      EXPRESSION; Expression missing",
        "X. property p;                SYNTAX;     square brackets",
        "X. [single] trailing;         SYNTAX;     square brackets",
        "X. [property p] [if p] [if p]; CONSTRAINT; already has an",
        "X. [property p] [if (p];      EXPRESSION; Unmatched opening parenthesis"
    })
    public void testConstraintErrors(String choiceLine, ErrorType type, String message) {
        TslParseException e = parseError("Category:\n  " + choiceLine + "\n");
        assertEquals(type, e.type());
        assertEquals(2, e.lineNumber());
        assertTrue(e.getMessage().contains(message), e.getMessage());
    }

    @Test
    public void testChoiceBeforeCategory() {
        TslParseException e = parseError("Orphan.\n");
        assertEquals(ErrorType.SYNTAX, e.type());
        assertEquals(1, e.lineNumber());
    }

    @Test
    public void testNoCategoriesWithChoices() {
        TslParseException e = parseError("# Only headers\nEmpty:\n");
        assertEquals(ErrorType.SYNTAX, e.type());
    }

    @Test
    public void testNameLimits() {
        String longCategory = "C".repeat(TslLimits.MAX_CATEGORY_NAME_LENGTH + 1);
        assertEquals(ErrorType.SYNTAX, parseError(longCategory + ":\n  X.\n").type());

        String longChoice = "c".repeat(TslLimits.MAX_CHOICE_NAME_LENGTH) + ".";
        assertEquals(ErrorType.SYNTAX, parseError("Category:\n  " + longChoice + "\n").type());

        String longProperty = "p".repeat(TslLimits.MAX_PROPERTY_NAME_LENGTH + 1);
        assertEquals(ErrorType.PROPERTY, parseError("Category:\n  X. [property " + longProperty + "]\n").type());
    }

    @Test
    public void testMissingFile(@TempDir Path dir) {
        TslParseException e = assertThrows(TslParseException.class,
                () -> new TslParser().parse(dir.resolve("missing.tsl")));
        assertEquals(ErrorType.FILE_SYSTEM, e.type());
    }

    @Test
    public void testMessageShowsLineAndCaret() {
        TslParseException e = parseError("Category:\n  X. [nope]\n");
        String[] lines = e.getMessage().split("\n");
        assertTrue(lines[0].startsWith("constraint: Unknown constraint: nope"), lines[0]);
        assertTrue(lines[0].endsWith("(line 2, column 7)"), lines[0]);
        assertEquals("  |   X. [nope]", lines[1]);
        assertEquals("  | " + " ".repeat(6) + "^", lines[2]);
    }
}
