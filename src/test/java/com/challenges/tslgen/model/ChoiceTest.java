package com.challenges.tslgen.model;

import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ChoiceTest {
    private final Property a = Property.of("A");
    private final Property b = Property.of("B");

    // ============================================================
    // Structural invariants
    // ============================================================

    @Test
    public void testElseWithoutConditionIsRejected() {
        Choice.Builder builder = Choice.builder("Broken.").elseBranch();
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, builder::build);
        assertTrue(e.getMessage().contains("else branch but no condition"));
    }

    @Test
    public void testIfFrameTypeWithoutConditionIsRejected() {
        Choice.Builder builder = Choice.builder("Broken.").ifFrameType(FrameType.SINGLE);
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    public void testIfPropertiesWithoutConditionAreRejected() {
        Choice.Builder builder = Choice.builder("Broken.").ifProperty(a);
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    public void testElseFrameTypeWithoutElseIsRejected() {
        Choice.Builder builder = Choice.builder("Broken.").condition(Expression.of(a)).elseFrameType(FrameType.ERROR);
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    public void testElsePropertiesWithoutElseAreRejected() {
        Choice.Builder builder = Choice.builder("Broken.").condition(Expression.of(a)).elseProperty(b);
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    public void testBlankNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Choice.of("  "));
    }

    @Test
    public void testNullFrameTypeIsRejected() {
        assertThrows(NullPointerException.class, () -> new Choice("X.", Lists.immutable.empty(), null,
                Lists.immutable.empty(), Lists.immutable.empty(), false, null, FrameType.NORMAL, FrameType.NORMAL));
    }

    // ============================================================
    // Builder routing
    // ============================================================

    @Test
    public void testRoutingFollowsMostRecentConstraint() {
        Property c = Property.of("C");
        Choice choice = Choice.builder("Routed.")
                .routedProperty(a)
                .condition(Expression.of(b))
                .routedProperty(b)
                .routedFrameType(FrameType.SINGLE)
                .elseBranch()
                .routedProperty(c)
                .routedFrameType(FrameType.ERROR)
                .build();

        assertEquals(Lists.immutable.with(a), choice.properties());
        assertEquals(Lists.immutable.with(b), choice.ifProperties());
        assertEquals(Lists.immutable.with(c), choice.elseProperties());
        assertEquals(FrameType.NORMAL, choice.frameType());
        assertEquals(FrameType.SINGLE, choice.ifFrameType());
        assertEquals(FrameType.ERROR, choice.elseFrameType());
        assertTrue(choice.hasElse());
    }

    @Test
    public void testUnconditionalFrameType() {
        Choice single = Choice.builder("Single.").routedFrameType(FrameType.SINGLE).build();
        assertTrue(single.isUnconditionallySpecial());
        assertFalse(single.hasCondition());
        assertTrue(single.conditionIfPresent().isEmpty());
        assertFalse(Choice.of("Plain.").isUnconditionallySpecial());
    }
}
