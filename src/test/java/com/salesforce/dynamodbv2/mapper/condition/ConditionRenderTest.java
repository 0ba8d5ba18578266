/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.google.common.collect.ImmutableMap;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidConditionException;
import com.salesforce.dynamodbv2.mapper.testsupport.User;
import com.salesforce.dynamodbv2.mapper.types.TypeEngine;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Tests rendering conditions into DynamoDB expressions.
 */
class ConditionRenderTest {

    private ReferenceTracker tracker;

    @BeforeEach
    void beforeEach() {
        tracker = new ReferenceTracker(new TypeEngine());
    }

    private static Stream<Arguments> renderings() {
        return Stream.of(
            Arguments.of(User.AGE.eq(3L), "(#n0 = :v1)"),
            Arguments.of(User.AGE.ne(3L), "(#n0 <> :v1)"),
            Arguments.of(User.AGE.lt(3L), "(#n0 < :v1)"),
            Arguments.of(User.AGE.le(3L), "(#n0 <= :v1)"),
            Arguments.of(User.AGE.gt(3L), "(#n0 > :v1)"),
            Arguments.of(User.AGE.ge(3L), "(#n0 >= :v1)"),
            Arguments.of(User.AGE.between(1L, 9L), "(#n0 BETWEEN :v1 AND :v2)"),
            Arguments.of(User.EMAIL.beginsWith("a"), "(begins_with(#n0, :v1))"),
            Arguments.of(User.TAGS.contains("a"), "(contains(#n0, :v1))"),
            Arguments.of(User.AGE.in(1L, 2L), "(#n0 IN (:v1, :v2))"),
            Arguments.of(User.AGE.exists(), "(attribute_exists(#n0))"),
            Arguments.of(User.AGE.notExists(), "(attribute_not_exists(#n0))"),
            Arguments.of(User.AGE.isNull(), "(attribute_not_exists(#n0))"),
            Arguments.of(User.AGE.isNotNull(), "(attribute_exists(#n0))"),
            Arguments.of(User.AGE.eq(3L).not(), "(NOT (#n0 = :v1))"),
            Arguments.of(User.AGE.eq(3L).and(User.EMAIL.eq("e")), "((#n0 = :v1) AND (#n2 = :v3))"),
            Arguments.of(User.AGE.eq(3L).or(User.AGE.eq(4L)), "((#n0 = :v1) OR (#n0 = :v2))"),
            Arguments.of(User.AGE.eq(User.NAME), "(#n0 = #n1)"),
            Arguments.of(new AndCondition(User.AGE.eq(3L)), "(#n0 = :v1)")
        );
    }

    @ParameterizedTest(name = "{index}: {1}")
    @MethodSource("renderings")
    void render(Condition condition, String expected) {
        assertEquals(expected, condition.render(tracker));
    }

    @Test
    void renderingIsDeterministic() {
        Condition condition = User.AGE.ge(18L).and(User.EMAIL.beginsWith("a").or(User.NAME.isNull())).not();
        String first = condition.render(new ReferenceTracker(new TypeEngine()));
        String second = condition.render(new ReferenceTracker(new TypeEngine()));
        assertEquals(first, second);
    }

    @Test
    void namesAndValues() {
        User.AGE.eq(3L).and(User.NAME.eq("bob")).render(tracker);
        assertEquals(ImmutableMap.of("#n0", "age", "#n2", "nm"), tracker.getAttributeNames());
        assertEquals(ImmutableMap.of(":v1", new AttributeValue().withN("3"), ":v3", new AttributeValue().withS("bob")),
            tracker.getAttributeValues());
    }

    @Test
    void documentPaths() {
        assertEquals("(#n0.#n1[2] = :v2)", User.SCORES.get("x").get(2).eq(5L).render(tracker));
        assertEquals(ImmutableMap.of("#n0", "scores", "#n1", "x"), tracker.getAttributeNames());
        assertEquals(ImmutableMap.of(":v2", new AttributeValue().withN("5")), tracker.getAttributeValues());
    }

    @Test
    void nullValueDropsTheValuePlaceholder() {
        assertEquals("(attribute_not_exists(#n0))", User.EMAIL.eq(null).render(tracker));
        assertTrue(tracker.getAttributeValues().isEmpty());
        assertEquals(1, tracker.getCount("#n0"));
        assertEquals(0, tracker.getCount(":v1"));
    }

    @Test
    void emptySetComparesAsMissing() {
        assertEquals("(attribute_not_exists(#n0))", User.TAGS.eq(Set.of()).render(tracker));
        assertTrue(tracker.getAttributeValues().isEmpty());
    }

    @Test
    void invalidConditionLeavesNoPlaceholders() {
        assertThrows(InvalidConditionException.class, () -> User.AGE.lt(null).render(tracker));
        assertTrue(tracker.getAttributeNames().isEmpty());
        assertTrue(tracker.getAttributeValues().isEmpty());
    }

    @Test
    void invalidChildRollsBackSiblings() {
        Condition condition = User.EMAIL.eq("e").and(User.NAME.eq("n")).and(User.AGE.between(1L, null));
        assertThrows(InvalidConditionException.class, () -> condition.render(tracker));
        assertTrue(tracker.getAttributeNames().isEmpty());
        assertTrue(tracker.getAttributeValues().isEmpty());
    }

    @Test
    void emptyInIsInvalid() {
        assertThrows(InvalidConditionException.class, () -> User.AGE.in().render(tracker));
        assertThrows(InvalidConditionException.class, () -> User.AGE.in(1L, null).render(tracker));
        assertTrue(tracker.getAttributeNames().isEmpty());
        assertTrue(tracker.getAttributeValues().isEmpty());
    }

    @Test
    void emptyAndIsInvalid() {
        assertThrows(InvalidConditionException.class, () -> new AndCondition().render(tracker));
        assertThrows(InvalidConditionException.class, () -> new OrCondition(List.of()).render(tracker));
    }

    @Test
    void sharedNamesArePoppedByCount() {
        Reference first = tracker.nameRef(User.AGE);
        Reference second = tracker.nameRef(User.AGE);
        assertEquals(first.getName(), second.getName());
        assertEquals(2, tracker.getCount(first.getName()));
        tracker.popRefs(first);
        assertEquals(ImmutableMap.of("#n0", "age"), tracker.getAttributeNames());
        tracker.popRefs(second);
        assertTrue(tracker.getAttributeNames().isEmpty());
        // never below zero
        tracker.popRefs(second);
        assertEquals(0, tracker.getCount(first.getName()));
    }

}
