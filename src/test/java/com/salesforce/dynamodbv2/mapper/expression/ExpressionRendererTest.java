/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.expression;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.QueryRequest;
import com.amazonaws.services.dynamodbv2.model.UpdateItemRequest;
import com.google.common.collect.ImmutableMap;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidConditionException;
import com.salesforce.dynamodbv2.mapper.model.Action;
import com.salesforce.dynamodbv2.mapper.testsupport.User;
import com.salesforce.dynamodbv2.mapper.tracking.ChangeTracker;
import com.salesforce.dynamodbv2.mapper.types.TypeEngine;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExpressionRendererTest {

    private final TypeEngine typeEngine = new TypeEngine();
    private ChangeTracker changeTracker;
    private User user;

    @BeforeEach
    void beforeEach() {
        changeTracker = new ChangeTracker(typeEngine);
        user = new User("u1");
    }

    private ExpressionRenderer<User> renderer() {
        return new ExpressionRenderer<>(User.SCHEMA, typeEngine, changeTracker);
    }

    @Test
    void setAndRemove() {
        user.setAge(30L);
        changeTracker.mark(user, User.AGE);
        changeTracker.mark(user, User.EMAIL);

        RenderedExpression rendered = renderer().update(user).build();

        assertEquals(Optional.of("REMOVE #n2 SET #n0=:v1"), rendered.getUpdateExpression());
        assertEquals(ImmutableMap.of("#n0", "age", "#n2", "email"), rendered.getAttributeNames().get());
        assertEquals(ImmutableMap.of(":v1", new AttributeValue().withN("30")), rendered.getAttributeValues().get());
    }

    @Test
    void keysAreNeverUpdated() {
        changeTracker.mark(user, User.ID);
        RenderedExpression rendered = renderer().update(user).build();
        assertFalse(rendered.getUpdateExpression().isPresent());
        assertFalse(rendered.getAttributeNames().isPresent());
    }

    @Test
    void actionsRenderInClauseOrder() {
        changeTracker.setAction(user, User.TAGS, Action.delete(Set.of("old")));
        changeTracker.setAction(user, User.AGE, Action.add(1L));
        changeTracker.setAction(user, User.NAME, Action.set("bob"));
        changeTracker.setAction(user, User.EMAIL, Action.remove());

        RenderedExpression rendered = renderer().update(user).build();

        assertEquals(Optional.of("ADD #n0 :v1 DELETE #n5 :v6 REMOVE #n2 SET #n3=:v4"),
            rendered.getUpdateExpression());
    }

    @Test
    void addingNothingIsSkipped() {
        changeTracker.setAction(user, User.TAGS, Action.add(Set.of()));
        RenderedExpression rendered = renderer().update(user).build();
        assertFalse(rendered.getUpdateExpression().isPresent());
        assertFalse(rendered.getAttributeNames().isPresent());
        assertFalse(rendered.getAttributeValues().isPresent());
    }

    @Test
    void updateRequiresObject() {
        assertThrows(InvalidConditionException.class, () -> renderer().update(null).build());
    }

    @Test
    void atomicConditionOfNewObject() {
        RenderedExpression rendered = renderer().condition(null, true, user).build();
        String expected = "((attribute_not_exists(#n0)) AND (attribute_not_exists(#n2)) AND "
            + "(attribute_not_exists(#n4)) AND (attribute_not_exists(#n6)) AND (attribute_not_exists(#n8)) AND "
            + "(attribute_not_exists(#n10)))";
        assertEquals(Optional.of(expected), rendered.getConditionExpression());
        assertFalse(rendered.getAttributeValues().isPresent());
        assertEquals(6, rendered.getAttributeNames().get().size());
    }

    @Test
    void explicitConditionIsAndedWithSnapshot() {
        user.setAge(30L);
        changeTracker.mark(user, User.AGE);
        changeTracker.sync(user, User.SCHEMA);

        RenderedExpression rendered = renderer()
            .condition(User.EMAIL.beginsWith("a"), true, user)
            .build();

        assertEquals(Optional.of("((begins_with(#n0, :v1)) AND (#n2 = :v3))"), rendered.getConditionExpression());
    }

    @Test
    void atomicRequiresObject() {
        assertThrows(InvalidConditionException.class, () -> renderer().condition(null, true, null).build());
    }

    @Test
    void nothingRequestedRendersNothing() {
        RenderedExpression rendered = renderer().condition(null, false, user).build();
        assertFalse(rendered.getConditionExpression().isPresent());
        UpdateItemRequest request = rendered.applyTo(new UpdateItemRequest());
        assertNull(request.getConditionExpression());
        assertNull(request.getExpressionAttributeNames());
    }

    @Test
    void queryExpressionsShareReferences() {
        RenderedExpression rendered = renderer()
            .filter(User.AGE.gt(18L))
            .projection(List.of(User.ID, User.AGE, User.AGE))
            .key(User.EMAIL.eq("a@b.c"))
            .build();

        QueryRequest request = rendered.applyTo(new QueryRequest());
        assertEquals("(#n0 > :v1)", request.getFilterExpression());
        assertEquals("#n2, #n0", request.getProjectionExpression());
        assertEquals("(#n3 = :v4)", request.getKeyConditionExpression());
        assertEquals(ImmutableMap.of("#n0", "age", "#n2", "id", "#n3", "email"),
            request.getExpressionAttributeNames());
    }

}
