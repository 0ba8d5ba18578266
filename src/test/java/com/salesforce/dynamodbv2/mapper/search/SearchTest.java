/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.amazonaws.services.dynamodbv2.AmazonDynamoDB;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.QueryRequest;
import com.amazonaws.services.dynamodbv2.model.QueryResult;
import com.amazonaws.services.dynamodbv2.model.ScanRequest;
import com.amazonaws.services.dynamodbv2.model.ScanResult;
import com.amazonaws.services.dynamodbv2.model.Select;
import com.google.common.collect.ImmutableMap;
import com.salesforce.dynamodbv2.mapper.exceptions.ConstraintViolationException;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidSearchException;
import com.salesforce.dynamodbv2.mapper.model.Column;
import com.salesforce.dynamodbv2.mapper.model.ModelSchema;
import com.salesforce.dynamodbv2.mapper.session.SessionWrapper;
import com.salesforce.dynamodbv2.mapper.testsupport.Event;
import com.salesforce.dynamodbv2.mapper.testsupport.User;
import com.salesforce.dynamodbv2.mapper.tracking.ChangeTracker;
import com.salesforce.dynamodbv2.mapper.types.TypeEngine;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SearchTest {

    private final TypeEngine typeEngine = new TypeEngine();
    private AmazonDynamoDB dynamoDb;
    private SessionWrapper session;
    private List<Collection<? extends Column<?, ?>>> loadedColumns;

    @BeforeEach
    void beforeEach() {
        dynamoDb = mock(AmazonDynamoDB.class);
        session = SessionWrapper.builder(dynamoDb).build();
        loadedColumns = new ArrayList<>();
    }

    private <M> Search<M> search(Search.Mode mode, ModelSchema<M> schema) {
        return new Search<>(mode, schema, "tbl", session, typeEngine, new ChangeTracker(typeEngine),
            (obj, columns) -> loadedColumns.add(columns));
    }

    private static Map<String, AttributeValue> userItem(String id) {
        return ImmutableMap.of("id", new AttributeValue().withS(id), "age", new AttributeValue().withN("7"));
    }

    private QueryRequest capturedQuery() {
        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(dynamoDb).query(captor.capture());
        return captor.getValue();
    }

    @Test
    void queryByHashKey() {
        when(dynamoDb.query(any(QueryRequest.class)))
            .thenReturn(new QueryResult().withItems(userItem("u1")));

        List<User> users = StreamSupport.stream(search(Search.Mode.QUERY, User.SCHEMA)
            .withKey(User.ID.eq("u1")).spliterator(), false).collect(Collectors.toList());

        assertEquals(1, users.size());
        assertEquals("u1", users.get(0).getId());
        assertEquals(7L, users.get(0).getAge());
        assertEquals(1, loadedColumns.size());
        assertEquals(User.SCHEMA.getColumns(), loadedColumns.get(0));

        QueryRequest request = capturedQuery();
        assertEquals("tbl", request.getTableName());
        assertNull(request.getIndexName());
        assertEquals("(#n0 = :v1)", request.getKeyConditionExpression());
        assertEquals(ImmutableMap.of("#n0", "id"), request.getExpressionAttributeNames());
        assertEquals(ImmutableMap.of(":v1", new AttributeValue().withS("u1")),
            request.getExpressionAttributeValues());
        assertEquals(Select.ALL_ATTRIBUTES.toString(), request.getSelect());
        assertTrue(request.getScanIndexForward());
        assertNull(request.getExclusiveStartKey());
    }

    @Test
    void keyConditionsAcceptHashAndRangeInEitherOrder() {
        when(dynamoDb.query(any(QueryRequest.class))).thenReturn(new QueryResult());
        search(Search.Mode.QUERY, Event.SCHEMA).withKey(Event.ACCOUNT.eq("a").and(Event.SEQUENCE.gt(5L)))
            .iterator().hasNext();
        search(Search.Mode.QUERY, Event.SCHEMA).withKey(Event.SEQUENCE.between(1L, 5L).and(Event.ACCOUNT.eq("a")))
            .iterator().hasNext();
        verify(dynamoDb, times(2)).query(any(QueryRequest.class));
    }

    @Test
    void invalidKeyConditions() {
        assertThrows(InvalidSearchException.class,
            () -> search(Search.Mode.QUERY, User.SCHEMA).iterator());
        assertThrows(InvalidSearchException.class,
            () -> search(Search.Mode.QUERY, User.SCHEMA).withKey(User.ID.ne("u1")).iterator());
        assertThrows(InvalidSearchException.class,
            () -> search(Search.Mode.QUERY, User.SCHEMA).withKey(User.EMAIL.eq("e")).iterator());
        assertThrows(InvalidSearchException.class,
            () -> search(Search.Mode.QUERY, Event.SCHEMA)
                .withKey(Event.ACCOUNT.eq("a").and(Event.SEQUENCE.ne(5L))).iterator());
        assertThrows(InvalidSearchException.class,
            () -> search(Search.Mode.QUERY, Event.SCHEMA)
                .withKey(Event.ACCOUNT.eq("a").or(Event.SEQUENCE.gt(5L))).iterator());
        assertThrows(InvalidSearchException.class,
            () -> search(Search.Mode.QUERY, Event.SCHEMA)
                .withKey(Event.ACCOUNT.eq("a").and(Event.SEQUENCE.gt(5L)).and(Event.KIND.eq("k"))).iterator());
        assertThrows(InvalidSearchException.class,
            () -> search(Search.Mode.SCAN, User.SCHEMA).withKey(User.ID.eq("u1")).iterator());
    }

    @Test
    void queryOnGlobalIndex() {
        when(dynamoDb.query(any(QueryRequest.class))).thenReturn(new QueryResult().withItems(userItem("u1")));

        search(Search.Mode.QUERY, User.SCHEMA).withIndex("by_email").withKey(User.EMAIL.eq("e")).iterator().next();

        QueryRequest request = capturedQuery();
        assertEquals("by_email", request.getIndexName());
        assertEquals(Select.ALL_PROJECTED_ATTRIBUTES.toString(), request.getSelect());
        assertEquals(Set.of(User.ID, User.EMAIL), new HashSet<>(loadedColumns.get(0)));
    }

    @Test
    void globalIndexRestrictions() {
        assertThrows(InvalidSearchException.class,
            () -> search(Search.Mode.QUERY, User.SCHEMA).withIndex("missing"));
        assertThrows(InvalidSearchException.class,
            () -> search(Search.Mode.QUERY, User.SCHEMA).withIndex("by_email").withKey(User.EMAIL.eq("e"))
                .withConsistent(true).iterator());
        assertThrows(InvalidSearchException.class,
            () -> search(Search.Mode.QUERY, User.SCHEMA).withIndex("by_email").withKey(User.EMAIL.eq("e"))
                .withProjection(User.AGE).iterator());
    }

    @Test
    void localIndexLoadsEveryColumn() {
        when(dynamoDb.query(any(QueryRequest.class))).thenReturn(new QueryResult().withItems(ImmutableMap.of(
            "account", new AttributeValue().withS("a"), "sequence", new AttributeValue().withN("1"))));

        search(Search.Mode.QUERY, Event.SCHEMA).withIndex("by_kind")
            .withKey(Event.ACCOUNT.eq("a").and(Event.KIND.eq("k")))
            .withConsistent(true)
            .iterator().next();

        QueryRequest request = capturedQuery();
        assertEquals("by_kind", request.getIndexName());
        assertTrue(request.getConsistentRead());
        assertEquals(Event.SCHEMA.getColumns(), loadedColumns.get(0));
    }

    @Test
    void projectionAlwaysIncludesKeys() {
        when(dynamoDb.query(any(QueryRequest.class))).thenReturn(new QueryResult().withItems(userItem("u1")));

        search(Search.Mode.QUERY, User.SCHEMA).withKey(User.ID.eq("u1")).withProjection(User.AGE).iterator().next();

        QueryRequest request = capturedQuery();
        assertEquals(Select.SPECIFIC_ATTRIBUTES.toString(), request.getSelect());
        assertEquals("#n0, #n1", request.getProjectionExpression());
        assertEquals("(#n1 = :v2)", request.getKeyConditionExpression());
        assertEquals(ImmutableMap.of("#n0", "age", "#n1", "id"), request.getExpressionAttributeNames());
        assertEquals(List.of(User.AGE, User.ID), new ArrayList<>(loadedColumns.get(0)));
    }

    @Test
    void projectionRejectsForeignColumns() {
        assertThrows(InvalidSearchException.class,
            () -> search(Search.Mode.SCAN, User.SCHEMA).withProjection((Column) Event.KIND).iterator());
    }

    @Test
    void followsPages() {
        Map<String, AttributeValue> lastKey = ImmutableMap.of("id", new AttributeValue().withS("u2"));
        when(dynamoDb.scan(any(ScanRequest.class)))
            .thenReturn(new ScanResult().withItems(userItem("u1"), userItem("u2")).withScannedCount(4)
                .withLastEvaluatedKey(lastKey))
            .thenReturn(new ScanResult().withItems(userItem("u3")));

        SearchIterator<User> it = search(Search.Mode.SCAN, User.SCHEMA).withFilter(User.AGE.gt(5L)).iterator();
        List<String> ids = new ArrayList<>();
        it.forEachRemaining(user -> ids.add(user.getId()));

        assertEquals(List.of("u1", "u2", "u3"), ids);
        assertEquals(3, it.getCount());
        assertEquals(5, it.getScanned());
        assertTrue(it.isExhausted());

        ArgumentCaptor<ScanRequest> captor = ArgumentCaptor.forClass(ScanRequest.class);
        verify(dynamoDb, times(2)).scan(captor.capture());
        assertNull(captor.getAllValues().get(0).getExclusiveStartKey());
        assertEquals(lastKey, captor.getAllValues().get(1).getExclusiveStartKey());
        assertEquals("(#n0 > :v1)", captor.getAllValues().get(1).getFilterExpression());
    }

    @Test
    void limitCapsResults() {
        when(dynamoDb.scan(any(ScanRequest.class)))
            .thenReturn(new ScanResult().withItems(userItem("u1"), userItem("u2"), userItem("u3")));

        SearchIterator<User> it = search(Search.Mode.SCAN, User.SCHEMA).withLimit(2).iterator();
        it.next();
        it.next();

        assertFalse(it.hasNext());
        assertTrue(it.isExhausted());
    }

    @Test
    void countOnly() {
        when(dynamoDb.scan(any(ScanRequest.class))).thenReturn(new ScanResult().withCount(5).withScannedCount(9));

        SearchIterator<User> it = search(Search.Mode.SCAN, User.SCHEMA).withProjectCount().iterator();

        assertFalse(it.hasNext());
        assertEquals(5, it.getCount());
        assertEquals(9, it.getScanned());
        ArgumentCaptor<ScanRequest> captor = ArgumentCaptor.forClass(ScanRequest.class);
        verify(dynamoDb).scan(captor.capture());
        assertEquals(Select.COUNT.toString(), captor.getValue().getSelect());
    }

    @Test
    void parallelScan() {
        when(dynamoDb.scan(any(ScanRequest.class))).thenReturn(new ScanResult());
        search(Search.Mode.SCAN, User.SCHEMA).withParallel(1, 4).iterator().hasNext();

        ArgumentCaptor<ScanRequest> captor = ArgumentCaptor.forClass(ScanRequest.class);
        verify(dynamoDb).scan(captor.capture());
        assertEquals(1, captor.getValue().getSegment());
        assertEquals(4, captor.getValue().getTotalSegments());

        assertThrows(InvalidSearchException.class,
            () -> search(Search.Mode.QUERY, User.SCHEMA).withKey(User.ID.eq("u1")).withParallel(0, 2).iterator());
        assertThrows(IllegalArgumentException.class,
            () -> search(Search.Mode.SCAN, User.SCHEMA).withParallel(2, 2));
    }

    @Test
    void firstAndOne() {
        when(dynamoDb.scan(any(ScanRequest.class)))
            .thenReturn(new ScanResult())
            .thenReturn(new ScanResult().withItems(userItem("u1"), userItem("u2")))
            .thenReturn(new ScanResult().withItems(userItem("u1"), userItem("u2")))
            .thenReturn(new ScanResult().withItems(userItem("u1")));
        SearchIterator<User> it = search(Search.Mode.SCAN, User.SCHEMA).iterator();

        ConstraintViolationException none = assertThrows(ConstraintViolationException.class, it::first);
        assertEquals("scan", none.getOperation());
        assertEquals("u1", it.first().getId());
        assertThrows(ConstraintViolationException.class, it::one);
        assertEquals("u1", it.one().getId());
    }

    @Test
    void oneSeesResultsBeyondTheLimit() {
        when(dynamoDb.scan(any(ScanRequest.class)))
            .thenReturn(new ScanResult().withItems(userItem("u1"))
                .withLastEvaluatedKey(ImmutableMap.of("id", new AttributeValue().withS("u1"))))
            .thenReturn(new ScanResult().withItems(userItem("u2")));

        SearchIterator<User> it = search(Search.Mode.SCAN, User.SCHEMA).withLimit(1).iterator();

        assertThrows(ConstraintViolationException.class, it::one);
    }

    @Test
    void eachIterationStartsOver() {
        when(dynamoDb.scan(any(ScanRequest.class))).thenReturn(new ScanResult().withItems(userItem("u1")));
        Search<User> search = search(Search.Mode.SCAN, User.SCHEMA);
        Set<String> ids = new HashSet<>();
        for (User user : search) {
            ids.add(user.getId());
        }
        for (User user : search) {
            ids.add(user.getId());
        }
        assertEquals(Set.of("u1"), ids);
        verify(dynamoDb, times(2)).scan(any(ScanRequest.class));
    }

}
