/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.tracking;

import static com.google.common.base.Preconditions.checkNotNull;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Iterables;
import com.google.common.collect.MapMaker;
import com.salesforce.dynamodbv2.mapper.condition.AndCondition;
import com.salesforce.dynamodbv2.mapper.condition.Condition;
import com.salesforce.dynamodbv2.mapper.model.Action;
import com.salesforce.dynamodbv2.mapper.model.Column;
import com.salesforce.dynamodbv2.mapper.model.ModelSchema;
import com.salesforce.dynamodbv2.mapper.types.TypeEngine;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentMap;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remembers, per model object, which columns were modified and what the object looked like when it was last loaded
 * or saved.
 *
 * <p>Objects are tracked by identity and held weakly, so tracking never keeps an object alive. The snapshot of an
 * object is a condition that holds if the stored item still has the values last seen by this process; it is used
 * as the precondition of atomic saves and deletes.
 */
public class ChangeTracker {

    private static final Logger LOG = LoggerFactory.getLogger(ChangeTracker.class);

    private final TypeEngine typeEngine;
    // MapMaker.weakKeys() compares keys by identity
    private final ConcurrentMap<Object, TrackedState> states = new MapMaker().weakKeys().makeMap();

    public ChangeTracker(TypeEngine typeEngine) {
        this.typeEngine = checkNotNull(typeEngine, "typeEngine is required");
    }

    /**
     * Records that a column of the object changed. Marks accumulate until the object is deleted.
     */
    public void mark(Object obj, Column<?, ?> column) {
        state(obj).marked.add(column);
    }

    /**
     * Columns marked on the object, in the order they were first marked.
     */
    public Set<Column<?, ?>> getMarked(Object obj) {
        TrackedState state = states.get(obj);
        return state == null ? Set.of() : new LinkedHashSet<>(state.marked);
    }

    /**
     * Records an explicit update for a column, replacing any earlier one, and marks the column.
     */
    public void setAction(Object obj, Column<?, ?> column, Action action) {
        TrackedState state = state(obj);
        state.marked.add(column);
        state.actions.put(column, checkNotNull(action, "action is required"));
    }

    public Map<Column<?, ?>, Action> getActions(Object obj) {
        TrackedState state = states.get(obj);
        return state == null ? Map.of() : new LinkedHashMap<>(state.actions);
    }

    /**
     * Returns the object's snapshot. An object that was never loaded or saved gets a snapshot expecting every column
     * to be absent, which is cached like a synced one.
     */
    public <M> Condition getSnapshot(M obj, ModelSchema<M> schema) {
        TrackedState state = state(obj);
        if (state.snapshot == null) {
            AndCondition snapshot = new AndCondition();
            for (Column<M, ?> column : schema.getColumnsByDynamoName()) {
                snapshot.add(column.isNull());
            }
            state.snapshot = snapshot;
        }
        return state.snapshot;
    }

    /**
     * Rebuilds the snapshot from the object's current values after a successful load or save.
     *
     * <p>Only marked, non-key columns are included. Values are dumped now so that later changes to a mutable value
     * can't leak into the snapshot. Recorded actions are dropped.
     *
     * @return the new snapshot
     */
    public <M> Condition sync(M obj, ModelSchema<M> schema) {
        TrackedState state = state(obj);
        AndCondition snapshot = new AndCondition();
        for (Column<M, ?> column : schema.getColumnsByDynamoName()) {
            if (column.isKey() || !state.marked.contains(column)) {
                continue;
            }
            AttributeValue dumped = typeEngine.dump(column.getType(), column.get(obj));
            snapshot.add(column.eq(dumped).setDumped(true));
        }
        state.snapshot = snapshot;
        state.actions.clear();
        if (LOG.isDebugEnabled()) {
            LOG.debug("synced {} with snapshot {}", schema.getModelClass().getSimpleName(), snapshot);
        }
        return snapshot;
    }

    /**
     * Forgets everything about the object, e.g. after it was deleted.
     */
    public void clear(Object obj) {
        states.remove(obj);
    }

    /**
     * Number of objects still tracked. Entries of collected objects are not counted even before they are purged.
     */
    @VisibleForTesting
    int trackedCount() {
        return Iterables.size(states.keySet());
    }

    @Nullable
    Condition peekSnapshot(Object obj) {
        TrackedState state = states.get(obj);
        return state == null ? null : state.snapshot;
    }

    private TrackedState state(Object obj) {
        return states.computeIfAbsent(checkNotNull(obj, "obj is required"), o -> new TrackedState());
    }

    private static final class TrackedState {

        private final Set<Column<?, ?>> marked = new LinkedHashSet<>();
        private final Map<Column<?, ?>, Action> actions = new LinkedHashMap<>();
        private Condition snapshot;

    }

}
