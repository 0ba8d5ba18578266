/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.search;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.amazonaws.services.dynamodbv2.model.ProjectionType;
import com.amazonaws.services.dynamodbv2.model.QueryRequest;
import com.amazonaws.services.dynamodbv2.model.ScanRequest;
import com.amazonaws.services.dynamodbv2.model.Select;
import com.google.common.base.MoreObjects;
import com.salesforce.dynamodbv2.mapper.condition.Condition;
import com.salesforce.dynamodbv2.mapper.condition.ConditionOperation;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidSearchException;
import com.salesforce.dynamodbv2.mapper.expression.ExpressionRenderer;
import com.salesforce.dynamodbv2.mapper.expression.RenderedExpression;
import com.salesforce.dynamodbv2.mapper.model.Column;
import com.salesforce.dynamodbv2.mapper.model.Index;
import com.salesforce.dynamodbv2.mapper.model.ModelSchema;
import com.salesforce.dynamodbv2.mapper.session.SessionWrapper;
import com.salesforce.dynamodbv2.mapper.tracking.ChangeTracker;
import com.salesforce.dynamodbv2.mapper.types.TypeEngine;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiConsumer;
import javax.annotation.Nullable;

/**
 * A query or scan against a model's table or one of its indexes.
 *
 * <pre>
 * for (User user : engine.query(userSchema)
 *         .withIndex("by_email")
 *         .withKey(User.EMAIL.eq("user@example.com"))
 *         .withFilter(User.AGE.ge(18))) {
 *     ...
 * }
 * </pre>
 *
 * <p>Each call to {@link #iterator()} validates the search and starts a new, independent iteration.
 *
 * @param <M> the model class
 */
public class Search<M> implements Iterable<M> {

    public enum Mode {
        QUERY,
        SCAN
    }

    private enum Projection {
        ALL,
        COUNT,
        COLUMNS
    }

    private final Mode mode;
    private final ModelSchema<M> schema;
    private final String tableName;
    private final SessionWrapper session;
    private final TypeEngine typeEngine;
    private final ChangeTracker changeTracker;
    private final BiConsumer<M, Collection<Column<M, ?>>> onLoaded;

    @Nullable
    private Index<M> index;
    @Nullable
    private Condition key;
    @Nullable
    private Condition filter;
    private Projection projection = Projection.ALL;
    private final List<Column<M, ?>> columns = new ArrayList<>();
    private boolean consistent;
    private boolean forward = true;
    private int limit;
    @Nullable
    private Integer segment;
    @Nullable
    private Integer totalSegments;

    /**
     * Creates a search.
     *
     * @param onLoaded called with each object loaded from a result and the columns loaded into it
     */
    public Search(Mode mode, ModelSchema<M> schema, String tableName, SessionWrapper session, TypeEngine typeEngine,
                  ChangeTracker changeTracker, BiConsumer<M, Collection<Column<M, ?>>> onLoaded) {
        this.mode = checkNotNull(mode, "mode is required");
        this.schema = checkNotNull(schema, "schema is required");
        this.tableName = checkNotNull(tableName, "tableName is required");
        this.session = checkNotNull(session, "session is required");
        this.typeEngine = checkNotNull(typeEngine, "typeEngine is required");
        this.changeTracker = checkNotNull(changeTracker, "changeTracker is required");
        this.onLoaded = checkNotNull(onLoaded, "onLoaded is required");
    }

    public Search<M> withIndex(String indexName) {
        this.index = schema.getIndex(indexName)
            .orElseThrow(() -> new InvalidSearchException(schema.getModelClass().getSimpleName()
                + " has no index " + indexName));
        return this;
    }

    /**
     * The key condition of a query: the hash key compared with {@code =}, optionally and-ed with one condition on the
     * range key.
     */
    public Search<M> withKey(Condition key) {
        this.key = key;
        return this;
    }

    public Search<M> withFilter(Condition filter) {
        this.filter = filter;
        return this;
    }

    /**
     * Loads every column available on the table or index. This is the default.
     */
    public Search<M> withProjectAll() {
        this.projection = Projection.ALL;
        this.columns.clear();
        return this;
    }

    /**
     * Only counts matching items; the iteration yields no objects.
     */
    public Search<M> withProjectCount() {
        this.projection = Projection.COUNT;
        this.columns.clear();
        return this;
    }

    @SafeVarargs
    public final Search<M> withProjection(Column<M, ?>... columns) {
        checkArgument(columns.length > 0, "projection needs at least one column");
        this.projection = Projection.COLUMNS;
        this.columns.clear();
        this.columns.addAll(Arrays.asList(columns));
        return this;
    }

    public Search<M> withConsistent(boolean consistent) {
        this.consistent = consistent;
        return this;
    }

    /**
     * Query direction over the range key; ignored for scans.
     */
    public Search<M> withForward(boolean forward) {
        this.forward = forward;
        return this;
    }

    /**
     * Maximum number of objects to yield, or 0 for no limit.
     */
    public Search<M> withLimit(int limit) {
        checkArgument(limit >= 0, "limit must not be negative");
        this.limit = limit;
        return this;
    }

    /**
     * Makes a scan cover only one segment of a parallel scan.
     */
    public Search<M> withParallel(int segment, int totalSegments) {
        checkArgument(totalSegments > 0 && segment >= 0 && segment < totalSegments,
            "segment must be in [0, totalSegments)");
        this.segment = segment;
        this.totalSegments = totalSegments;
        return this;
    }

    /**
     * Validates the search and starts iterating it.
     *
     * @throws InvalidSearchException if the search is malformed
     */
    @Override
    public SearchIterator<M> iterator() {
        validate();
        Collection<Column<M, ?>> loaded = loadedColumns();
        ExpressionRenderer<M> renderer = new ExpressionRenderer<>(schema, typeEngine, changeTracker);
        if (filter != null) {
            renderer.filter(filter);
        }
        if (projection == Projection.COLUMNS) {
            renderer.projection(loaded);
        }
        if (mode == Mode.QUERY) {
            renderer.key(key);
        }
        RenderedExpression rendered = renderer.build();
        Select select = select();
        String indexName = index == null ? null : index.getName();
        if (mode == Mode.QUERY) {
            QueryRequest request = rendered.applyTo(new QueryRequest()
                .withTableName(tableName)
                .withIndexName(indexName)
                .withSelect(select)
                .withConsistentRead(consistent)
                .withScanIndexForward(forward));
            return new SearchIterator<>(schema, session, typeEngine, onLoaded, loaded, limit, request);
        }
        ScanRequest request = rendered.applyTo(new ScanRequest()
            .withTableName(tableName)
            .withIndexName(indexName)
            .withSelect(select)
            .withConsistentRead(consistent)
            .withSegment(segment)
            .withTotalSegments(totalSegments));
        return new SearchIterator<>(schema, session, typeEngine, onLoaded, loaded, limit, request);
    }

    private void validate() {
        if (mode == Mode.QUERY) {
            if (key == null || key.isEmpty()) {
                throw new InvalidSearchException("a query requires a key condition");
            }
            validateKey(key);
        } else if (key != null && !key.isEmpty()) {
            throw new InvalidSearchException("a scan doesn't take a key condition");
        }
        if (mode == Mode.QUERY && segment != null) {
            throw new InvalidSearchException("only scans can be parallel");
        }
        if (consistent && index != null && index.isGlobal()) {
            throw new InvalidSearchException("global index " + index.getName() + " doesn't support consistent reads");
        }
        if (projection == Projection.COLUMNS) {
            for (Column<M, ?> column : columns) {
                if (!schema.owns(column)) {
                    throw new InvalidSearchException("column " + column.getName() + " is not part of "
                        + schema.getModelClass().getSimpleName());
                }
                if (index != null && index.isGlobal() && !index.getProjected().contains(column)) {
                    throw new InvalidSearchException("global index " + index.getName() + " doesn't project "
                        + column.getName());
                }
            }
        }
    }

    private void validateKey(Condition key) {
        Column<M, ?> hashKey = index == null ? schema.getHashKey() : index.getHashKey();
        Column<M, ?> rangeKey = index == null ? schema.getRangeKey().orElse(null)
            : index.getRangeKey().orElse(null);
        if (isHashKeyCondition(key, hashKey)) {
            return;
        }
        if (rangeKey == null) {
            throw new InvalidSearchException("the key condition for a query on " + target() + " must be "
                + hashKey.getName() + " == value");
        }
        // an and with exactly one hash key and one range key condition, in either order
        if (key.getOperation() == ConditionOperation.AND && key.getValues().size() == 2) {
            Condition first = (Condition) key.getValues().get(0);
            Condition second = (Condition) key.getValues().get(1);
            if (isHashKeyCondition(first, hashKey) && isRangeKeyCondition(second, rangeKey)
                || isRangeKeyCondition(first, rangeKey) && isHashKeyCondition(second, hashKey)) {
                return;
            }
        }
        throw new InvalidSearchException("invalid key condition " + key + " for a query on " + target());
    }

    private static boolean isHashKeyCondition(Condition condition, Column<?, ?> hashKey) {
        return condition.getOperation() == ConditionOperation.EQ && condition.getAttribute() == hashKey;
    }

    private static boolean isRangeKeyCondition(Condition condition, Column<?, ?> rangeKey) {
        ConditionOperation operation = condition.getOperation();
        if (operation == null || condition.getAttribute() != rangeKey) {
            return false;
        }
        return operation.isComparison() && operation != ConditionOperation.NE
            || operation == ConditionOperation.BEGINS_WITH
            || operation == ConditionOperation.BETWEEN;
    }

    private Collection<Column<M, ?>> loadedColumns() {
        switch (projection) {
            case COUNT:
                return List.of();
            case COLUMNS:
                Set<Column<M, ?>> loaded = new LinkedHashSet<>(columns);
                // keys are always returned and are needed to save the object later
                loaded.addAll(schema.getKeys());
                return loaded;
            default:
                if (index == null || index.getProjectionType() == ProjectionType.ALL) {
                    return schema.getColumns();
                }
                if (index.isGlobal()) {
                    return List.copyOf(index.getProjected());
                }
                // a local index fetches missing columns from the table
                return schema.getColumns();
        }
    }

    private Select select() {
        switch (projection) {
            case COUNT:
                return Select.COUNT;
            case COLUMNS:
                return Select.SPECIFIC_ATTRIBUTES;
            default:
                if (index != null && index.isGlobal()
                    && index.getProjectionType() != ProjectionType.ALL) {
                    return Select.ALL_PROJECTED_ATTRIBUTES;
                }
                return Select.ALL_ATTRIBUTES;
        }
    }

    private String target() {
        return schema.getModelClass().getSimpleName() + (index == null ? "" : "." + index.getName());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("mode", mode)
            .add("target", target())
            .add("key", key)
            .add("filter", filter)
            .toString();
    }

}
