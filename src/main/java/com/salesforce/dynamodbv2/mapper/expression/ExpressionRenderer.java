/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.expression;

import static com.google.common.base.Preconditions.checkNotNull;

import com.salesforce.dynamodbv2.mapper.condition.AttributePath;
import com.salesforce.dynamodbv2.mapper.condition.Condition;
import com.salesforce.dynamodbv2.mapper.condition.Reference;
import com.salesforce.dynamodbv2.mapper.condition.ReferenceTracker;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidConditionException;
import com.salesforce.dynamodbv2.mapper.model.Action;
import com.salesforce.dynamodbv2.mapper.model.ActionType;
import com.salesforce.dynamodbv2.mapper.model.Column;
import com.salesforce.dynamodbv2.mapper.model.ModelSchema;
import com.salesforce.dynamodbv2.mapper.tracking.ChangeTracker;
import com.salesforce.dynamodbv2.mapper.types.TypeEngine;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders the expressions of one request. Callers state what they need, then {@link #build()} renders it in a fixed
 * order (filter, projection, key, condition, update) so the same request always produces the same placeholders.
 *
 * <pre>
 * RenderedExpression rendered = new ExpressionRenderer&lt;&gt;(schema, typeEngine, tracker)
 *     .condition(User.AGE.ge(18), true, user)
 *     .update(user)
 *     .build();
 * UpdateItemRequest request = rendered.applyTo(new UpdateItemRequest().withTableName(table).withKey(key));
 * </pre>
 *
 * <p>A renderer is good for a single {@code build()}.
 *
 * @param <M> the model class
 */
public class ExpressionRenderer<M> {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionRenderer.class);

    private final ModelSchema<M> schema;
    private final ChangeTracker changeTracker;
    private final ReferenceTracker refs;

    private Condition filter;
    private Collection<? extends AttributePath> projection;
    private Condition key;
    private Condition condition;
    private boolean atomic;
    private boolean conditionRequested;
    private M conditionObject;
    private boolean updateRequested;
    private M updateObject;

    public ExpressionRenderer(ModelSchema<M> schema, TypeEngine typeEngine, ChangeTracker changeTracker) {
        this.schema = checkNotNull(schema, "schema is required");
        this.changeTracker = checkNotNull(changeTracker, "changeTracker is required");
        this.refs = new ReferenceTracker(checkNotNull(typeEngine, "typeEngine is required"));
    }

    public ExpressionRenderer<M> filter(Condition filter) {
        this.filter = filter;
        return this;
    }

    public ExpressionRenderer<M> projection(Collection<? extends AttributePath> projection) {
        this.projection = projection;
        return this;
    }

    public ExpressionRenderer<M> key(Condition key) {
        this.key = key;
        return this;
    }

    /**
     * Requests a condition expression.
     *
     * @param condition the explicit condition, may be null
     * @param atomic    whether to also require the object's snapshot
     * @param obj       the object the snapshot is taken from; required when {@code atomic} is set
     */
    public ExpressionRenderer<M> condition(@Nullable Condition condition, boolean atomic, @Nullable M obj) {
        this.conditionRequested = true;
        this.condition = condition;
        this.atomic = atomic;
        this.conditionObject = obj;
        return this;
    }

    /**
     * Requests an update expression for the columns marked on the object.
     */
    public ExpressionRenderer<M> update(@Nullable M obj) {
        this.updateRequested = true;
        this.updateObject = obj;
        return this;
    }

    public RenderedExpression build() {
        String filterExpression = filter == null || filter.isEmpty() ? null : filter.render(refs);
        String projectionExpression = projection == null ? null : renderProjection(projection);
        String keyExpression = key == null || key.isEmpty() ? null : key.render(refs);
        String conditionExpression = conditionRequested ? renderCondition() : null;
        String updateExpression = null;
        if (updateRequested) {
            if (updateObject == null) {
                throw new InvalidConditionException("an update requires the object being updated");
            }
            updateExpression = renderUpdate(updateObject);
        }
        RenderedExpression rendered = new RenderedExpression(conditionExpression, filterExpression, keyExpression,
            projectionExpression, updateExpression, refs.getAttributeNames(), refs.getAttributeValues());
        if (LOG.isDebugEnabled()) {
            LOG.debug("rendered {}", rendered);
        }
        return rendered;
    }

    @Nullable
    private String renderCondition() {
        Condition combined = condition == null ? Condition.empty() : condition;
        if (atomic) {
            if (conditionObject == null) {
                throw new InvalidConditionException("an atomic condition requires the object being written");
            }
            combined = combined.and(changeTracker.getSnapshot(conditionObject, schema));
        }
        return combined.isEmpty() ? null : combined.render(refs);
    }

    @Nullable
    private String renderProjection(Collection<? extends AttributePath> columns) {
        Set<AttributePath> distinct = new LinkedHashSet<>(columns);
        if (distinct.isEmpty()) {
            return null;
        }
        return distinct.stream()
            .map(column -> refs.nameRef(column).getName())
            .collect(Collectors.joining(", "));
    }

    @Nullable
    private String renderUpdate(M obj) {
        Set<Column<?, ?>> marked = changeTracker.getMarked(obj);
        Map<Column<?, ?>, Action> actions = changeTracker.getActions(obj);
        Map<ActionType, List<String>> clauses = new EnumMap<>(ActionType.class);
        for (Column<M, ?> column : schema.getColumnsByDynamoName()) {
            if (column.isKey() || !marked.contains(column)) {
                continue;
            }
            Action action = actions.get(column);
            if (action == null) {
                action = Action.set(column.get(obj));
            }
            Reference name = refs.nameRef(column);
            ActionType type = action.getType();
            String value = null;
            if (type != ActionType.REMOVE) {
                Reference valueRef = refs.valueRef(column, action.getValue(), false, false);
                if (valueRef.isEmptyValue()) {
                    if (type == ActionType.SET) {
                        refs.popRefs(valueRef);
                        type = ActionType.REMOVE;
                    } else {
                        // adding or deleting nothing leaves the attribute unchanged
                        refs.popRefs(name, valueRef);
                        continue;
                    }
                } else {
                    value = valueRef.getName();
                }
            }
            clauses.computeIfAbsent(type, t -> new ArrayList<>()).add(type.render(name.getName(), value));
        }
        if (clauses.isEmpty()) {
            return null;
        }
        return clauses.entrySet().stream()
            .map(clause -> clause.getKey().getWireKey() + " " + String.join(", ", clause.getValue()))
            .collect(Collectors.joining(" "));
    }

}
