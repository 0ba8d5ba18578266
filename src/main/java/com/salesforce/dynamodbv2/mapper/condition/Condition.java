/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A node in a condition tree. Conditions are built from {@link AttributePath} factories and combined with
 * {@link #and}, {@link #or} and {@link #not}:
 *
 * <pre>
 * Condition condition = User.AGE.ge(18).and(User.EMAIL.beginsWith("admin@")).or(User.ID.eq("root"));
 * </pre>
 *
 * <p>The set of node kinds is closed; every subclass lives in this package. {@link EmptyCondition} is the identity
 * for {@code and}/{@code or} and its own negation. Combining two nodes of the same meta kind flattens them into one
 * node instead of nesting.
 *
 * <p>Nodes are immutable except for {@link AndCondition#add} and {@link OrCondition#add}, which extend a node in
 * place. Trees may therefore contain cycles; size, iteration, equality and rendering all visit each node at most
 * once.
 */
public abstract class Condition {

    @Nullable
    private final ConditionOperation operation;
    @Nullable
    private final AttributePath attribute;
    final List<Object> values;
    private boolean dumped;

    Condition(@Nullable ConditionOperation operation, @Nullable AttributePath attribute, List<?> values) {
        this.operation = operation;
        this.attribute = attribute;
        this.values = new ArrayList<>(values);
    }

    /**
     * Returns a new empty condition, the starting point for building a condition incrementally.
     */
    public static Condition empty() {
        return new EmptyCondition();
    }

    /**
     * The kind of this node, or null for the empty condition.
     */
    @Nullable
    public ConditionOperation getOperation() {
        return operation;
    }

    /**
     * The attribute the condition tests, or null for and/or/not and the empty condition.
     */
    @Nullable
    public AttributePath getAttribute() {
        return attribute;
    }

    /**
     * The operands of this node: child conditions for and/or/not, otherwise the values the attribute is tested
     * against. The returned list is live.
     */
    public List<Object> getValues() {
        return values;
    }

    /**
     * Whether the operand values are already wire values and must not be dumped again when rendering.
     */
    public boolean isDumped() {
        return dumped;
    }

    public Condition setDumped(boolean dumped) {
        this.dumped = dumped;
        return this;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Number of conditions in the tree. The empty condition has size 0 and any other non-meta node size 1. For
     * and/or/not this counts the non-meta conditions reachable from the node, each once, plus one if the node can
     * reach itself again through a cycle.
     */
    public int size() {
        return Conditions.size(this);
    }

    public Condition and(Condition other) {
        checkNotNull(other, "other condition is required");
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<Object> combined = new ArrayList<>();
        addFlattened(combined, this, ConditionOperation.AND);
        addFlattened(combined, other, ConditionOperation.AND);
        return new AndCondition(combined);
    }

    public Condition or(Condition other) {
        checkNotNull(other, "other condition is required");
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<Object> combined = new ArrayList<>();
        addFlattened(combined, this, ConditionOperation.OR);
        addFlattened(combined, other, ConditionOperation.OR);
        return new OrCondition(combined);
    }

    /**
     * Negates this condition. The empty condition negates to itself, and negating a not returns its inner node.
     */
    public Condition not() {
        if (isEmpty()) {
            return this;
        }
        if (operation == ConditionOperation.NOT) {
            return (Condition) values.get(0);
        }
        return new NotCondition(this);
    }

    /**
     * Renders this condition into expression syntax, allocating placeholders from the tracker.
     *
     * @param tracker the tracker for the current render pass
     * @return the rendered expression, or null if the condition is empty
     * @throws com.salesforce.dynamodbv2.mapper.exceptions.InvalidConditionException if the condition is malformed;
     *     any placeholders the condition allocated have been released
     */
    @Nullable
    public abstract String render(ReferenceTracker tracker);

    static void addFlattened(List<Object> target, Condition condition, ConditionOperation operation) {
        if (condition.operation == operation) {
            target.addAll(condition.values);
        } else {
            target.add(condition);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Condition && Conditions.structurallyEqual(this, (Condition) o);
    }

    @Override
    public int hashCode() {
        return Conditions.shallowHash(this);
    }

    @Override
    public String toString() {
        return Conditions.describe(this);
    }

}
