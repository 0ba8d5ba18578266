/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import static java.util.stream.Collectors.joining;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Traversal and comparison helpers for condition trees. All of them visit each node at most once, so they terminate on
 * trees that contain cycles.
 */
public final class Conditions {

    private Conditions() {
    }

    /**
     * Returns every condition in the tree in depth-first order, each node once. A meta root (and, or, not) is not
     * included unless one of its descendants refers back to it.
     *
     * @param root the root of the tree
     * @return the conditions below the root
     */
    public static List<Condition> iterConditions(Condition root) {
        List<Condition> result = new ArrayList<>();
        Set<Condition> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Condition> pending = new ArrayDeque<>();
        if (root.getOperation() != null && root.getOperation().isMeta()) {
            visited.add(root);
            pushChildren(pending, root);
        } else {
            pending.push(root);
        }
        boolean rootSeen = false;
        while (!pending.isEmpty()) {
            Condition condition = pending.pop();
            if (condition == root && !rootSeen && visited.contains(root)) {
                // reached the meta root again through a cycle
                rootSeen = true;
                result.add(condition);
                continue;
            }
            if (!visited.add(condition)) {
                continue;
            }
            result.add(condition);
            if (condition.getOperation() != null && condition.getOperation().isMeta()) {
                pushChildren(pending, condition);
            }
        }
        return result;
    }

    /**
     * Returns the root attributes used anywhere in the tree, including attributes compared against as values, each
     * once and in the order they are first found.
     */
    public static Set<AttributePath> iterColumns(Condition root) {
        Set<AttributePath> columns = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<AttributePath> ordered = new LinkedHashSet<>();
        for (Condition condition : iterConditions(root)) {
            if (condition.getAttribute() != null && columns.add(condition.getAttribute().getRoot())) {
                ordered.add(condition.getAttribute().getRoot());
            }
            if (condition.getOperation() != null && !condition.getOperation().isMeta()) {
                for (Object value : condition.values) {
                    if (value instanceof AttributePath && columns.add(((AttributePath) value).getRoot())) {
                        ordered.add(((AttributePath) value).getRoot());
                    }
                }
            }
        }
        return ordered;
    }

    static int size(Condition condition) {
        ConditionOperation operation = condition.getOperation();
        if (operation == null) {
            return 0;
        }
        if (!operation.isMeta()) {
            return 1;
        }
        int size = 0;
        for (Condition child : iterConditions(condition)) {
            if (child == condition) {
                // the edge back to the root counts once
                size++;
            } else if (child.getOperation() != null && !child.getOperation().isMeta()) {
                size++;
            }
        }
        return size;
    }

    static boolean structurallyEqual(Condition a, Condition b) {
        return structurallyEqual(a, b, new IdentityHashMap<>());
    }

    private static boolean structurallyEqual(Condition a, Condition b, Map<Condition, Set<Condition>> assumed) {
        if (a == b) {
            return true;
        }
        if (a.getOperation() != b.getOperation() || a.getClass() != b.getClass()) {
            return false;
        }
        Set<Condition> pairs = assumed.computeIfAbsent(a, k -> Collections.newSetFromMap(new IdentityHashMap<>()));
        if (!pairs.add(b)) {
            // already comparing this pair further up; assume equal
            return true;
        }
        if (!sameAttribute(a.getAttribute(), b.getAttribute())) {
            return false;
        }
        if (a.values.size() != b.values.size()) {
            return false;
        }
        for (int i = 0; i < a.values.size(); i++) {
            Object left = a.values.get(i);
            Object right = b.values.get(i);
            if (left instanceof Condition && right instanceof Condition) {
                if (!structurallyEqual((Condition) left, (Condition) right, assumed)) {
                    return false;
                }
            } else if (left instanceof AttributePath && right instanceof AttributePath) {
                if (!sameAttribute((AttributePath) left, (AttributePath) right)) {
                    return false;
                }
            } else if (!Objects.deepEquals(left, right)) {
                return false;
            }
        }
        return true;
    }

    static int shallowHash(Condition condition) {
        AttributePath attribute = condition.getAttribute();
        if (attribute == null) {
            return Objects.hashCode(condition.getOperation());
        }
        return Objects.hash(condition.getOperation(), System.identityHashCode(attribute.getRoot()),
            attribute.getPath());
    }

    private static boolean sameAttribute(AttributePath a, AttributePath b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.getRoot() == b.getRoot() && a.getPath().equals(b.getPath());
    }

    /**
     * Human readable name for a path, e.g. {@code data.Description.Tags[3]}.
     */
    public static String printableName(AttributePath path) {
        StringBuilder name = new StringBuilder(path.getName());
        for (Object segment : path.getPath()) {
            if (segment instanceof Integer) {
                name.append('[').append(segment).append(']');
            } else {
                name.append('.').append(segment);
            }
        }
        return name.toString();
    }

    static String describe(Condition condition) {
        return describe(condition, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static String describe(Condition condition, Set<Condition> seen) {
        ConditionOperation operation = condition.getOperation();
        if (operation == null) {
            return "<empty condition>";
        }
        if (!seen.add(condition)) {
            return "<cycle>";
        }
        try {
            switch (operation) {
                case AND:
                case OR:
                    return condition.values.stream()
                        .map(value -> describe((Condition) value, seen))
                        .collect(joining(" " + operation.getSymbol() + " ", "(", ")"));
                case NOT:
                    return "(~" + describe((Condition) condition.values.get(0), seen) + ")";
                case EXISTS:
                case NOT_EXISTS:
                    return operation.getSymbol() + "(" + printableName(condition.getAttribute()) + ")";
                case BEGINS_WITH:
                case CONTAINS:
                case BETWEEN:
                case IN:
                    return printableName(condition.getAttribute()) + "." + operation.getSymbol()
                        + condition.values.stream().map(Conditions::describeValue).collect(joining(", ", "(", ")"));
                default:
                    return "(" + printableName(condition.getAttribute()) + " " + operation.getSymbol() + " "
                        + describeValue(condition.values.get(0)) + ")";
            }
        } finally {
            seen.remove(condition);
        }
    }

    private static String describeValue(Object value) {
        if (value instanceof AttributePath) {
            return printableName((AttributePath) value);
        }
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }

    private static void pushChildren(Deque<Condition> pending, Condition condition) {
        List<Object> children = condition.values;
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push((Condition) children.get(i));
        }
    }

}
