/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import com.salesforce.dynamodbv2.mapper.exceptions.InvalidConditionException;
import java.util.ArrayList;
import java.util.List;

/**
 * Base for {@link AndCondition} and {@link OrCondition}.
 */
public abstract class MultiCondition extends Condition {

    MultiCondition(ConditionOperation operation, List<?> conditions) {
        super(operation, null, conditions);
        for (Object condition : conditions) {
            if (!(condition instanceof Condition)) {
                throw new InvalidConditionException(operation + " only accepts conditions, not " + condition);
            }
        }
    }

    /**
     * Extends this node in place, flattening {@code other} if it is the same kind of node.
     *
     * @param other the condition to add
     * @return this node
     */
    public MultiCondition add(Condition other) {
        if (!other.isEmpty()) {
            addFlattened(values, other, getOperation());
        }
        return this;
    }

    @Override
    public String render(ReferenceTracker tracker) {
        if (values.isEmpty()) {
            throw new InvalidConditionException("Invalid condition: <empty " + getOperation() + "> needs at least one"
                + " condition");
        }
        if (!tracker.enter(this)) {
            throw new InvalidConditionException("Invalid condition: cyclic conditions can't be rendered");
        }
        int checkpoint = tracker.checkpoint();
        try {
            if (values.size() == 1) {
                return ((Condition) values.get(0)).render(tracker);
            }
            List<String> rendered = new ArrayList<>(values.size());
            for (Object value : values) {
                String condition = ((Condition) value).render(tracker);
                if (condition != null) {
                    rendered.add(condition);
                }
            }
            if (rendered.isEmpty()) {
                return null;
            }
            if (rendered.size() == 1) {
                return rendered.get(0);
            }
            return "(" + String.join(" " + getOperation().getWireName() + " ", rendered) + ")";
        } catch (InvalidConditionException e) {
            tracker.rollback(checkpoint);
            throw e;
        } finally {
            tracker.exit(this);
        }
    }

}
