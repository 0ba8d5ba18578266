/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import com.salesforce.dynamodbv2.mapper.exceptions.InvalidConditionException;
import java.util.Arrays;

public final class BetweenCondition extends Condition {

    public BetweenCondition(AttributePath attribute, Object lower, Object upper) {
        super(ConditionOperation.BETWEEN, attribute, Arrays.asList(lower, upper));
    }

    @Override
    public String render(ReferenceTracker tracker) {
        Reference name = tracker.nameRef(getAttribute());
        Reference lower = tracker.anyRef(getAttribute(), values.get(0), isDumped(), false);
        Reference upper = tracker.anyRef(getAttribute(), values.get(1), isDumped(), false);
        if (lower.isEmptyValue() || upper.isEmptyValue()) {
            tracker.popRefs(name, lower, upper);
            throw new InvalidConditionException("Invalid condition: " + this + " needs non-empty bounds");
        }
        return "(" + name.getName() + " BETWEEN " + lower.getName() + " AND " + upper.getName() + ")";
    }

}
