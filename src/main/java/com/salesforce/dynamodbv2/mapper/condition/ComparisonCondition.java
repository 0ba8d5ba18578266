/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import static com.google.common.base.Preconditions.checkArgument;

import com.salesforce.dynamodbv2.mapper.exceptions.InvalidConditionException;
import java.util.Collections;

/**
 * One of {@code = <> < <= > >=} between an attribute and a value or another attribute. Comparing with a value that
 * dumps to nothing renders as {@code attribute_not_exists} for {@code =} and {@code attribute_exists} for
 * {@code <>}, and is invalid for the ordering operators.
 */
public final class ComparisonCondition extends Condition {

    public ComparisonCondition(ConditionOperation operation, AttributePath attribute, Object value) {
        super(operation, attribute, Collections.singletonList(value));
        checkArgument(operation.isComparison(), "%s is not a comparison", operation);
    }

    @Override
    public String render(ReferenceTracker tracker) {
        Reference name = tracker.nameRef(getAttribute());
        Reference value = tracker.anyRef(getAttribute(), values.get(0), isDumped(), false);
        if (value.isEmptyValue()) {
            switch (getOperation()) {
                case EQ:
                    tracker.popRefs(value);
                    return "(attribute_not_exists(" + name.getName() + "))";
                case NE:
                    tracker.popRefs(value);
                    return "(attribute_exists(" + name.getName() + "))";
                default:
                    tracker.popRefs(name, value);
                    throw new InvalidConditionException("Invalid condition: " + this
                        + " can't compare against an empty value");
            }
        }
        return "(" + name.getName() + " " + getOperation().getWireName() + " " + value.getName() + ")";
    }

}
