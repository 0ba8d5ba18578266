/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import com.salesforce.dynamodbv2.mapper.exceptions.InvalidConditionException;
import java.util.Collections;

/**
 * {@code contains} on a string, set or list attribute. For sets and lists the value is a single element and is
 * dumped with the element type.
 */
public final class ContainsCondition extends Condition {

    public ContainsCondition(AttributePath attribute, Object value) {
        super(ConditionOperation.CONTAINS, attribute, Collections.singletonList(value));
    }

    @Override
    public String render(ReferenceTracker tracker) {
        Reference name = tracker.nameRef(getAttribute());
        Reference value = tracker.anyRef(getAttribute(), values.get(0), isDumped(), true);
        if (value.isEmptyValue()) {
            tracker.popRefs(name, value);
            throw new InvalidConditionException("Invalid condition: " + this + " needs a non-empty value");
        }
        return "(contains(" + name.getName() + ", " + value.getName() + "))";
    }

}
