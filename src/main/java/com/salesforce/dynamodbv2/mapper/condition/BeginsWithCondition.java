/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import com.salesforce.dynamodbv2.mapper.exceptions.InvalidConditionException;
import java.util.Collections;

public final class BeginsWithCondition extends Condition {

    public BeginsWithCondition(AttributePath attribute, Object value) {
        super(ConditionOperation.BEGINS_WITH, attribute, Collections.singletonList(value));
    }

    @Override
    public String render(ReferenceTracker tracker) {
        Reference name = tracker.nameRef(getAttribute());
        Reference value = tracker.anyRef(getAttribute(), values.get(0), isDumped(), false);
        if (value.isEmptyValue()) {
            tracker.popRefs(name, value);
            throw new InvalidConditionException("Invalid condition: " + this + " needs a non-empty prefix");
        }
        return "(begins_with(" + name.getName() + ", " + value.getName() + "))";
    }

}
