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

public final class InCondition extends Condition {

    public InCondition(AttributePath attribute, List<?> values) {
        super(ConditionOperation.IN, attribute, values);
    }

    @Override
    public String render(ReferenceTracker tracker) {
        if (values.isEmpty()) {
            throw new InvalidConditionException("Invalid condition: " + this + " needs at least one value");
        }
        List<Reference> refs = new ArrayList<>();
        refs.add(tracker.nameRef(getAttribute()));
        for (Object value : values) {
            Reference ref = tracker.anyRef(getAttribute(), value, isDumped(), false);
            refs.add(ref);
            if (ref.isEmptyValue()) {
                tracker.popRefs(refs);
                throw new InvalidConditionException("Invalid condition: " + this + " can't contain empty values");
            }
        }
        List<String> placeholders = new ArrayList<>();
        for (Reference ref : refs.subList(1, refs.size())) {
            placeholders.add(ref.getName());
        }
        return "(" + refs.get(0).getName() + " IN (" + String.join(", ", placeholders) + "))";
    }

}
