/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import java.util.List;

/**
 * {@code attribute_exists} or {@code attribute_not_exists} on a path.
 */
public final class ExistsCondition extends Condition {

    public ExistsCondition(AttributePath attribute, boolean exists) {
        super(exists ? ConditionOperation.EXISTS : ConditionOperation.NOT_EXISTS, attribute, List.of());
    }

    @Override
    public String render(ReferenceTracker tracker) {
        Reference name = tracker.nameRef(getAttribute());
        return "(" + getOperation().getWireName() + "(" + name.getName() + "))";
    }

}
