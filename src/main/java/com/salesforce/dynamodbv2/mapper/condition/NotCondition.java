/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import static com.google.common.base.Preconditions.checkNotNull;

import com.salesforce.dynamodbv2.mapper.exceptions.InvalidConditionException;
import java.util.List;

public final class NotCondition extends Condition {

    public NotCondition(Condition condition) {
        super(ConditionOperation.NOT, null, List.of(checkNotNull(condition, "condition is required")));
    }

    @Override
    public String render(ReferenceTracker tracker) {
        if (!tracker.enter(this)) {
            throw new InvalidConditionException("Invalid condition: cyclic conditions can't be rendered");
        }
        try {
            String inner = ((Condition) values.get(0)).render(tracker);
            return inner == null ? null : "(NOT " + inner + ")";
        } finally {
            tracker.exit(this);
        }
    }

}
