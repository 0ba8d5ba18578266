/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import java.util.Arrays;
import java.util.List;

public final class AndCondition extends MultiCondition {

    public AndCondition(Condition... conditions) {
        this(Arrays.asList(conditions));
    }

    AndCondition(List<?> conditions) {
        super(ConditionOperation.AND, conditions);
    }

    @Override
    public AndCondition add(Condition other) {
        super.add(other);
        return this;
    }

}
