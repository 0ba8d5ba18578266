/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import java.util.Arrays;
import java.util.List;

public final class OrCondition extends MultiCondition {

    public OrCondition(Condition... conditions) {
        this(Arrays.asList(conditions));
    }

    OrCondition(List<?> conditions) {
        super(ConditionOperation.OR, conditions);
    }

    @Override
    public OrCondition add(Condition other) {
        super.add(other);
        return this;
    }

}
