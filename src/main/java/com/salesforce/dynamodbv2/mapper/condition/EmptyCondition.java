/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import java.util.List;

/**
 * The empty condition. Renders to nothing.
 */
public final class EmptyCondition extends Condition {

    public EmptyCondition() {
        super(null, null, List.of());
    }

    @Override
    public String render(ReferenceTracker tracker) {
        return null;
    }

}
