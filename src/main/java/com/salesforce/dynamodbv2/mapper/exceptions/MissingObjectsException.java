/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.exceptions;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.List;

/**
 * Some objects passed to a load were not found.
 */
public class MissingObjectsException extends MapperException {

    private final List<Object> objects;

    public MissingObjectsException(String message, Collection<?> objects) {
        super(message);
        this.objects = ImmutableList.copyOf(objects);
    }

    public List<Object> getObjects() {
        return objects;
    }

}
