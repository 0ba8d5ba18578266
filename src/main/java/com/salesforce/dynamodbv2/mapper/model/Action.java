/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * An explicit update for one attribute. SET and REMOVE are usually implied by setting or clearing a value; ADD (atomic
 * counters, set union) and DELETE (set difference) must be requested explicitly.
 */
public final class Action {

    private final ActionType type;
    @Nullable
    private final Object value;

    private Action(ActionType type, @Nullable Object value) {
        this.type = checkNotNull(type, "type is required");
        this.value = value;
    }

    public static Action add(Object value) {
        checkArgument(value != null, "add requires a value");
        return new Action(ActionType.ADD, value);
    }

    public static Action delete(Object value) {
        checkArgument(value != null, "delete requires a value");
        return new Action(ActionType.DELETE, value);
    }

    public static Action remove() {
        return new Action(ActionType.REMOVE, null);
    }

    public static Action set(@Nullable Object value) {
        return value == null ? remove() : new Action(ActionType.SET, value);
    }

    public ActionType getType() {
        return type;
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Action action = (Action) o;
        return type == action.type && Objects.deepEquals(value, action.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("type", type).add("value", value).toString();
    }

}
