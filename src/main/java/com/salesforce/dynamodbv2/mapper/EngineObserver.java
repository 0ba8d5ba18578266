/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper;

import com.salesforce.dynamodbv2.mapper.model.Column;
import com.salesforce.dynamodbv2.mapper.model.ModelSchema;
import javax.annotation.Nullable;

/**
 * Receives lifecycle callbacks from an {@link Engine}. Callbacks run synchronously on the calling thread, in the
 * order observers were registered.
 */
public interface EngineObserver {

    /**
     * A model was bound to its physical table.
     */
    default void modelBound(ModelSchema<?> schema, String tableName) {
    }

    /**
     * An object was loaded by {@code load}, a search or a stream.
     */
    default void objectLoaded(Object obj) {
    }

    default void objectSaved(Object obj) {
    }

    default void objectDeleted(Object obj) {
    }

    /**
     * A column of an object was set, unset or given an update action.
     *
     * @param value the new local value, or null when unset or when the update is applied server side
     */
    default void objectModified(Object obj, Column<?, ?> column, @Nullable Object value) {
    }

}
