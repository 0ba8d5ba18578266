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
import com.salesforce.dynamodbv2.mapper.condition.AttributePath;
import com.salesforce.dynamodbv2.mapper.types.Type;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * A model attribute: its model-side name, the attribute name it is stored under, its {@link Type} and how to read
 * and write it on a model object.
 *
 * <p>Columns use identity equality. Conditions built from a column only match that column instance, so declare each
 * column once, typically as a {@code public static final} field of the model class.
 *
 * @param <M> the model class
 * @param <V> the Java type of the attribute value
 */
public final class Column<M, V> implements AttributePath {

    private final String name;
    private final String dynamoName;
    private final Type<V> type;
    private final Function<M, V> getter;
    private final BiConsumer<M, V> setter;
    private final boolean hashKey;
    private final boolean rangeKey;

    private Column(Builder<M, V> builder) {
        this.name = builder.name;
        this.dynamoName = builder.dynamoName == null ? builder.name : builder.dynamoName;
        this.type = builder.type;
        this.getter = checkNotNull(builder.getter, "getter is required for column %s", name);
        this.setter = checkNotNull(builder.setter, "setter is required for column %s", name);
        this.hashKey = builder.hashKey;
        this.rangeKey = builder.rangeKey;
    }

    public static <M, V> Builder<M, V> builder(String name, Type<V> type) {
        return new Builder<>(name, type);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDynamoName() {
        return dynamoName;
    }

    @Override
    public AttributePath getRoot() {
        return this;
    }

    @Override
    public List<Object> getPath() {
        return List.of();
    }

    @Override
    public Type<V> getType() {
        return type;
    }

    public boolean isHashKey() {
        return hashKey;
    }

    public boolean isRangeKey() {
        return rangeKey;
    }

    public boolean isKey() {
        return hashKey || rangeKey;
    }

    @Nullable
    public V get(M obj) {
        return getter.apply(obj);
    }

    public void set(M obj, @Nullable V value) {
        setter.accept(obj, value);
    }

    /**
     * Sets a value whose type was checked elsewhere, e.g. one just loaded with this column's type.
     */
    @SuppressWarnings("unchecked")
    public void setUnchecked(M obj, @Nullable Object value) {
        setter.accept(obj, (V) value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("name", name)
            .add("dynamoName", dynamoName)
            .add("type", type.getClass().getSimpleName())
            .toString();
    }

    public static class Builder<M, V> {

        private final String name;
        private final Type<V> type;
        private String dynamoName;
        private Function<M, V> getter;
        private BiConsumer<M, V> setter;
        private boolean hashKey;
        private boolean rangeKey;

        private Builder(String name, Type<V> type) {
            checkArgument(name != null && !name.isEmpty(), "name is required");
            this.name = name;
            this.type = checkNotNull(type, "type is required");
        }

        public Builder<M, V> withDynamoName(String dynamoName) {
            this.dynamoName = dynamoName;
            return this;
        }

        public Builder<M, V> withAccessors(Function<M, V> getter, BiConsumer<M, V> setter) {
            this.getter = getter;
            this.setter = setter;
            return this;
        }

        public Builder<M, V> withHashKey() {
            this.hashKey = true;
            return this;
        }

        public Builder<M, V> withRangeKey() {
            this.rangeKey = true;
            return this;
        }

        public Column<M, V> build() {
            checkArgument(!(hashKey && rangeKey), "column %s can't be both hash and range key", name);
            return new Column<>(this);
        }

    }

}
