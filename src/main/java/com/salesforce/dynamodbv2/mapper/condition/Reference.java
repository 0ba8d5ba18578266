/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.google.common.base.MoreObjects;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A placeholder handed out by a {@link ReferenceTracker}. Name references stand for an attribute path such as
 * {@code #n0.#n1[3]}; value references stand for a literal such as {@code :v2}.
 *
 * <p>Each call to the tracker returns a new instance, even when a name placeholder is reused, so that every use can be
 * released individually.
 */
public final class Reference {

    public enum Kind {
        NAME, VALUE
    }

    private final String name;
    private final Kind kind;
    @Nullable
    private final AttributeValue value;

    Reference(String name, Kind kind, @Nullable AttributeValue value) {
        this.name = name;
        this.kind = kind;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The wire value of a value reference; null for name references and for values that dumped to nothing.
     */
    @Nullable
    public AttributeValue getValue() {
        return value;
    }

    public boolean isName() {
        return kind == Kind.NAME;
    }

    /**
     * True for a value reference whose value dumped to nothing.
     */
    public boolean isEmptyValue() {
        return kind == Kind.VALUE && value == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Reference reference = (Reference) o;
        return name.equals(reference.name) && kind == reference.kind && Objects.equals(value, reference.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("name", name)
            .add("kind", kind)
            .add("value", value)
            .toString();
    }

}
