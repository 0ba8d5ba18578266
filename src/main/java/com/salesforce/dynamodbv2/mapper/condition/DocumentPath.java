/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.salesforce.dynamodbv2.mapper.types.Type;
import java.util.List;
import java.util.Objects;

/**
 * A location inside a document attribute, e.g. {@code data["Description"]["Tags"][3]}.
 */
public final class DocumentPath implements AttributePath {

    private final AttributePath root;
    private final List<Object> path;

    DocumentPath(AttributePath root, List<Object> path) {
        this.root = checkNotNull(root, "root is required");
        this.path = ImmutableList.copyOf(path);
    }

    @Override
    public String getName() {
        return root.getName();
    }

    @Override
    public String getDynamoName() {
        return root.getDynamoName();
    }

    @Override
    public AttributePath getRoot() {
        return root;
    }

    @Override
    public List<Object> getPath() {
        return path;
    }

    @Override
    public Type<?> getType() {
        Type<?> type = root.getType();
        for (Object segment : path) {
            type = type.typeAt(segment);
        }
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DocumentPath that = (DocumentPath) o;
        return root == that.root && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(root), path);
    }

    @Override
    public String toString() {
        return Conditions.printableName(this);
    }

}
