/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import com.google.common.collect.ImmutableList;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidConditionException;
import com.salesforce.dynamodbv2.mapper.types.Type;
import java.util.Arrays;
import java.util.List;

/**
 * A model attribute, or a location inside a document attribute, that conditions can be built against.
 *
 * <p>Identity matters: two paths refer to the same attribute only if they share the same root instance and the same
 * segments.
 */
public interface AttributePath {

    /**
     * The model-side name of the root attribute.
     */
    String getName();

    /**
     * The name of the root attribute in DynamoDB.
     */
    String getDynamoName();

    /**
     * The root attribute, which is this instance for a top-level attribute.
     */
    AttributePath getRoot();

    /**
     * Segments below the root; {@code String} keys into maps and {@code Integer} indexes into lists.
     */
    List<Object> getPath();

    /**
     * The type of the value found at this path.
     */
    Type<?> getType();

    default AttributePath get(String key) {
        return new DocumentPath(getRoot(), ImmutableList.<Object>builder().addAll(getPath()).add(key).build());
    }

    default AttributePath get(int index) {
        return new DocumentPath(getRoot(), ImmutableList.<Object>builder().addAll(getPath()).add(index).build());
    }

    default Condition eq(Object value) {
        return new ComparisonCondition(ConditionOperation.EQ, this, value);
    }

    default Condition ne(Object value) {
        return new ComparisonCondition(ConditionOperation.NE, this, value);
    }

    default Condition isNull() {
        return eq(null);
    }

    default Condition isNotNull() {
        return ne(null);
    }

    /**
     * A condition that holds when the attribute is present, rendered with {@code attribute_exists}.
     */
    default Condition exists() {
        return new ExistsCondition(this, true);
    }

    default Condition notExists() {
        return new ExistsCondition(this, false);
    }

    default Condition lt(Object value) {
        checkOrdering(ConditionOperation.LT);
        return new ComparisonCondition(ConditionOperation.LT, this, value);
    }

    default Condition le(Object value) {
        checkOrdering(ConditionOperation.LE);
        return new ComparisonCondition(ConditionOperation.LE, this, value);
    }

    default Condition gt(Object value) {
        checkOrdering(ConditionOperation.GT);
        return new ComparisonCondition(ConditionOperation.GT, this, value);
    }

    default Condition ge(Object value) {
        checkOrdering(ConditionOperation.GE);
        return new ComparisonCondition(ConditionOperation.GE, this, value);
    }

    default Condition between(Object lower, Object upper) {
        checkOrdering(ConditionOperation.BETWEEN);
        return new BetweenCondition(this, lower, upper);
    }

    default Condition beginsWith(Object value) {
        if (!getType().supportsBeginsWith()) {
            throw new InvalidConditionException(getType() + " does not support begins_with");
        }
        return new BeginsWithCondition(this, value);
    }

    default Condition contains(Object value) {
        if (!getType().supportsContains()) {
            throw new InvalidConditionException(getType() + " does not support contains");
        }
        return new ContainsCondition(this, value);
    }

    default Condition in(Object... values) {
        return new InCondition(this, Arrays.asList(values));
    }

    private void checkOrdering(ConditionOperation operation) {
        if (!getType().supportsOrdering()) {
            throw new InvalidConditionException(getType() + " does not support " + operation.getSymbol());
        }
    }

}
