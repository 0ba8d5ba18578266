/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

/**
 * Tag identifying the kind of a {@link Condition} node.
 */
public enum ConditionOperation {

    EQ("==", "="),
    NE("!=", "<>"),
    LT("<", "<"),
    GT(">", ">"),
    LE("<=", "<="),
    GE(">=", ">="),
    BEGINS_WITH("begins_with", "begins_with"),
    BETWEEN("between", "BETWEEN"),
    CONTAINS("contains", "contains"),
    IN("in", "IN"),
    EXISTS("exists", "attribute_exists"),
    NOT_EXISTS("not_exists", "attribute_not_exists"),
    AND("&", "AND"),
    OR("|", "OR"),
    NOT("~", "NOT");

    private final String symbol;
    private final String wireName;

    ConditionOperation(String symbol, String wireName) {
        this.symbol = symbol;
        this.wireName = wireName;
    }

    /**
     * Symbol used when printing conditions.
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Operator or function name in the expression syntax.
     */
    public String getWireName() {
        return wireName;
    }

    public boolean isMeta() {
        return this == AND || this == OR || this == NOT;
    }

    public boolean isComparison() {
        return ordinal() <= GE.ordinal();
    }

}
