/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.model;

/**
 * How an update expression applies a value to an attribute. Constants are declared in the order their clauses
 * appear in a rendered update expression.
 */
public enum ActionType {

    ADD("%s %s"),
    DELETE("%s %s"),
    REMOVE("%s"),
    SET("%s=%s");

    private final String format;

    ActionType(String format) {
        this.format = format;
    }

    /**
     * The clause keyword, e.g. {@code SET}.
     */
    public String getWireKey() {
        return name();
    }

    /**
     * Renders one entry of this clause.
     *
     * @param nameRef  the attribute name placeholder
     * @param valueRef the value placeholder, ignored for {@code REMOVE}
     * @return the rendered entry, e.g. {@code #n0=:v1}
     */
    public String render(String nameRef, String valueRef) {
        return this == REMOVE ? String.format(format, nameRef) : String.format(format, nameRef, valueRef);
    }

}
