/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.exceptions;

/**
 * A conditional write's precondition was not satisfied. Carries the name of the failed operation and the request
 * that was sent, so callers can tell which object and which condition were involved.
 */
public class ConstraintViolationException extends MapperException {

    private final String operation;
    private final Object request;

    public ConstraintViolationException(String operation, Object request, Throwable cause) {
        super("the " + operation + " condition was not met", cause);
        this.operation = operation;
        this.request = request;
    }

    public ConstraintViolationException(String operation, Object request, String message) {
        super(message);
        this.operation = operation;
        this.request = request;
    }

    public String getOperation() {
        return operation;
    }

    public Object getRequest() {
        return request;
    }

}
