/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.exceptions;

/**
 * The table that exists in DynamoDB does not match the model bound to it.
 */
public class TableMismatchException extends MapperException {

    public TableMismatchException(String message) {
        super(message);
    }

}
