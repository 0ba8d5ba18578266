/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.exceptions;

/**
 * A condition could not be built or rendered.
 */
public class InvalidConditionException extends MapperException {

    public InvalidConditionException(String message) {
        super(message);
    }

}
