/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.exceptions;

/**
 * A previously obtained shard iterator is no longer valid.
 */
public class ShardIteratorExpiredException extends MapperException {

    public ShardIteratorExpiredException(String message, Throwable cause) {
        super(message, cause);
    }

}
