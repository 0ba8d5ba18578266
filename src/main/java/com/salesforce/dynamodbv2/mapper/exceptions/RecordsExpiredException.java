/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.exceptions;

/**
 * The requested stream position is older than the shard's trim horizon.
 */
public class RecordsExpiredException extends MapperException {

    public RecordsExpiredException(String message, Throwable cause) {
        super(message, cause);
    }

}
