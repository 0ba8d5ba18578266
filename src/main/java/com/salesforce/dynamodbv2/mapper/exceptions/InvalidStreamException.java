/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.exceptions;

/**
 * The stream does not exist, the model has no stream, or a stream token can't be related to the live stream.
 */
public class InvalidStreamException extends MapperException {

    public InvalidStreamException(String message) {
        super(message);
    }

    public InvalidStreamException(String message, Throwable cause) {
        super(message, cause);
    }

}
