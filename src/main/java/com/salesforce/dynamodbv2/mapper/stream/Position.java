package com.salesforce.dynamodbv2.mapper.stream;

import com.amazonaws.services.dynamodbv2.model.ShardIteratorType;

/**
 * The two ends of a stream.
 */
public enum Position {

    /**
     * The oldest records still retained.
     */
    TRIM_HORIZON(ShardIteratorType.TRIM_HORIZON),

    /**
     * Only records written from now on.
     */
    LATEST(ShardIteratorType.LATEST);

    private final ShardIteratorType iteratorType;

    Position(ShardIteratorType iteratorType) {
        this.iteratorType = iteratorType;
    }

    public ShardIteratorType getIteratorType() {
        return iteratorType;
    }

}
