package com.salesforce.dynamodbv2.mapper.types;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import java.math.BigDecimal;
import javax.annotation.Nonnull;

/**
 * Whole numbers, stored as {@code N}. Fractional wire values are truncated on load.
 */
public class IntegerType implements Type<Long> {

    @Override
    public String getBackingType() {
        return "N";
    }

    @Override
    public AttributeValue dump(@Nonnull Long value) {
        return new AttributeValue().withN(Long.toString(value));
    }

    @Override
    public Long load(@Nonnull AttributeValue value) {
        return new BigDecimal(value.getN()).longValue();
    }

    @Override
    public boolean supportsBeginsWith() {
        return false;
    }

    @Override
    public boolean supportsContains() {
        return false;
    }

    @Override
    public String toString() {
        return "Integer";
    }

}
