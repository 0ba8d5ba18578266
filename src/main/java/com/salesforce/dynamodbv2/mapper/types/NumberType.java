package com.salesforce.dynamodbv2.mapper.types;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import java.math.BigDecimal;
import javax.annotation.Nonnull;

/**
 * Arbitrary precision numbers, stored as {@code N}. Dumps drop trailing zeros, matching the form the service
 * returns numbers in.
 */
public class NumberType implements Type<BigDecimal> {

    @Override
    public String getBackingType() {
        return "N";
    }

    @Override
    public AttributeValue dump(@Nonnull BigDecimal value) {
        return new AttributeValue().withN(value.stripTrailingZeros().toPlainString());
    }

    @Override
    public BigDecimal load(@Nonnull AttributeValue value) {
        return new BigDecimal(value.getN());
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
        return "Number";
    }

}
