package com.salesforce.dynamodbv2.mapper.types;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import javax.annotation.Nonnull;

public class BooleanType implements Type<Boolean> {

    @Override
    public String getBackingType() {
        return "BOOL";
    }

    @Override
    public AttributeValue dump(@Nonnull Boolean value) {
        return new AttributeValue().withBOOL(value);
    }

    @Override
    public Boolean load(@Nonnull AttributeValue value) {
        return value.getBOOL();
    }

    @Override
    public boolean supportsOrdering() {
        return false;
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
        return "Boolean";
    }

}
