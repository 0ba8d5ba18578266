package com.salesforce.dynamodbv2.mapper.types;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import javax.annotation.Nonnull;

public class StringType implements Type<String> {

    @Override
    public String getBackingType() {
        return "S";
    }

    @Override
    public AttributeValue dump(@Nonnull String value) {
        return new AttributeValue().withS(value);
    }

    @Override
    public String load(@Nonnull AttributeValue value) {
        return value.getS();
    }

    @Override
    public String toString() {
        return "String";
    }

}
