package com.salesforce.dynamodbv2.mapper.types;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import java.util.UUID;
import javax.annotation.Nonnull;

public class UuidType implements Type<UUID> {

    @Override
    public String getBackingType() {
        return "S";
    }

    @Override
    public AttributeValue dump(@Nonnull UUID value) {
        return new AttributeValue().withS(value.toString());
    }

    @Override
    public UUID load(@Nonnull AttributeValue value) {
        return UUID.fromString(value.getS());
    }

    @Override
    public String toString() {
        return "UUID";
    }

}
