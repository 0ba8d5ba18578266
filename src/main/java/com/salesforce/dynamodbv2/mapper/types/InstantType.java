package com.salesforce.dynamodbv2.mapper.types;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import javax.annotation.Nonnull;

/**
 * Points in time, stored as ISO-8601 UTC strings so that they sort lexicographically.
 */
public class InstantType implements Type<Instant> {

    @Override
    public String getBackingType() {
        return "S";
    }

    @Override
    public AttributeValue dump(@Nonnull Instant value) {
        return new AttributeValue().withS(DateTimeFormatter.ISO_INSTANT.format(value));
    }

    @Override
    public Instant load(@Nonnull AttributeValue value) {
        return Instant.parse(value.getS());
    }

    @Override
    public String toString() {
        return "DateTime";
    }

}
