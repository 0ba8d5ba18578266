package com.salesforce.dynamodbv2.mapper.types;

import static com.google.common.base.Preconditions.checkNotNull;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidModelException;
import javax.annotation.Nullable;

/**
 * Entry point for converting values to and from their wire form. Handles absence so that individual types only ever
 * convert present values: null dumps to null (the attribute is omitted), and a missing wire value loads as the type's
 * empty value.
 */
public class TypeEngine {

    /**
     * Converts a value to its wire form.
     *
     * @param type  the type of the value
     * @param value the value, may be null
     * @return the wire value, or null if the attribute should be omitted
     */
    @Nullable
    @SuppressWarnings("unchecked")
    public AttributeValue dump(Type<?> type, @Nullable Object value) {
        checkNotNull(type, "type is required");
        if (value == null) {
            return null;
        }
        try {
            return ((Type<Object>) type).dump(value);
        } catch (ClassCastException e) {
            throw new InvalidModelException("can't dump " + value.getClass().getSimpleName() + " as " + type);
        }
    }

    /**
     * Converts a wire value back to a Java value.
     *
     * @param type  the type of the value
     * @param value the wire value, may be null
     * @return the loaded value, or the type's empty value when absent
     */
    @Nullable
    public Object load(Type<?> type, @Nullable AttributeValue value) {
        checkNotNull(type, "type is required");
        if (value == null || Boolean.TRUE.equals(value.getNULL())) {
            return type.empty();
        }
        return type.load(value);
    }

}
