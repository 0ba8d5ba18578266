package com.salesforce.dynamodbv2.mapper.types;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidModelException;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Converts between a Java value and its DynamoDB wire representation.
 *
 * <p>Implementations never see null values; {@link TypeEngine} handles absence before delegating.
 *
 * @param <V> Java type of the values this type converts
 */
public interface Type<V> {

    /**
     * Returns the DynamoDB attribute type this type is stored as, e.g. {@code S}, {@code N} or {@code SS}.
     *
     * @return the backing attribute type
     */
    String getBackingType();

    /**
     * Converts a value to its wire form.
     *
     * @param value the value to convert
     * @return the wire value, or null if the value is empty and must be omitted
     */
    @Nullable
    AttributeValue dump(@Nonnull V value);

    /**
     * Converts a wire value back into a Java value.
     *
     * @param value the wire value
     * @return the loaded value
     */
    V load(@Nonnull AttributeValue value);

    /**
     * Value to use when the attribute is absent. Scalars have none; collections return an empty container.
     */
    @Nullable
    default V empty() {
        return null;
    }

    /**
     * Returns the type of the value found at the given document path segment.
     *
     * @param segment a String key or an Integer index
     * @return the type at that segment
     */
    default Type<?> typeAt(Object segment) {
        throw new InvalidModelException(getClass().getSimpleName() + " does not support path segment " + segment);
    }

    default boolean supportsOrdering() {
        return true;
    }

    default boolean supportsBeginsWith() {
        return true;
    }

    default boolean supportsContains() {
        return true;
    }

}
