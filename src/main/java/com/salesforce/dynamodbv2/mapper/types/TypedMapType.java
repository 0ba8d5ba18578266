package com.salesforce.dynamodbv2.mapper.types;

import static com.google.common.base.Preconditions.checkNotNull;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidModelException;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * A map with arbitrary string keys and values of a single type, stored as {@code M}.
 *
 * @param <V> value type
 */
public class TypedMapType<V> implements Type<Map<String, V>> {

    private final Type<V> valueType;

    public TypedMapType(Type<V> valueType) {
        this.valueType = checkNotNull(valueType, "valueType is required");
    }

    @Override
    public String getBackingType() {
        return "M";
    }

    @Override
    public AttributeValue dump(@Nonnull Map<String, V> value) {
        Map<String, AttributeValue> dumped = new LinkedHashMap<>();
        value.forEach((key, element) -> {
            if (element != null) {
                AttributeValue attributeValue = valueType.dump(element);
                if (attributeValue != null) {
                    dumped.put(key, attributeValue);
                }
            }
        });
        return dumped.isEmpty() ? null : new AttributeValue().withM(dumped);
    }

    @Override
    public Map<String, V> load(@Nonnull AttributeValue value) {
        Map<String, V> loaded = new LinkedHashMap<>();
        if (value.getM() != null) {
            value.getM().forEach((key, element) -> loaded.put(key, valueType.load(element)));
        }
        return loaded;
    }

    @Override
    public Map<String, V> empty() {
        return new LinkedHashMap<>();
    }

    @Override
    public Type<?> typeAt(Object segment) {
        if (!(segment instanceof String)) {
            throw new InvalidModelException("Map paths must use string keys, not " + segment);
        }
        return valueType;
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
        return "TypedMap(" + valueType + ")";
    }

}
