package com.salesforce.dynamodbv2.mapper.types;

import static com.google.common.base.Preconditions.checkArgument;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.google.common.collect.ImmutableMap;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidModelException;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * A document with a fixed set of keys, each with its own type, stored as {@code M}. Keys that aren't declared are
 * ignored in both directions.
 */
public class MapType implements Type<Map<String, Object>> {

    private final Map<String, Type<?>> types;

    private MapType(Map<String, Type<?>> types) {
        this.types = ImmutableMap.copyOf(types);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Type<?>> getTypes() {
        return types;
    }

    @Override
    public String getBackingType() {
        return "M";
    }

    @Override
    @SuppressWarnings("unchecked")
    public AttributeValue dump(@Nonnull Map<String, Object> value) {
        Map<String, AttributeValue> dumped = new LinkedHashMap<>();
        types.forEach((key, type) -> {
            Object element = value.get(key);
            if (element != null) {
                AttributeValue attributeValue = ((Type<Object>) type).dump(element);
                if (attributeValue != null) {
                    dumped.put(key, attributeValue);
                }
            }
        });
        return dumped.isEmpty() ? null : new AttributeValue().withM(dumped);
    }

    @Override
    public Map<String, Object> load(@Nonnull AttributeValue value) {
        Map<String, Object> loaded = new LinkedHashMap<>();
        if (value.getM() != null) {
            types.forEach((key, type) -> {
                AttributeValue element = value.getM().get(key);
                if (element != null) {
                    loaded.put(key, type.load(element));
                }
            });
        }
        return loaded;
    }

    @Override
    public Map<String, Object> empty() {
        return new LinkedHashMap<>();
    }

    @Override
    public Type<?> typeAt(Object segment) {
        Type<?> type = types.get(segment);
        if (type == null) {
            throw new InvalidModelException("Map has no key " + segment);
        }
        return type;
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
        return "Map" + types.keySet();
    }

    public static class Builder {

        private final Map<String, Type<?>> types = new LinkedHashMap<>();

        public Builder with(String key, Type<?> type) {
            checkArgument(key != null && type != null, "key and type are required");
            types.put(key, type);
            return this;
        }

        public MapType build() {
            return new MapType(types);
        }

    }

}
