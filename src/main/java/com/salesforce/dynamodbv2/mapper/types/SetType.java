package com.salesforce.dynamodbv2.mapper.types;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.stream.Collectors.toList;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.google.common.collect.ImmutableSet;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidModelException;
import java.nio.ByteBuffer;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import javax.annotation.Nonnull;

/**
 * A set of strings, numbers or binary values, stored as {@code SS}, {@code NS} or {@code BS}. Null elements are
 * dropped on dump, and an empty set dumps to nothing.
 *
 * @param <V> element type
 */
public class SetType<V> implements Type<Set<V>> {

    private static final Set<String> SUPPORTED_BACKING_TYPES = ImmutableSet.of("S", "N", "B");

    private final Type<V> elementType;
    private final String backingType;

    public SetType(Type<V> elementType) {
        this.elementType = checkNotNull(elementType, "elementType is required");
        if (!SUPPORTED_BACKING_TYPES.contains(elementType.getBackingType())) {
            throw new InvalidModelException("Set does not support element type " + elementType);
        }
        this.backingType = elementType.getBackingType() + "S";
    }

    public Type<V> getElementType() {
        return elementType;
    }

    @Override
    public String getBackingType() {
        return backingType;
    }

    @Override
    public AttributeValue dump(@Nonnull Set<V> value) {
        List<AttributeValue> elements = value.stream()
            .filter(Objects::nonNull)
            .map(elementType::dump)
            .filter(Objects::nonNull)
            .collect(toList());
        if (elements.isEmpty()) {
            return null;
        }
        switch (backingType) {
            case "SS":
                return new AttributeValue().withSS(elements.stream().map(AttributeValue::getS).collect(toList()));
            case "NS":
                return new AttributeValue().withNS(elements.stream().map(AttributeValue::getN).collect(toList()));
            default:
                return new AttributeValue().withBS(elements.stream().map(AttributeValue::getB).collect(toList()));
        }
    }

    @Override
    public Set<V> load(@Nonnull AttributeValue value) {
        Set<V> loaded = new LinkedHashSet<>();
        switch (backingType) {
            case "SS":
                if (value.getSS() != null) {
                    value.getSS().forEach(s -> loaded.add(elementType.load(new AttributeValue().withS(s))));
                }
                break;
            case "NS":
                if (value.getNS() != null) {
                    value.getNS().forEach(n -> loaded.add(elementType.load(new AttributeValue().withN(n))));
                }
                break;
            default:
                if (value.getBS() != null) {
                    for (ByteBuffer b : value.getBS()) {
                        loaded.add(elementType.load(new AttributeValue().withB(b)));
                    }
                }
                break;
        }
        return loaded;
    }

    @Override
    public Set<V> empty() {
        return new LinkedHashSet<>();
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
    public String toString() {
        return "Set(" + elementType + ")";
    }

}
