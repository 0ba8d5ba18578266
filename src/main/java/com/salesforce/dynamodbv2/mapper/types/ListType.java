package com.salesforce.dynamodbv2.mapper.types;

import static com.google.common.base.Preconditions.checkNotNull;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidModelException;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * A list of values of a single type, stored as {@code L}. Elements that dump to nothing are dropped.
 *
 * @param <V> element type
 */
public class ListType<V> implements Type<List<V>> {

    private final Type<V> elementType;

    public ListType(Type<V> elementType) {
        this.elementType = checkNotNull(elementType, "elementType is required");
    }

    public Type<V> getElementType() {
        return elementType;
    }

    @Override
    public String getBackingType() {
        return "L";
    }

    @Override
    public AttributeValue dump(@Nonnull List<V> value) {
        List<AttributeValue> elements = new ArrayList<>(value.size());
        for (V element : value) {
            if (element != null) {
                AttributeValue dumped = elementType.dump(element);
                if (dumped != null) {
                    elements.add(dumped);
                }
            }
        }
        return elements.isEmpty() ? null : new AttributeValue().withL(elements);
    }

    @Override
    public List<V> load(@Nonnull AttributeValue value) {
        List<V> loaded = new ArrayList<>();
        if (value.getL() != null) {
            for (AttributeValue element : value.getL()) {
                loaded.add(elementType.load(element));
            }
        }
        return loaded;
    }

    @Override
    public List<V> empty() {
        return new ArrayList<>();
    }

    @Override
    public Type<?> typeAt(Object segment) {
        if (!(segment instanceof Integer)) {
            throw new InvalidModelException("List paths must use integer indexes, not " + segment);
        }
        return elementType;
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
        return "List(" + elementType + ")";
    }

}
