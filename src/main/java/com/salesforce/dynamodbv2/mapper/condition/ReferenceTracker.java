/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.condition;

import static com.google.common.base.Preconditions.checkNotNull;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.salesforce.dynamodbv2.mapper.types.ListType;
import com.salesforce.dynamodbv2.mapper.types.SetType;
import com.salesforce.dynamodbv2.mapper.types.Type;
import com.salesforce.dynamodbv2.mapper.types.TypeEngine;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Allocates the {@code #n}/{@code :v} placeholders for a single render pass and collects the attribute name and value
 * maps that accompany the rendered expressions.
 *
 * <p>Names and values share one counter, and an index is never issued twice, even after the placeholder that used it
 * has been released. Name placeholders are de-duplicated per path segment; value placeholders never are. Every
 * placeholder keeps a usage count, and is removed from the output maps once all of its uses have been popped.
 *
 * <p>Not thread-safe; a tracker belongs to one render pass.
 */
public class ReferenceTracker {

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceTracker.class);

    private final TypeEngine typeEngine;
    private int nextIndex;
    private final Map<String, Integer> counts = new HashMap<>();
    // placeholder -> attribute name
    private final Map<String, String> attributeNames = new LinkedHashMap<>();
    // attribute name -> placeholder
    private final Map<String, String> nameIndex = new HashMap<>();
    // placeholder -> wire value (null when the value dumped to nothing)
    private final Map<String, AttributeValue> attributeValues = new LinkedHashMap<>();
    // every reference handed out and not yet popped, in issue order
    private final List<Reference> issued = new ArrayList<>();
    // meta conditions currently being rendered
    private final Set<Condition> rendering = Collections.newSetFromMap(new IdentityHashMap<>());

    public ReferenceTracker(TypeEngine typeEngine) {
        this.typeEngine = checkNotNull(typeEngine, "typeEngine is required");
    }

    @VisibleForTesting
    int nextIndex() {
        return nextIndex++;
    }

    /**
     * Returns a name reference for the attribute path, reusing the placeholders already allocated for any of its
     * segments. Integer segments are rendered as list indexes on the preceding segment.
     *
     * @param path the attribute path
     * @return a name reference such as {@code #n0.#n1[3]}
     */
    public Reference nameRef(AttributePath path) {
        StringBuilder rendered = new StringBuilder(segmentRef(path.getDynamoName()));
        for (Object segment : path.getPath()) {
            if (segment instanceof Integer) {
                rendered.append('[').append(segment).append(']');
            } else {
                rendered.append('.').append(segmentRef(segment.toString()));
            }
        }
        return issue(new Reference(rendered.toString(), Reference.Kind.NAME, null));
    }

    /**
     * Allocates a new value placeholder.
     *
     * @param path   the attribute the value is compared against, used to find the type to dump with
     * @param value  the value
     * @param dumped whether the value is already a wire value
     * @param inner  whether the value is an element of the attribute's collection rather than a whole value
     * @return a value reference such as {@code :v1}; its value is null if the value dumped to nothing
     */
    public Reference valueRef(AttributePath path, @Nullable Object value, boolean dumped, boolean inner) {
        String placeholder = ":v" + nextIndex();
        AttributeValue wireValue;
        if (dumped) {
            wireValue = (AttributeValue) value;
        } else {
            Type<?> type = path.getType();
            if (inner) {
                type = elementType(type);
            }
            wireValue = typeEngine.dump(type, value);
        }
        attributeValues.put(placeholder, wireValue);
        counts.merge(placeholder, 1, Integer::sum);
        return issue(new Reference(placeholder, Reference.Kind.VALUE, wireValue));
    }

    /**
     * Returns a name reference if {@code value} is itself an attribute path, otherwise a value reference.
     */
    public Reference anyRef(AttributePath path, @Nullable Object value, boolean dumped, boolean inner) {
        if (value instanceof AttributePath) {
            return nameRef((AttributePath) value);
        }
        return valueRef(path, value, dumped, inner);
    }

    /**
     * Releases one use of each reference. A placeholder is removed from the output once its count reaches zero.
     * Unknown references are ignored, and counts never drop below zero.
     *
     * @param refs the references to release
     */
    public void popRefs(Reference... refs) {
        popRefs(List.of(refs));
    }

    public void popRefs(List<Reference> refs) {
        for (Reference ref : refs) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("popping {}", ref);
            }
            removeIssued(ref);
            if (ref.isName()) {
                // a path renders as "#n0.#n1[3]"; release each segment
                for (String segment : ref.getName().split("\\.")) {
                    int bracket = segment.indexOf('[');
                    popName(bracket < 0 ? segment : segment.substring(0, bracket));
                }
            } else {
                popValue(ref.getName());
            }
        }
    }

    /**
     * Marks the current position, so that a failed render can release everything it allocated after it.
     */
    int checkpoint() {
        return issued.size();
    }

    /**
     * Pops every reference issued since the checkpoint that has not already been popped.
     */
    void rollback(int checkpoint) {
        if (issued.size() > checkpoint) {
            popRefs(new ArrayList<>(issued.subList(checkpoint, issued.size())));
        }
    }

    /**
     * Records that rendering of {@code condition} has started.
     *
     * @return false if the condition is already being rendered further up the tree
     */
    boolean enter(Condition condition) {
        return rendering.add(condition);
    }

    void exit(Condition condition) {
        rendering.remove(condition);
    }

    /**
     * Placeholder to attribute name map, empty if no names are in use.
     */
    public Map<String, String> getAttributeNames() {
        return ImmutableMap.copyOf(attributeNames);
    }

    /**
     * Placeholder to wire value map for the values in use.
     */
    public Map<String, AttributeValue> getAttributeValues() {
        Map<String, AttributeValue> values = new LinkedHashMap<>();
        attributeValues.forEach((placeholder, value) -> {
            if (value != null) {
                values.put(placeholder, value);
            }
        });
        return values;
    }

    @VisibleForTesting
    int getCount(String placeholder) {
        return counts.getOrDefault(placeholder, 0);
    }

    private String segmentRef(String name) {
        String placeholder = nameIndex.get(name);
        if (placeholder == null) {
            placeholder = "#n" + nextIndex();
            attributeNames.put(placeholder, name);
            nameIndex.put(name, placeholder);
        }
        counts.merge(placeholder, 1, Integer::sum);
        return placeholder;
    }

    private void popName(String placeholder) {
        if (decrement(placeholder)) {
            String name = attributeNames.remove(placeholder);
            if (name != null) {
                nameIndex.remove(name);
            }
        }
    }

    private void popValue(String placeholder) {
        if (decrement(placeholder)) {
            attributeValues.remove(placeholder);
        }
    }

    /**
     * Returns true when the last use of the placeholder was released.
     */
    private boolean decrement(String placeholder) {
        Integer count = counts.get(placeholder);
        if (count == null || count == 0) {
            return false;
        }
        counts.put(placeholder, count - 1);
        if (count == 1) {
            LOG.debug("popping last usage of {}", placeholder);
            return true;
        }
        return false;
    }

    private Reference issue(Reference reference) {
        issued.add(reference);
        return reference;
    }

    private void removeIssued(Reference ref) {
        for (int i = issued.size() - 1; i >= 0; i--) {
            if (issued.get(i) == ref) {
                issued.remove(i);
                return;
            }
        }
    }

    private static Type<?> elementType(Type<?> type) {
        if (type instanceof SetType) {
            return ((SetType<?>) type).getElementType();
        }
        if (type instanceof ListType) {
            return ((ListType<?>) type).getElementType();
        }
        return type;
    }

}
