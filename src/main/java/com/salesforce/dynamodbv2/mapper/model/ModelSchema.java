/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.model;

import static com.amazonaws.services.dynamodbv2.model.KeyType.HASH;
import static com.amazonaws.services.dynamodbv2.model.KeyType.RANGE;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.amazonaws.services.dynamodbv2.model.AttributeDefinition;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.CreateTableRequest;
import com.amazonaws.services.dynamodbv2.model.GlobalSecondaryIndex;
import com.amazonaws.services.dynamodbv2.model.KeySchemaElement;
import com.amazonaws.services.dynamodbv2.model.LocalSecondaryIndex;
import com.amazonaws.services.dynamodbv2.model.Projection;
import com.amazonaws.services.dynamodbv2.model.ProjectionType;
import com.amazonaws.services.dynamodbv2.model.ProvisionedThroughput;
import com.amazonaws.services.dynamodbv2.model.ScalarAttributeType;
import com.google.common.base.MoreObjects;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidModelException;
import com.salesforce.dynamodbv2.mapper.types.TypeEngine;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Describes how a model class maps onto a table: its columns, keys, secondary indexes and stream.
 *
 * <pre>
 * ModelSchema&lt;User&gt; schema = ModelSchema.builder(User.class, User::new)
 *     .withTableName("users")
 *     .withColumns(User.ID, User.EMAIL, User.AGE)
 *     .withIndex(Index.globalIndex("by_email", User.EMAIL).withProjectAll().build())
 *     .withStream(StreamConfig.of(StreamConfig.Include.NEW, StreamConfig.Include.OLD))
 *     .build();
 * </pre>
 *
 * @param <M> the model class
 */
public final class ModelSchema<M> {

    private final Class<M> modelClass;
    private final Supplier<M> factory;
    private final String tableName;
    private final List<Column<M, ?>> columns;
    private final Map<String, Column<M, ?>> byName;
    private final Map<String, Column<M, ?>> byDynamoName;
    private final Column<M, ?> hashKey;
    @Nullable
    private final Column<M, ?> rangeKey;
    private final Map<String, Index<M>> indexes;
    @Nullable
    private final StreamConfig stream;
    private final long readUnits;
    private final long writeUnits;

    private ModelSchema(Builder<M> builder) {
        this.modelClass = builder.modelClass;
        this.factory = builder.factory;
        this.tableName = builder.tableName == null ? builder.modelClass.getSimpleName() : builder.tableName;
        this.columns = List.copyOf(builder.columns);
        this.byName = new LinkedHashMap<>();
        this.byDynamoName = new HashMap<>();
        Column<M, ?> hash = null;
        Column<M, ?> range = null;
        for (Column<M, ?> column : columns) {
            if (byName.put(column.getName(), column) != null) {
                throw new InvalidModelException(modelClass.getSimpleName() + " declares column " + column.getName()
                    + " twice");
            }
            if (byDynamoName.put(column.getDynamoName(), column) != null) {
                throw new InvalidModelException(modelClass.getSimpleName() + " maps two columns to "
                    + column.getDynamoName());
            }
            if (column.isHashKey()) {
                if (hash != null) {
                    throw new InvalidModelException(modelClass.getSimpleName() + " declares more than one hash key");
                }
                hash = column;
            }
            if (column.isRangeKey()) {
                if (range != null) {
                    throw new InvalidModelException(modelClass.getSimpleName() + " declares more than one range key");
                }
                range = column;
            }
        }
        if (hash == null) {
            throw new InvalidModelException(modelClass.getSimpleName() + " has no hash key");
        }
        this.hashKey = hash;
        this.rangeKey = range;
        this.indexes = new LinkedHashMap<>();
        for (Index<M> index : builder.indexes) {
            if (index.getIndexType() == Index.IndexType.LSI && rangeKey == null) {
                throw new InvalidModelException("local index " + index.getName() + " requires "
                    + modelClass.getSimpleName() + " to have a range key");
            }
            index.resolve(hashKey, rangeKey, columns);
            checkOwned(index.getHashKey());
            index.getRangeKey().ifPresent(this::checkOwned);
            index.getIncluded().forEach(this::checkOwned);
            if (indexes.put(index.getName(), index) != null) {
                throw new InvalidModelException(modelClass.getSimpleName() + " declares index " + index.getName()
                    + " twice");
            }
        }
        getKeys().forEach(ModelSchema::scalarType);
        indexes.values().forEach(index -> {
            scalarType(index.getHashKey());
            index.getRangeKey().ifPresent(ModelSchema::scalarType);
        });
        this.stream = builder.stream;
        this.readUnits = builder.readUnits;
        this.writeUnits = builder.writeUnits;
    }

    public static <M> Builder<M> builder(Class<M> modelClass, Supplier<M> factory) {
        return new Builder<>(modelClass, factory);
    }

    public Class<M> getModelClass() {
        return modelClass;
    }

    public M newInstance() {
        return factory.get();
    }

    /**
     * The table name before the engine's table name template is applied.
     */
    public String getTableName() {
        return tableName;
    }

    /**
     * Columns in declaration order.
     */
    public List<Column<M, ?>> getColumns() {
        return columns;
    }

    public Optional<Column<M, ?>> getColumn(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Optional<Column<M, ?>> getColumnByDynamoName(String dynamoName) {
        return Optional.ofNullable(byDynamoName.get(dynamoName));
    }

    /**
     * Columns sorted by their attribute name, the order used when rendering updates and snapshots.
     */
    public List<Column<M, ?>> getColumnsByDynamoName() {
        return columns.stream()
            .sorted(Comparator.comparing(Column::getDynamoName))
            .collect(Collectors.toList());
    }

    public Column<M, ?> getHashKey() {
        return hashKey;
    }

    public Optional<Column<M, ?>> getRangeKey() {
        return Optional.ofNullable(rangeKey);
    }

    /**
     * The hash key, followed by the range key if there is one.
     */
    public List<Column<M, ?>> getKeys() {
        List<Column<M, ?>> keys = new ArrayList<>(2);
        keys.add(hashKey);
        if (rangeKey != null) {
            keys.add(rangeKey);
        }
        return keys;
    }

    public Collection<Index<M>> getIndexes() {
        return indexes.values();
    }

    public Optional<Index<M>> getIndex(String name) {
        return Optional.ofNullable(indexes.get(name));
    }

    public Optional<StreamConfig> getStream() {
        return Optional.ofNullable(stream);
    }

    public boolean owns(Column<?, ?> column) {
        return byName.get(column.getName()) == column;
    }

    /**
     * Dumps the key attributes of an object.
     *
     * @throws InvalidModelException if a key attribute is missing
     */
    public Map<String, AttributeValue> dumpKey(M obj, TypeEngine typeEngine) {
        Map<String, AttributeValue> key = new LinkedHashMap<>();
        for (Column<M, ?> column : getKeys()) {
            AttributeValue value = typeEngine.dump(column.getType(), column.get(obj));
            if (value == null) {
                throw new InvalidModelException(modelClass.getSimpleName() + " is missing key attribute "
                    + column.getName());
            }
            key.put(column.getDynamoName(), value);
        }
        return key;
    }

    /**
     * Copies the given columns from an item onto an object. Columns missing from the item are set to their empty
     * value.
     */
    public void load(M obj, Map<String, AttributeValue> item, Collection<Column<M, ?>> toLoad,
                     TypeEngine typeEngine) {
        for (Column<M, ?> column : toLoad) {
            column.setUnchecked(obj, typeEngine.load(column.getType(), item.get(column.getDynamoName())));
        }
    }

    /**
     * Creates a new object from an item, e.g. a stream image.
     */
    public M instantiate(Map<String, AttributeValue> item, TypeEngine typeEngine) {
        M obj = newInstance();
        load(obj, item, columns, typeEngine);
        return obj;
    }

    /**
     * Key schema of the table, hash key first.
     */
    public List<KeySchemaElement> getKeySchema() {
        List<KeySchemaElement> keySchema = new ArrayList<>(2);
        keySchema.add(new KeySchemaElement(hashKey.getDynamoName(), HASH));
        if (rangeKey != null) {
            keySchema.add(new KeySchemaElement(rangeKey.getDynamoName(), RANGE));
        }
        return keySchema;
    }

    /**
     * Builds the request that creates this model's table under the given name.
     */
    public CreateTableRequest createTableRequest(String physicalName) {
        Map<String, AttributeDefinition> definitions = new LinkedHashMap<>();
        getKeys().forEach(key -> addDefinition(definitions, key));
        CreateTableRequest request = new CreateTableRequest()
            .withTableName(physicalName)
            .withKeySchema(getKeySchema())
            .withProvisionedThroughput(new ProvisionedThroughput(readUnits, writeUnits));
        for (Index<M> index : indexes.values()) {
            List<KeySchemaElement> keySchema = new ArrayList<>(2);
            keySchema.add(new KeySchemaElement(index.getHashKey().getDynamoName(), HASH));
            addDefinition(definitions, index.getHashKey());
            index.getRangeKey().ifPresent(range -> {
                keySchema.add(new KeySchemaElement(range.getDynamoName(), RANGE));
                addDefinition(definitions, range);
            });
            Projection projection = new Projection().withProjectionType(index.getProjectionType());
            if (index.getProjectionType() == ProjectionType.INCLUDE) {
                projection.withNonKeyAttributes(index.getIncluded().stream()
                    .map(Column::getDynamoName)
                    .collect(Collectors.toList()));
            }
            if (index.isGlobal()) {
                request.withGlobalSecondaryIndexes(new GlobalSecondaryIndex()
                    .withIndexName(index.getName())
                    .withKeySchema(keySchema)
                    .withProjection(projection)
                    .withProvisionedThroughput(new ProvisionedThroughput(index.getReadUnits(),
                        index.getWriteUnits())));
            } else {
                request.withLocalSecondaryIndexes(new LocalSecondaryIndex()
                    .withIndexName(index.getName())
                    .withKeySchema(keySchema)
                    .withProjection(projection));
            }
        }
        if (stream != null) {
            request.withStreamSpecification(stream.toSpecification());
        }
        return request.withAttributeDefinitions(new ArrayList<>(definitions.values()));
    }

    private void checkOwned(Column<M, ?> column) {
        if (!owns(column)) {
            throw new InvalidModelException("column " + column.getName() + " is not part of "
                + modelClass.getSimpleName());
        }
    }

    private static void addDefinition(Map<String, AttributeDefinition> definitions, Column<?, ?> column) {
        definitions.computeIfAbsent(column.getDynamoName(),
            name -> new AttributeDefinition(name, scalarType(column)));
    }

    private static ScalarAttributeType scalarType(Column<?, ?> column) {
        String backingType = column.getType().getBackingType();
        switch (backingType) {
            case "S":
                return ScalarAttributeType.S;
            case "N":
                return ScalarAttributeType.N;
            case "B":
                return ScalarAttributeType.B;
            default:
                throw new InvalidModelException("key column " + column.getName() + " must be a string, number or"
                    + " binary type, not " + backingType);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("modelClass", modelClass.getSimpleName())
            .add("tableName", tableName)
            .toString();
    }

    public static class Builder<M> {

        private final Class<M> modelClass;
        private final Supplier<M> factory;
        private String tableName;
        private final List<Column<M, ?>> columns = new ArrayList<>();
        private final List<Index<M>> indexes = new ArrayList<>();
        private StreamConfig stream;
        private long readUnits = 1L;
        private long writeUnits = 1L;

        private Builder(Class<M> modelClass, Supplier<M> factory) {
            this.modelClass = checkNotNull(modelClass, "modelClass is required");
            this.factory = checkNotNull(factory, "factory is required");
        }

        public Builder<M> withTableName(String tableName) {
            checkArgument(tableName != null && !tableName.isEmpty(), "tableName must not be empty");
            this.tableName = tableName;
            return this;
        }

        @SafeVarargs
        public final Builder<M> withColumns(Column<M, ?>... columns) {
            this.columns.addAll(List.of(columns));
            return this;
        }

        public Builder<M> withIndex(Index<M> index) {
            this.indexes.add(checkNotNull(index, "index is required"));
            return this;
        }

        public Builder<M> withStream(StreamConfig stream) {
            this.stream = stream;
            return this;
        }

        public Builder<M> withThroughput(long readUnits, long writeUnits) {
            this.readUnits = readUnits;
            this.writeUnits = writeUnits;
            return this;
        }

        public ModelSchema<M> build() {
            return new ModelSchema<>(this);
        }

    }

}
