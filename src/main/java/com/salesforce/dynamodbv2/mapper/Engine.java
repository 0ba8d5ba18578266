/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.awaitility.Awaitility.await;

import com.amazonaws.services.dynamodbv2.AmazonDynamoDB;
import com.amazonaws.services.dynamodbv2.AmazonDynamoDBStreams;
import com.amazonaws.services.dynamodbv2.model.AttributeDefinition;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.DeleteItemRequest;
import com.amazonaws.services.dynamodbv2.model.GlobalSecondaryIndexDescription;
import com.amazonaws.services.dynamodbv2.model.IndexStatus;
import com.amazonaws.services.dynamodbv2.model.KeysAndAttributes;
import com.amazonaws.services.dynamodbv2.model.ReturnValue;
import com.amazonaws.services.dynamodbv2.model.TableDescription;
import com.amazonaws.services.dynamodbv2.model.TableStatus;
import com.amazonaws.services.dynamodbv2.model.UpdateItemRequest;
import com.amazonaws.services.dynamodbv2.model.UpdateItemResult;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.salesforce.dynamodbv2.mapper.condition.Condition;
import com.salesforce.dynamodbv2.mapper.exceptions.ConstraintViolationException;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidModelException;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidStreamException;
import com.salesforce.dynamodbv2.mapper.exceptions.MissingObjectsException;
import com.salesforce.dynamodbv2.mapper.exceptions.TableMismatchException;
import com.salesforce.dynamodbv2.mapper.expression.ExpressionRenderer;
import com.salesforce.dynamodbv2.mapper.expression.RenderedExpression;
import com.salesforce.dynamodbv2.mapper.model.Action;
import com.salesforce.dynamodbv2.mapper.model.ActionType;
import com.salesforce.dynamodbv2.mapper.model.Column;
import com.salesforce.dynamodbv2.mapper.model.ModelSchema;
import com.salesforce.dynamodbv2.mapper.model.StreamConfig;
import com.salesforce.dynamodbv2.mapper.search.Search;
import com.salesforce.dynamodbv2.mapper.session.SessionRetry;
import com.salesforce.dynamodbv2.mapper.session.SessionWrapper;
import com.salesforce.dynamodbv2.mapper.stream.Coordinator;
import com.salesforce.dynamodbv2.mapper.stream.Position;
import com.salesforce.dynamodbv2.mapper.stream.Stream;
import com.salesforce.dynamodbv2.mapper.stream.StreamToken;
import com.salesforce.dynamodbv2.mapper.tracking.ChangeTracker;
import com.salesforce.dynamodbv2.mapper.types.TypeEngine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import org.awaitility.pollinterval.FixedPollInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for mapping model objects to DynamoDB tables.
 *
 * <p>Models are bound once with {@link #bind(ModelSchema)}, which creates their tables if needed. Changes made
 * through {@link #set}, {@link #unset} and {@link #apply} are tracked so that {@link #save} only writes the columns
 * that changed, and atomic saves and deletes only succeed if the stored item still matches what this engine last
 * saw.
 */
public class Engine {

    private static final Logger LOG = LoggerFactory.getLogger(Engine.class);

    static final String TABLE_NAME_PLACEHOLDER = "{table_name}";

    private final SessionWrapper session;
    private final TypeEngine typeEngine;
    private final ChangeTracker changeTracker;
    private final String tableNameTemplate;
    private final MeterRegistry meterRegistry;
    private final String metricPrefix;
    private final int tablePollIntervalSeconds;
    private final int tableTimeoutSeconds;
    private final boolean skipTableSetup;
    private final List<EngineObserver> observers;

    private final Map<Class<?>, ModelSchema<?>> models = new ConcurrentHashMap<>();
    private final Map<Class<?>, String> tableNames = new ConcurrentHashMap<>();

    @VisibleForTesting
    Engine(SessionWrapper session, TypeEngine typeEngine, String tableNameTemplate, MeterRegistry meterRegistry,
           @Nullable String metricPrefix, int tablePollIntervalSeconds, int tableTimeoutSeconds,
           boolean skipTableSetup, List<EngineObserver> observers) {
        this.session = session;
        this.typeEngine = typeEngine;
        this.changeTracker = new ChangeTracker(typeEngine);
        this.tableNameTemplate = tableNameTemplate;
        this.meterRegistry = meterRegistry;
        this.metricPrefix = metricPrefix;
        this.tablePollIntervalSeconds = tablePollIntervalSeconds;
        this.tableTimeoutSeconds = tableTimeoutSeconds;
        this.skipTableSetup = skipTableSetup;
        this.observers = new CopyOnWriteArrayList<>(observers);
    }

    public static Builder builder(AmazonDynamoDB amazonDynamoDb) {
        return new Builder(amazonDynamoDb);
    }

    public TypeEngine getTypeEngine() {
        return typeEngine;
    }

    public ChangeTracker getChangeTracker() {
        return changeTracker;
    }

    /**
     * Physical table name of a model after the table name template was applied.
     */
    public String getTableName(ModelSchema<?> schema) {
        return tableNameTemplate.replace(TABLE_NAME_PLACEHOLDER, schema.getTableName());
    }

    /**
     * Creates the model's table unless it already exists, waits for it to become active and checks that it
     * matches the model.
     *
     * @throws TableMismatchException if the existing table does not match the model
     */
    public <M> void bind(ModelSchema<M> schema) {
        String tableName = getTableName(schema);
        if (!skipTableSetup) {
            if (session.createTable(schema.createTableRequest(tableName))) {
                LOG.info("created table={} for model={}", tableName, schema.getModelClass().getSimpleName());
            }
            awaitTableActive(tableName);
        }
        TableDescription description = session.describeTable(tableName);
        if (description == null) {
            throw new TableMismatchException("table=" + tableName + " does not exist");
        }
        validateTable(schema, description);
        schema.getStream().ifPresent(stream -> stream.setArn(description.getLatestStreamArn()));
        models.put(schema.getModelClass(), schema);
        tableNames.put(schema.getModelClass(), tableName);
        LOG.info("bound model={} to table={}", schema.getModelClass().getSimpleName(), tableName);
        observers.forEach(observer -> observer.modelBound(schema, tableName));
    }

    private void awaitTableActive(String tableName) {
        LOG.info("awaiting " + tableTimeoutSeconds + "s for table=" + tableName + " to become active ...");
        await().pollInSameThread()
            .pollInterval(new FixedPollInterval(Duration.ofSeconds(tablePollIntervalSeconds)))
            .atMost(tableTimeoutSeconds, SECONDS)
            .until(() -> isActive(session.describeTable(tableName)));
    }

    private static boolean isActive(@Nullable TableDescription description) {
        if (description == null || !TableStatus.ACTIVE.toString().equals(description.getTableStatus())) {
            return false;
        }
        if (description.getGlobalSecondaryIndexes() != null) {
            for (GlobalSecondaryIndexDescription index : description.getGlobalSecondaryIndexes()) {
                if (!IndexStatus.ACTIVE.toString().equals(index.getIndexStatus())) {
                    return false;
                }
            }
        }
        return true;
    }

    private static <M> void validateTable(ModelSchema<M> schema, TableDescription description) {
        String tableName = description.getTableName();
        if (!schema.getKeySchema().equals(description.getKeySchema())) {
            throw new TableMismatchException("table=" + tableName + " has key schema " + description.getKeySchema()
                + " but model " + schema.getModelClass().getSimpleName() + " expects " + schema.getKeySchema());
        }
        Map<String, String> attributeTypes = new HashMap<>();
        if (description.getAttributeDefinitions() != null) {
            for (AttributeDefinition definition : description.getAttributeDefinitions()) {
                attributeTypes.put(definition.getAttributeName(), definition.getAttributeType());
            }
        }
        for (Column<M, ?> key : schema.getKeys()) {
            String expected = key.getType().getBackingType();
            String actual = attributeTypes.get(key.getDynamoName());
            if (!expected.equals(actual)) {
                throw new TableMismatchException("table=" + tableName + " defines key " + key.getDynamoName()
                    + " as " + actual + " but model " + schema.getModelClass().getSimpleName() + " expects "
                    + expected);
            }
        }
        StreamConfig stream = schema.getStream().orElse(null);
        if (stream != null) {
            boolean enabled = description.getStreamSpecification() != null
                && Boolean.TRUE.equals(description.getStreamSpecification().getStreamEnabled());
            if (!enabled || !stream.getViewType().toString()
                .equals(description.getStreamSpecification().getStreamViewType())) {
                throw new TableMismatchException("table=" + tableName + " does not have a "
                    + stream.getViewType() + " stream");
            }
        }
    }

    /**
     * Sets a column's value locally and marks it to be saved.
     */
    public <M, V> void set(M obj, Column<M, V> column, @Nullable V value) {
        ensureOwned(obj, column);
        column.set(obj, value);
        changeTracker.mark(obj, column);
        observers.forEach(observer -> observer.objectModified(obj, column, value));
    }

    /**
     * Clears a column locally and marks it so that saving removes the attribute.
     */
    public <M> void unset(M obj, Column<M, ?> column) {
        ensureOwned(obj, column);
        column.setUnchecked(obj, null);
        changeTracker.mark(obj, column);
        observers.forEach(observer -> observer.objectModified(obj, column, null));
    }

    /**
     * Records an update action for the next save. {@code set} and {@code remove} actions change the local value
     * right away; {@code add} and {@code delete} are applied by DynamoDB and the new value is loaded when the
     * object is saved.
     *
     * @throws InvalidModelException if the action does not apply to the column's type
     */
    public <M> void apply(M obj, Column<M, ?> column, Action action) {
        ensureOwned(obj, column);
        checkNotNull(action, "action is required");
        String backingType = column.getType().getBackingType();
        boolean isSet = backingType.length() == 2 && backingType.endsWith("S");
        if (action.getType() == ActionType.ADD && !isSet && !"N".equals(backingType)) {
            throw new InvalidModelException("add is only supported for numbers and sets, not column "
                + column.getName() + " of type " + backingType);
        }
        if (action.getType() == ActionType.DELETE && !isSet) {
            throw new InvalidModelException("delete is only supported for sets, not column " + column.getName()
                + " of type " + backingType);
        }
        if (column.isKey() && action.getType() != ActionType.SET) {
            throw new InvalidModelException("key column " + column.getName() + " can only be set");
        }
        Object local = null;
        switch (action.getType()) {
            case SET:
                local = action.getValue();
                column.setUnchecked(obj, local);
                break;
            case REMOVE:
                column.setUnchecked(obj, null);
                break;
            default:
                break;
        }
        changeTracker.setAction(obj, column, action);
        Object value = local;
        observers.forEach(observer -> observer.objectModified(obj, column, value));
    }

    /**
     * Saves the changed columns of an object.
     *
     * @param condition an extra condition the stored item must meet, may be null
     * @param atomic    whether the stored item must also still match what this engine last saw
     * @throws ConstraintViolationException if a condition failed
     */
    public <M> void save(M obj, @Nullable Condition condition, boolean atomic) {
        ModelSchema<M> schema = schemaOf(obj);
        boolean serverSideUpdate = changeTracker.getActions(obj).values().stream()
            .anyMatch(action -> action.getType() == ActionType.ADD || action.getType() == ActionType.DELETE);
        RenderedExpression rendered = new ExpressionRenderer<>(schema, typeEngine, changeTracker)
            .condition(condition, atomic, obj)
            .update(obj)
            .build();
        UpdateItemRequest request = rendered.applyTo(new UpdateItemRequest()
            .withTableName(tableNameOf(schema))
            .withKey(schema.dumpKey(obj, typeEngine)));
        if (serverSideUpdate) {
            request.setReturnValues(ReturnValue.UPDATED_NEW);
        }
        UpdateItemResult result = session.saveItem(request);
        if (serverSideUpdate && result.getAttributes() != null) {
            List<Column<M, ?>> updated = schema.getColumns().stream()
                .filter(column -> result.getAttributes().containsKey(column.getDynamoName()))
                .collect(Collectors.toList());
            schema.load(obj, result.getAttributes(), updated, typeEngine);
        }
        changeTracker.sync(obj, schema);
        observers.forEach(observer -> observer.objectSaved(obj));
    }

    public <M> void save(M obj) {
        save(obj, null, false);
    }

    /**
     * Deletes an object's item and stops tracking the object.
     *
     * @throws ConstraintViolationException if a condition failed
     */
    public <M> void delete(M obj, @Nullable Condition condition, boolean atomic) {
        ModelSchema<M> schema = schemaOf(obj);
        RenderedExpression rendered = new ExpressionRenderer<>(schema, typeEngine, changeTracker)
            .condition(condition, atomic, obj)
            .build();
        DeleteItemRequest request = rendered.applyTo(new DeleteItemRequest()
            .withTableName(tableNameOf(schema))
            .withKey(schema.dumpKey(obj, typeEngine)));
        session.deleteItem(request);
        changeTracker.clear(obj);
        observers.forEach(observer -> observer.objectDeleted(obj));
    }

    public <M> void delete(M obj) {
        delete(obj, null, false);
    }

    /**
     * Loads every column of the given objects by their keys. Objects of different models can be loaded together.
     *
     * @throws MissingObjectsException if some objects were not found; the others are still loaded
     */
    public void load(Object... objs) {
        batchLoad(false, objs);
    }

    /**
     * Like {@link #load(Object...)} with strongly consistent reads.
     */
    public void loadConsistent(Object... objs) {
        batchLoad(true, objs);
    }

    private void batchLoad(boolean consistent, Object[] objs) {
        // table -> key -> objects sharing that key
        Map<String, Map<Map<String, AttributeValue>, List<Object>>> pending = new LinkedHashMap<>();
        Map<String, ModelSchema<Object>> schemas = new HashMap<>();
        Map<String, KeysAndAttributes> request = new LinkedHashMap<>();
        for (Object obj : objs) {
            ModelSchema<Object> schema = schemaOf(obj);
            String tableName = tableNameOf(schema);
            schemas.put(tableName, schema);
            Map<String, AttributeValue> key = schema.dumpKey(obj, typeEngine);
            List<Object> sameKey = pending.computeIfAbsent(tableName, t -> new LinkedHashMap<>())
                .computeIfAbsent(key, k -> new ArrayList<>());
            if (sameKey.isEmpty()) {
                request.computeIfAbsent(tableName, t -> new KeysAndAttributes().withConsistentRead(consistent))
                    .withKeys(key);
            }
            sameKey.add(obj);
        }
        if (request.isEmpty()) {
            return;
        }
        session.loadItems(request).forEach((tableName, items) -> {
            ModelSchema<Object> schema = schemas.get(tableName);
            Map<Map<String, AttributeValue>, List<Object>> byKey = pending.get(tableName);
            for (Map<String, AttributeValue> item : items) {
                List<Object> found = byKey.remove(extractKey(schema, item));
                if (found == null) {
                    LOG.warn("ignoring unexpected item from table={}", tableName);
                    continue;
                }
                for (Object obj : found) {
                    schema.load(obj, item, schema.getColumns(), typeEngine);
                    onLoaded(obj, schema.getColumns());
                }
            }
        });
        Set<Object> missing = Collections.newSetFromMap(new IdentityHashMap<>());
        pending.values().forEach(byKey -> byKey.values().forEach(missing::addAll));
        if (!missing.isEmpty()) {
            throw new MissingObjectsException("failed to load " + missing.size() + " objects", missing);
        }
    }

    // round trips each key attribute through its type so it compares equal to a dumped request key
    private Map<String, AttributeValue> extractKey(ModelSchema<?> schema, Map<String, AttributeValue> item) {
        Map<String, AttributeValue> key = new LinkedHashMap<>();
        for (Column<?, ?> column : schema.getKeys()) {
            Object value = typeEngine.load(column.getType(), item.get(column.getDynamoName()));
            key.put(column.getDynamoName(), typeEngine.dump(column.getType(), value));
        }
        return key;
    }

    public <M> Search<M> query(ModelSchema<M> schema) {
        return search(Search.Mode.QUERY, schema);
    }

    public <M> Search<M> scan(ModelSchema<M> schema) {
        return search(Search.Mode.SCAN, schema);
    }

    private <M> Search<M> search(Search.Mode mode, ModelSchema<M> schema) {
        return new Search<>(mode, schema, tableNameOf(schema), session, typeEngine, changeTracker, this::onLoaded);
    }

    /**
     * Opens a model's stream at the trim horizon or at the latest record.
     */
    public <M> Stream<M> stream(ModelSchema<M> schema, Position position) {
        Stream<M> stream = openStream(schema);
        stream.moveTo(position);
        return stream;
    }

    /**
     * Opens a model's stream where an earlier stream's token left off.
     */
    public <M> Stream<M> stream(ModelSchema<M> schema, StreamToken token) {
        Stream<M> stream = openStream(schema);
        stream.moveTo(token);
        return stream;
    }

    /**
     * Opens a model's stream at the first records created at or after the given time.
     */
    public <M> Stream<M> stream(ModelSchema<M> schema, Instant position) {
        Stream<M> stream = openStream(schema);
        stream.moveTo(position);
        return stream;
    }

    private <M> Stream<M> openStream(ModelSchema<M> schema) {
        tableNameOf(schema);
        StreamConfig config = schema.getStream().orElseThrow(() ->
            new InvalidStreamException(schema.getModelClass().getSimpleName() + " does not have a stream"));
        if (config.getArn() == null) {
            throw new InvalidStreamException("stream of " + schema.getModelClass().getSimpleName()
                + " has no arn; is the table's stream enabled?");
        }
        Coordinator coordinator = new Coordinator(session, config.getArn(), meterRegistry, metricPrefix);
        BiConsumer<M, Collection<Column<M, ?>>> onLoaded = this::onLoaded;
        return new Stream<>(schema, coordinator, typeEngine, onLoaded);
    }

    /**
     * Marks loaded columns, takes a new snapshot and notifies observers.
     */
    private <M> void onLoaded(M obj, Collection<? extends Column<?, ?>> columns) {
        ModelSchema<M> schema = schemaOf(obj);
        for (Column<?, ?> column : columns) {
            changeTracker.mark(obj, column);
        }
        changeTracker.sync(obj, schema);
        observers.forEach(observer -> observer.objectLoaded(obj));
    }

    @SuppressWarnings("unchecked")
    private <M> ModelSchema<M> schemaOf(M obj) {
        checkNotNull(obj, "obj is required");
        ModelSchema<?> schema = models.get(obj.getClass());
        if (schema == null) {
            throw new InvalidModelException(obj.getClass().getSimpleName() + " is not bound");
        }
        return (ModelSchema<M>) schema;
    }

    private String tableNameOf(ModelSchema<?> schema) {
        String tableName = tableNames.get(schema.getModelClass());
        if (tableName == null || models.get(schema.getModelClass()) != schema) {
            throw new InvalidModelException(schema.getModelClass().getSimpleName() + " is not bound");
        }
        return tableName;
    }

    private <M> void ensureOwned(M obj, Column<M, ?> column) {
        ModelSchema<M> schema = schemaOf(obj);
        if (!schema.owns(column)) {
            throw new InvalidModelException("column " + column.getName() + " is not part of "
                + schema.getModelClass().getSimpleName());
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("tableNameTemplate", tableNameTemplate)
            .add("models", tableNames)
            .toString();
    }

    public static class Builder {

        private final AmazonDynamoDB amazonDynamoDb;
        private AmazonDynamoDBStreams amazonDynamoDbStreams;
        private String tableNameTemplate = TABLE_NAME_PLACEHOLDER;
        private MeterRegistry meterRegistry;
        private String metricPrefix;
        private TypeEngine typeEngine;
        private SessionRetry retry;
        private int tablePollIntervalSeconds = 1;
        private int tableTimeoutSeconds = 600;
        private boolean skipTableSetup;
        private final List<EngineObserver> observers = new ArrayList<>();

        private Builder(AmazonDynamoDB amazonDynamoDb) {
            this.amazonDynamoDb = checkNotNull(amazonDynamoDb, "amazonDynamoDb is required");
        }

        public Builder withAmazonDynamoDbStreams(AmazonDynamoDBStreams amazonDynamoDbStreams) {
            this.amazonDynamoDbStreams = amazonDynamoDbStreams;
            return this;
        }

        /**
         * Template for physical table names, e.g. {@code "prod-{table_name}"}.
         */
        public Builder withTableNameTemplate(String tableNameTemplate) {
            checkArgument(tableNameTemplate != null && tableNameTemplate.contains(TABLE_NAME_PLACEHOLDER),
                "table name template must contain " + TABLE_NAME_PLACEHOLDER);
            this.tableNameTemplate = tableNameTemplate;
            return this;
        }

        public Builder withMeterRegistry(MeterRegistry meterRegistry, String metricPrefix) {
            this.meterRegistry = meterRegistry;
            this.metricPrefix = metricPrefix;
            return this;
        }

        public Builder withTypeEngine(TypeEngine typeEngine) {
            this.typeEngine = typeEngine;
            return this;
        }

        public Builder withRetry(SessionRetry retry) {
            this.retry = retry;
            return this;
        }

        public Builder withTablePollIntervalSeconds(int tablePollIntervalSeconds) {
            checkArgument(tablePollIntervalSeconds > 0, "tablePollIntervalSeconds must be positive");
            this.tablePollIntervalSeconds = tablePollIntervalSeconds;
            return this;
        }

        public Builder withTableTimeoutSeconds(int tableTimeoutSeconds) {
            checkArgument(tableTimeoutSeconds > 0, "tableTimeoutSeconds must be positive");
            this.tableTimeoutSeconds = tableTimeoutSeconds;
            return this;
        }

        /**
         * Skips table creation; bind only checks that the existing table matches.
         */
        public Builder withSkipTableSetup(boolean skipTableSetup) {
            this.skipTableSetup = skipTableSetup;
            return this;
        }

        public Builder withObserver(EngineObserver observer) {
            observers.add(checkNotNull(observer, "observer is required"));
            return this;
        }

        public Engine build() {
            MeterRegistry registry = meterRegistry == null ? new CompositeMeterRegistry() : meterRegistry;
            SessionWrapper.Builder session = SessionWrapper.builder(amazonDynamoDb)
                .withMeterRegistry(registry, metricPrefix);
            if (amazonDynamoDbStreams != null) {
                session.withAmazonDynamoDbStreams(amazonDynamoDbStreams);
            }
            if (retry != null) {
                session.withRetry(retry);
            }
            return new Engine(session.build(),
                typeEngine == null ? new TypeEngine() : typeEngine,
                tableNameTemplate,
                registry,
                metricPrefix,
                tablePollIntervalSeconds,
                tableTimeoutSeconds,
                skipTableSetup,
                observers);
        }

    }

}
