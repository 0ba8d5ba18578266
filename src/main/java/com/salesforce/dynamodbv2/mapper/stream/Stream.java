package com.salesforce.dynamodbv2.mapper.stream;

import static com.google.common.base.Preconditions.checkNotNull;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.Record;
import com.amazonaws.services.dynamodbv2.model.StreamRecord;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidStreamException;
import com.salesforce.dynamodbv2.mapper.model.Column;
import com.salesforce.dynamodbv2.mapper.model.ModelSchema;
import com.salesforce.dynamodbv2.mapper.model.StreamConfig;
import com.salesforce.dynamodbv2.mapper.types.TypeEngine;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import javax.annotation.Nullable;

/**
 * Reads the change records of one model's stream.
 *
 * <pre>
 * Stream&lt;User&gt; stream = engine.stream(userSchema, Position.TRIM_HORIZON);
 * while (running) {
 *     ChangeRecord&lt;User&gt; record = stream.next();
 *     if (record == null) {
 *         sleep(backoff);
 *     } else {
 *         process(record);
 *     }
 * }
 * </pre>
 *
 * <p>Records of a single item are in order. Across shards, records are ordered by their approximate creation time,
 * which is best effort for busy tables.
 *
 * @param <M> the model class
 */
public class Stream<M> {

    private final ModelSchema<M> schema;
    private final Coordinator coordinator;
    private final TypeEngine typeEngine;
    private final BiConsumer<M, Collection<Column<M, ?>>> onLoaded;
    private final Set<StreamConfig.Include> include;

    /**
     * Creates a stream.
     *
     * @param onLoaded called with each object loaded from a record and the columns loaded into it
     */
    public Stream(ModelSchema<M> schema, Coordinator coordinator, TypeEngine typeEngine,
                  BiConsumer<M, Collection<Column<M, ?>>> onLoaded) {
        this.schema = checkNotNull(schema, "schema is required");
        this.coordinator = checkNotNull(coordinator, "coordinator is required");
        this.typeEngine = checkNotNull(typeEngine, "typeEngine is required");
        this.onLoaded = checkNotNull(onLoaded, "onLoaded is required");
        this.include = schema.getStream()
            .orElseThrow(() -> new InvalidStreamException(schema.getModelClass().getSimpleName()
                + " does not have a stream"))
            .getInclude();
    }

    /**
     * Returns the next record, or null if none is available right now.
     */
    @Nullable
    public ChangeRecord<M> next() {
        Record record = coordinator.next();
        if (record == null) {
            return null;
        }
        StreamRecord change = record.getDynamodb();
        return new ChangeRecord<>(
            unpack(StreamConfig.Include.KEYS, change.getKeys(), schema.getKeys()),
            unpack(StreamConfig.Include.NEW, change.getNewImage(), schema.getColumns()),
            unpack(StreamConfig.Include.OLD, change.getOldImage(), schema.getColumns()),
            RecordMetadata.from(record));
    }

    /**
     * Keeps idle iterators alive; call at least every 12 minutes.
     */
    public void heartbeat() {
        coordinator.heartbeat();
    }

    public void moveTo(Position position) {
        coordinator.moveTo(position);
    }

    public void moveTo(StreamToken token) {
        coordinator.moveTo(token);
    }

    public void moveTo(Instant position) {
        coordinator.moveTo(position);
    }

    public StreamToken getToken() {
        return coordinator.getToken();
    }

    @Nullable
    private M unpack(StreamConfig.Include image, @Nullable Map<String, AttributeValue> attributes,
                     Collection<Column<M, ?>> expected) {
        if (!include.contains(image) || attributes == null) {
            return null;
        }
        M obj = schema.newInstance();
        schema.load(obj, attributes, expected, typeEngine);
        onLoaded.accept(obj, expected);
        return obj;
    }

    @Override
    public String toString() {
        return "Stream[" + schema.getModelClass().getSimpleName() + "]";
    }

}
