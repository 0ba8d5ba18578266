package com.salesforce.dynamodbv2.mapper.stream;

import com.amazonaws.services.dynamodbv2.model.Record;
import com.google.common.base.MoreObjects;
import java.time.Instant;
import java.util.Locale;

/**
 * Event details of a stream record.
 */
public final class RecordMetadata {

    private final Instant createdAt;
    private final String sequenceNumber;
    private final String eventId;
    private final String eventType;
    private final String eventVersion;

    public RecordMetadata(Instant createdAt, String sequenceNumber, String eventId, String eventType,
                          String eventVersion) {
        this.createdAt = createdAt;
        this.sequenceNumber = sequenceNumber;
        this.eventId = eventId;
        this.eventType = eventType;
        this.eventVersion = eventVersion;
    }

    static RecordMetadata from(Record record) {
        return new RecordMetadata(
            record.getDynamodb().getApproximateCreationDateTime().toInstant(),
            record.getDynamodb().getSequenceNumber(),
            record.getEventID(),
            record.getEventName() == null ? null : record.getEventName().toLowerCase(Locale.ROOT),
            record.getEventVersion());
    }

    /**
     * Approximate time the change was made.
     */
    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getSequenceNumber() {
        return sequenceNumber;
    }

    public String getEventId() {
        return eventId;
    }

    /**
     * One of {@code insert}, {@code modify} or {@code remove}.
     */
    public String getEventType() {
        return eventType;
    }

    public String getEventVersion() {
        return eventVersion;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("createdAt", createdAt)
            .add("sequenceNumber", sequenceNumber)
            .add("eventId", eventId)
            .add("eventType", eventType)
            .add("eventVersion", eventVersion)
            .toString();
    }

}
