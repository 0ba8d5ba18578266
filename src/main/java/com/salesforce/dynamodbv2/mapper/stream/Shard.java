package com.salesforce.dynamodbv2.mapper.stream;

import static com.google.common.base.Preconditions.checkNotNull;

import com.amazonaws.services.dynamodbv2.model.GetRecordsResult;
import com.amazonaws.services.dynamodbv2.model.Record;
import com.amazonaws.services.dynamodbv2.model.ShardIteratorType;
import com.amazonaws.services.dynamodbv2.model.StreamDescription;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.salesforce.dynamodbv2.mapper.exceptions.ShardIteratorExpiredException;
import com.salesforce.dynamodbv2.mapper.session.SessionWrapper;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one shard of a stream.
 *
 * <p>A shard moves through these positions: unstarted (no iterator), a relative position ({@code TRIM_HORIZON} or
 * {@code LATEST}), {@code AT_SEQUENCE_NUMBER} once a fetch returns its first records, {@code AFTER_SEQUENCE_NUMBER}
 * once the coordinator hands one of its records to a consumer, and finally exhausted once the shard is closed and
 * fully read.
 *
 * <p>Fetches never move the sequence number once one is set; only consumption does, through
 * {@link #markConsumed(String)}.
 */
public class Shard {

    private static final Logger LOG = LoggerFactory.getLogger(Shard.class);

    /**
     * Number of consecutive empty responses after which an open shard is assumed to be at its head.
     */
    static final int CALLS_TO_REACH_HEAD = 5;

    private final String streamArn;
    private final String shardId;
    private final SessionWrapper session;
    private final StreamMeters meters;

    @Nullable
    private String iteratorId;
    private boolean exhausted;
    @Nullable
    private ShardIteratorType iteratorType;
    @Nullable
    private String sequenceNumber;
    @Nullable
    private Shard parent;
    private final List<Shard> children = new ArrayList<>();
    private int emptyResponses;

    public Shard(String streamArn, String shardId, SessionWrapper session) {
        this(streamArn, shardId, session, StreamMeters.noop());
    }

    Shard(String streamArn, String shardId, SessionWrapper session, StreamMeters meters) {
        this.streamArn = checkNotNull(streamArn, "streamArn is required");
        this.shardId = checkNotNull(shardId, "shardId is required");
        this.session = checkNotNull(session, "session is required");
        this.meters = meters;
    }

    public String getStreamArn() {
        return streamArn;
    }

    public String getShardId() {
        return shardId;
    }

    @Nullable
    public String getIteratorId() {
        return iteratorId;
    }

    @Nullable
    public ShardIteratorType getIteratorType() {
        return iteratorType;
    }

    @Nullable
    public String getSequenceNumber() {
        return sequenceNumber;
    }

    @Nullable
    public Shard getParent() {
        return parent;
    }

    public List<Shard> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isExhausted() {
        return exhausted;
    }

    @VisibleForTesting
    int getEmptyResponses() {
        return emptyResponses;
    }

    /**
     * Restores a position without requesting an iterator, e.g. when loading a token.
     */
    void restore(@Nullable ShardIteratorType iteratorType, @Nullable String sequenceNumber) {
        this.iteratorType = iteratorType;
        this.sequenceNumber = sequenceNumber;
    }

    void setParent(@Nullable Shard parent) {
        this.parent = parent;
    }

    void addChild(Shard child) {
        children.add(child);
    }

    /**
     * Records that a record from this shard was handed to a consumer; reading resumes after it.
     */
    void markConsumed(String sequenceNumber) {
        this.sequenceNumber = sequenceNumber;
        this.iteratorType = ShardIteratorType.AFTER_SEQUENCE_NUMBER;
    }

    /**
     * Fetches the next records. If the iterator expired and the shard has a fixed position, a new iterator is
     * requested for that position and the fetch is tried once more.
     *
     * @throws ShardIteratorExpiredException if the iterator expired while at a relative position
     */
    public List<Record> next() {
        try {
            return getRecords();
        } catch (ShardIteratorExpiredException e) {
            if (iteratorType == null || iteratorType == ShardIteratorType.TRIM_HORIZON
                || iteratorType == ShardIteratorType.LATEST) {
                throw e;
            }
            LOG.info("iterator for shard {} expired, refreshing at {} {}", shardId, iteratorType, sequenceNumber);
            meters.iteratorRefreshes.increment();
        }
        jumpTo(iteratorType, sequenceNumber);
        return getRecords();
    }

    /**
     * Requests a new iterator for the given position.
     *
     * @throws com.salesforce.dynamodbv2.mapper.exceptions.RecordsExpiredException if the sequence number is older
     *     than the shard's retention window
     */
    public void jumpTo(ShardIteratorType iteratorType, @Nullable String sequenceNumber) {
        this.iteratorId = session.getShardIterator(streamArn, shardId, iteratorType, sequenceNumber);
        this.exhausted = false;
        this.iteratorType = iteratorType;
        this.sequenceNumber = sequenceNumber;
        this.emptyResponses = 0;
    }

    public void jumpTo(ShardIteratorType iteratorType) {
        jumpTo(iteratorType, null);
    }

    /**
     * Moves to the first records created at or after the given time, reading from the trim horizon.
     *
     * @return the first records at or after the time; empty if the shard was exhausted or its head reached first
     */
    public List<Record> seekTo(Instant position) {
        jumpTo(ShardIteratorType.TRIM_HORIZON);
        while (!exhausted && emptyResponses < CALLS_TO_REACH_HEAD) {
            List<Record> records = getRecords();
            if (!records.isEmpty() && !createdAt(records.get(records.size() - 1)).isBefore(position)) {
                int first = 0;
                while (createdAt(records.get(first)).isBefore(position)) {
                    first++;
                }
                // earlier records fixed the position before the time; it starts at the first record returned
                this.sequenceNumber = records.get(first).getDynamodb().getSequenceNumber();
                this.iteratorType = ShardIteratorType.AT_SEQUENCE_NUMBER;
                return new ArrayList<>(records.subList(first, records.size()));
            }
        }
        return List.of();
    }

    /**
     * Discovers the shard's descendants, unless its children are already known.
     *
     * @return the children
     */
    public List<Shard> loadChildren() {
        if (!children.isEmpty()) {
            return getChildren();
        }
        StreamDescription description = session.describeStream(streamArn, shardId);
        ListMultimap<String, Shard> byParent = ArrayListMultimap.create();
        Map<String, Shard> byId = new HashMap<>();
        Map<String, String> parentIds = new HashMap<>();
        for (com.amazonaws.services.dynamodbv2.model.Shard described : description.getShards()) {
            Shard shard = new Shard(streamArn, described.getShardId(), session, meters);
            byId.put(shard.shardId, shard);
            if (described.getParentShardId() != null) {
                byParent.put(described.getParentShardId(), shard);
                parentIds.put(shard.shardId, described.getParentShardId());
            }
        }
        byId.put(shardId, this);
        Deque<Shard> toInsert = new ArrayDeque<>(byParent.get(shardId));
        while (!toInsert.isEmpty()) {
            Shard shard = toInsert.poll();
            Shard shardParent = byId.get(parentIds.get(shard.shardId));
            shard.parent = shardParent;
            shardParent.children.add(shard);
            toInsert.addAll(byParent.get(shard.shardId));
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("loaded children {} of shard {}", childIds(), shardId);
        }
        return getChildren();
    }

    /**
     * Fetches records, reading ahead through empty responses. Once the shard has seen {@value #CALLS_TO_REACH_HEAD}
     * consecutive empty responses it is assumed to be at its head and only one fetch is made per call.
     */
    public List<Record> getRecords() {
        if (exhausted) {
            return List.of();
        }
        if (emptyResponses >= CALLS_TO_REACH_HEAD) {
            return apply(session.getStreamRecords(iteratorId));
        }
        while (emptyResponses < CALLS_TO_REACH_HEAD && !exhausted) {
            List<Record> records = apply(session.getStreamRecords(iteratorId));
            if (!records.isEmpty()) {
                return records;
            }
        }
        return List.of();
    }

    /**
     * This shard and all of its descendants, breadth first.
     */
    public List<Shard> walkTree() {
        List<Shard> shards = new ArrayList<>();
        Deque<Shard> pending = new ArrayDeque<>();
        pending.add(this);
        while (!pending.isEmpty()) {
            Shard shard = pending.poll();
            shards.add(shard);
            pending.addAll(shard.children);
        }
        return shards;
    }

    public ShardToken getToken() {
        return new ShardToken(shardId, iteratorType, sequenceNumber, parent == null ? null : parent.shardId);
    }

    private List<Record> apply(GetRecordsResult result) {
        List<Record> records = result.getRecords() == null ? List.of() : result.getRecords();
        iteratorId = result.getNextShardIterator();
        if (iteratorId == null) {
            exhausted = true;
            LOG.debug("shard {} is exhausted", shardId);
        }
        if (!records.isEmpty() && sequenceNumber == null) {
            sequenceNumber = records.get(0).getDynamodb().getSequenceNumber();
            iteratorType = ShardIteratorType.AT_SEQUENCE_NUMBER;
        } else if (records.isEmpty()) {
            emptyResponses++;
        }
        return records;
    }

    private Set<String> childIds() {
        return children.stream().map(Shard::getShardId).collect(Collectors.toSet());
    }

    private static Instant createdAt(Record record) {
        return record.getDynamodb().getApproximateCreationDateTime().toInstant();
    }

    /**
     * Shards are equal when they have the same position, iterator and children.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Shard that = (Shard) o;
        return streamArn.equals(that.streamArn)
            && getToken().equals(that.getToken())
            && exhausted == that.exhausted
            && Objects.equals(iteratorId, that.iteratorId)
            && childIds().equals(that.childIds());
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamArn, shardId);
    }

    @Override
    public String toString() {
        String details;
        if (exhausted) {
            details = "exhausted, ";
        } else if (iteratorType == ShardIteratorType.AT_SEQUENCE_NUMBER) {
            details = "at_seq=" + sequenceNumber + ", ";
        } else if (iteratorType == ShardIteratorType.AFTER_SEQUENCE_NUMBER) {
            details = "after_seq=" + sequenceNumber + ", ";
        } else if (iteratorType != null) {
            details = iteratorType.toString().toLowerCase(Locale.ROOT) + ", ";
        } else {
            details = "";
        }
        return "Shard[" + details + "id=" + shardId + "]";
    }

}
