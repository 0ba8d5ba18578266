package com.salesforce.dynamodbv2.mapper.stream;

import static com.google.common.base.Preconditions.checkNotNull;

import com.amazonaws.services.dynamodbv2.model.Record;
import com.amazonaws.services.dynamodbv2.model.ShardIteratorType;
import com.amazonaws.services.dynamodbv2.model.StreamDescription;
import com.google.common.annotations.VisibleForTesting;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidStreamException;
import com.salesforce.dynamodbv2.mapper.exceptions.RecordsExpiredException;
import com.salesforce.dynamodbv2.mapper.session.SessionWrapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a whole stream: tracks the tree of shards, which shards are being read, and buffers their records so they
 * are handed out in approximate creation order.
 *
 * <p>Nothing here blocks or sleeps. {@link #next()} returns null when no record is available, and callers decide how
 * long to wait before polling again. Not thread-safe; a coordinator belongs to one consumer.
 */
public class Coordinator {

    private static final Logger LOG = LoggerFactory.getLogger(Coordinator.class);

    private final SessionWrapper session;
    private final String streamArn;
    private final StreamMeters meters;
    private final List<Shard> roots = new ArrayList<>();
    private final List<Shard> active = new ArrayList<>();
    private final RecordBuffer buffer = new RecordBuffer();

    public Coordinator(SessionWrapper session, String streamArn) {
        this(session, streamArn, StreamMeters.noop());
    }

    public Coordinator(SessionWrapper session, String streamArn, MeterRegistry meterRegistry, String metricPrefix) {
        this(session, streamArn, new StreamMeters(meterRegistry, metricPrefix));
    }

    private Coordinator(SessionWrapper session, String streamArn, StreamMeters meters) {
        this.session = checkNotNull(session, "session is required");
        this.streamArn = checkNotNull(streamArn, "streamArn is required");
        this.meters = meters;
    }

    public String getStreamArn() {
        return streamArn;
    }

    /**
     * Shards without a known parent.
     */
    public List<Shard> getRoots() {
        return Collections.unmodifiableList(roots);
    }

    /**
     * Shards currently being read.
     */
    public List<Shard> getActive() {
        return Collections.unmodifiableList(active);
    }

    @VisibleForTesting
    RecordBuffer getBuffer() {
        return buffer;
    }

    @VisibleForTesting
    void addRoot(Shard shard) {
        roots.add(shard);
    }

    @VisibleForTesting
    void addActive(Shard shard) {
        active.add(shard);
    }

    /**
     * Returns the next record, fetching from the active shards if nothing is buffered.
     *
     * @return the oldest buffered record, or null if no shard has records right now
     */
    @Nullable
    public Record next() {
        if (buffer.isEmpty()) {
            advanceShards();
        }
        if (buffer.isEmpty()) {
            return null;
        }
        RecordBuffer.Entry entry = buffer.pop();
        // only a record handed to the caller moves its shard forward
        entry.getShard().markConsumed(entry.getRecord().getDynamodb().getSequenceNumber());
        return entry.getRecord();
    }

    /**
     * Fetches once from every active shard and buffers the results. Does nothing while records are still buffered.
     * Exhausted shards are then replaced by their children, which start at their trim horizon.
     */
    public void advanceShards() {
        if (!buffer.isEmpty()) {
            return;
        }
        for (Shard shard : active) {
            bufferRecords(shard);
        }
        removeExhausted();
    }

    /**
     * Keeps iterators at a relative position from expiring. Every active shard without a sequence number fetches
     * once; if that finds records, they are buffered and the shard now has a fixed position.
     *
     * <p>Call this periodically, well within the iterator lifetime of 15 minutes.
     */
    public void heartbeat() {
        for (Shard shard : active) {
            if (shard.getSequenceNumber() == null) {
                bufferRecords(shard);
            }
        }
        removeExhausted();
    }

    // buffered per shard so records already fetched survive a failure on a later shard
    private void bufferRecords(Shard shard) {
        List<Map.Entry<Record, Shard>> fetched = new ArrayList<>();
        for (Record record : shard.next()) {
            fetched.add(new SimpleImmutableEntry<>(record, shard));
        }
        buffer.pushAll(fetched);
    }

    /**
     * Moves to either end of the stream. Reading from the trim horizon starts at the root shards; reading from latest
     * starts at the shards without children.
     */
    public void moveTo(Position position) {
        clear();
        Map<String, Shard> byId = unpackShards(describe());
        for (Shard shard : byId.values()) {
            if (shard.getParent() == null) {
                roots.add(shard);
            }
        }
        if (position == Position.TRIM_HORIZON) {
            active.addAll(roots);
        } else {
            for (Shard root : roots) {
                for (Shard shard : root.walkTree()) {
                    if (shard.getChildren().isEmpty()) {
                        active.add(shard);
                    }
                }
            }
        }
        for (Shard shard : active) {
            shard.jumpTo(position.getIteratorType());
        }
        LOG.info("moved stream {} to {} with {} active shards", streamArn, position, active.size());
    }

    /**
     * Moves to a position saved with {@link #getToken()}. Shards the stream no longer has are replaced by their
     * children. Active shards whose position has expired restart at their trim horizon.
     *
     * @throws InvalidStreamException if the token is for another stream, or none of its shards still exist
     */
    public void moveTo(StreamToken token) {
        if (!streamArn.equals(token.getStreamArn())) {
            throw new InvalidStreamException("token is for stream " + token.getStreamArn() + ", not " + streamArn);
        }
        clear();
        Map<String, Shard> byId = new LinkedHashMap<>();
        for (ShardToken shardToken : token.getShards()) {
            Shard shard = new Shard(streamArn, shardToken.getShardId(), session, meters);
            shard.restore(shardToken.getIteratorType(), shardToken.getSequenceNumber());
            byId.put(shard.getShardId(), shard);
        }
        for (ShardToken shardToken : token.getShards()) {
            Shard parent = shardToken.getParent() == null ? null : byId.get(shardToken.getParent());
            if (parent != null) {
                Shard shard = byId.get(shardToken.getShardId());
                shard.setParent(parent);
                parent.addChild(shard);
            }
        }
        for (String shardId : token.getActive()) {
            Shard shard = byId.get(shardId);
            if (shard == null) {
                throw new InvalidStreamException("token marks unknown shard " + shardId + " as active");
            }
            active.add(shard);
        }

        // drop shards the stream no longer has, trying their children instead
        Set<String> live = describe().getShards().stream()
            .map(com.amazonaws.services.dynamodbv2.model.Shard::getShardId)
            .collect(Collectors.toSet());
        Deque<Shard> candidates = byId.values().stream()
            .filter(shard -> shard.getParent() == null)
            .collect(Collectors.toCollection(ArrayDeque::new));
        while (!candidates.isEmpty()) {
            Shard shard = candidates.poll();
            if (live.contains(shard.getShardId())) {
                roots.add(shard);
                continue;
            }
            LOG.warn("shard {} from token no longer exists in stream {}", shard.getShardId(), streamArn);
            boolean wasActive = removeByIdentity(active, shard);
            for (Shard child : shard.getChildren()) {
                child.setParent(null);
                candidates.add(child);
                if (wasActive) {
                    active.add(child);
                }
            }
        }
        if (roots.isEmpty()) {
            throw new InvalidStreamException("none of the shards in the token still exist in stream " + streamArn);
        }
        Set<Shard> reachable = Collections.newSetFromMap(new IdentityHashMap<>());
        roots.forEach(root -> reachable.addAll(root.walkTree()));
        active.removeIf(shard -> !reachable.contains(shard));

        for (Shard shard : active) {
            resume(shard);
        }
        LOG.info("moved stream {} to token with {} active shards", streamArn, active.size());
    }

    /**
     * Moves to the first records created at or after the given time. Each shard tree is searched from its root;
     * a shard that has records at or after the time becomes active with those records buffered, otherwise its
     * children are searched. An open shard that reached its head without finding any becomes active as well.
     */
    public void moveTo(Instant position) {
        clear();
        Map<String, Shard> byId = unpackShards(describe());
        for (Shard shard : byId.values()) {
            if (shard.getParent() == null) {
                roots.add(shard);
            }
        }
        List<Map.Entry<Record, Shard>> found = new ArrayList<>();
        Deque<Shard> pending = new ArrayDeque<>(roots);
        while (!pending.isEmpty()) {
            Shard shard = pending.poll();
            List<Record> records = shard.seekTo(position);
            if (!records.isEmpty()) {
                active.add(shard);
                records.forEach(record -> found.add(new SimpleImmutableEntry<>(record, shard)));
            } else if (!shard.getChildren().isEmpty()) {
                pending.addAll(shard.getChildren());
            } else if (!shard.isExhausted()) {
                active.add(shard);
            }
        }
        buffer.pushAll(found);
        LOG.info("moved stream {} to {} with {} active shards", streamArn, position, active.size());
    }

    /**
     * Removes a shard from the roots and active shards, promoting its children in its place, and drops its buffered
     * records.
     */
    public void removeShard(Shard shard) {
        if (removeByIdentity(roots, shard)) {
            for (Shard child : shard.getChildren()) {
                child.setParent(null);
                roots.add(child);
            }
        }
        if (removeByIdentity(active, shard)) {
            active.addAll(shard.getChildren());
        }
        buffer.removeShard(shard);
    }

    /**
     * The current position, which {@link #moveTo(StreamToken)} can later resume from.
     */
    public StreamToken getToken() {
        List<ShardToken> shards = new ArrayList<>();
        for (Shard root : roots) {
            for (Shard shard : root.walkTree()) {
                shards.add(shard.getToken());
            }
        }
        return new StreamToken(streamArn,
            active.stream().map(Shard::getShardId).collect(Collectors.toList()),
            shards);
    }

    private void removeExhausted() {
        for (Shard shard : new ArrayList<>(active)) {
            // an exhausted shard stays until its last records are consumed
            if (!shard.isExhausted() || buffer.containsShard(shard)) {
                continue;
            }
            List<Shard> children = shard.loadChildren();
            removeShard(shard);
            for (Shard child : children) {
                child.jumpTo(ShardIteratorType.TRIM_HORIZON);
            }
            if (LOG.isDebugEnabled()) {
                LOG.debug("replaced exhausted shard {} with {}", shard.getShardId(), children);
            }
        }
    }

    private void resume(Shard shard) {
        ShardIteratorType iteratorType = shard.getIteratorType();
        if (iteratorType == null) {
            shard.jumpTo(ShardIteratorType.TRIM_HORIZON);
            return;
        }
        try {
            shard.jumpTo(iteratorType, shard.getSequenceNumber());
        } catch (RecordsExpiredException e) {
            LOG.warn("position {} {} of shard {} expired, restarting at trim horizon", iteratorType,
                shard.getSequenceNumber(), shard.getShardId());
            meters.trimHorizonFallbacks.increment();
            shard.jumpTo(ShardIteratorType.TRIM_HORIZON);
        }
    }

    private StreamDescription describe() {
        return session.describeStream(streamArn, null);
    }

    private Map<String, Shard> unpackShards(StreamDescription description) {
        Map<String, Shard> byId = new LinkedHashMap<>();
        for (com.amazonaws.services.dynamodbv2.model.Shard described : description.getShards()) {
            byId.put(described.getShardId(), new Shard(streamArn, described.getShardId(), session, meters));
        }
        for (com.amazonaws.services.dynamodbv2.model.Shard described : description.getShards()) {
            // a parent past the retention window is no longer described; its child is a root
            Shard parent = described.getParentShardId() == null ? null : byId.get(described.getParentShardId());
            if (parent != null) {
                Shard shard = byId.get(described.getShardId());
                shard.setParent(parent);
                parent.addChild(shard);
            }
        }
        return byId;
    }

    private void clear() {
        roots.clear();
        active.clear();
        buffer.clear();
    }

    private static boolean removeByIdentity(List<Shard> shards, Shard shard) {
        for (int i = 0; i < shards.size(); i++) {
            if (shards.get(i) == shard) {
                shards.remove(i);
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "Coordinator[" + streamArn + ", active=" + active + "]";
    }

}
