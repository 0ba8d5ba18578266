package com.salesforce.dynamodbv2.mapper.stream;

import com.amazonaws.services.dynamodbv2.model.Record;
import com.google.common.base.MoreObjects;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;

/**
 * Buffers fetched records across shards and hands them out oldest first.
 *
 * <p>Records are ordered by approximate creation time, then sequence number, then the order they were pushed in.
 * Creation times are only approximate, so ordering across shards is best effort; within a shard it is exact.
 */
public class RecordBuffer {

    private PriorityQueue<Entry> heap = new PriorityQueue<>();
    private long monotonic;

    /**
     * A buffered record and the shard it was read from.
     */
    public static final class Entry implements Comparable<Entry> {

        private final Date createdAt;
        private final String sequenceNumber;
        private final long clock;
        private final Record record;
        private final Shard shard;

        private Entry(long clock, Record record, Shard shard) {
            this.createdAt = record.getDynamodb().getApproximateCreationDateTime();
            this.sequenceNumber = record.getDynamodb().getSequenceNumber();
            this.clock = clock;
            this.record = record;
            this.shard = shard;
        }

        public Record getRecord() {
            return record;
        }

        public Shard getShard() {
            return shard;
        }

        @Override
        public int compareTo(Entry other) {
            int byTime = createdAt.compareTo(other.createdAt);
            if (byTime != 0) {
                return byTime;
            }
            int bySequence = compareSequenceNumbers(sequenceNumber, other.sequenceNumber);
            if (bySequence != 0) {
                return bySequence;
            }
            return Long.compare(clock, other.clock);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                .add("createdAt", createdAt.toInstant())
                .add("sequenceNumber", sequenceNumber)
                .add("clock", clock)
                .add("shard", shard.getShardId())
                .toString();
        }

    }

    public void push(Record record, Shard shard) {
        heap.add(new Entry(clock(), record, shard));
    }

    /**
     * Adds many records at once, rebuilding the heap in a single pass.
     *
     * @param records record to the shard it was read from
     */
    public void pushAll(Collection<? extends Map.Entry<Record, Shard>> records) {
        if (records.isEmpty()) {
            return;
        }
        List<Entry> entries = new ArrayList<>(heap.size() + records.size());
        entries.addAll(heap);
        for (Map.Entry<Record, Shard> record : records) {
            entries.add(new Entry(clock(), record.getKey(), record.getValue()));
        }
        heap = new PriorityQueue<>(entries);
    }

    /**
     * Removes and returns the oldest record.
     *
     * @throws NoSuchElementException if the buffer is empty
     */
    public Entry pop() {
        Entry entry = heap.poll();
        if (entry == null) {
            throw new NoSuchElementException("record buffer is empty");
        }
        return entry;
    }

    /**
     * Returns the oldest record without removing it.
     *
     * @throws NoSuchElementException if the buffer is empty
     */
    public Entry peek() {
        Entry entry = heap.peek();
        if (entry == null) {
            throw new NoSuchElementException("record buffer is empty");
        }
        return entry;
    }

    /**
     * Drops every record read from the shard. Runs in time linear in the size of the buffer.
     */
    public void removeShard(Shard shard) {
        heap.removeIf(entry -> entry.shard == shard);
    }

    public boolean containsShard(Shard shard) {
        return heap.stream().anyMatch(entry -> entry.shard == shard);
    }

    public void clear() {
        heap.clear();
    }

    public int size() {
        return heap.size();
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    /**
     * Strictly increasing; odd values only.
     */
    private long clock() {
        monotonic += 2;
        return monotonic - 1;
    }

    /**
     * Sequence numbers are decimal strings of varying length.
     */
    static int compareSequenceNumbers(String a, String b) {
        if (isDigits(a) && isDigits(b)) {
            return new BigInteger(a).compareTo(new BigInteger(b));
        }
        return a.compareTo(b);
    }

    private static boolean isDigits(String s) {
        return !s.isEmpty() && s.chars().allMatch(c -> c >= '0' && c <= '9');
    }

}
