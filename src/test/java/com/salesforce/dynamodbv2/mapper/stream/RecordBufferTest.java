package com.salesforce.dynamodbv2.mapper.stream;

import static com.salesforce.dynamodbv2.mapper.testsupport.StreamsTestUtil.STREAM_ARN;
import static com.salesforce.dynamodbv2.mapper.testsupport.StreamsTestUtil.mockRecord;
import static com.salesforce.dynamodbv2.mapper.testsupport.StreamsTestUtil.mockSequenceNumber;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import com.amazonaws.services.dynamodbv2.AmazonDynamoDB;
import com.amazonaws.services.dynamodbv2.model.Record;
import com.salesforce.dynamodbv2.mapper.session.SessionWrapper;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class RecordBufferTest {

    private final SessionWrapper session = SessionWrapper.builder(mock(AmazonDynamoDB.class)).build();
    private final Shard shard1 = new Shard(STREAM_ARN, "shard-1", session);
    private final Shard shard2 = new Shard(STREAM_ARN, "shard-2", session);
    private final RecordBuffer sut = new RecordBuffer();

    private List<String> drain() {
        List<String> sequenceNumbers = new ArrayList<>();
        while (!sut.isEmpty()) {
            sequenceNumbers.add(sut.pop().getRecord().getDynamodb().getSequenceNumber());
        }
        return sequenceNumbers;
    }

    @Test
    void ordersByCreationTimeThenSequenceNumber() {
        sut.push(mockRecord(2, 5), shard1);
        sut.push(mockRecord(99, 3), shard2);
        sut.push(mockRecord(1, 5), shard2);

        assertEquals(List.of(mockSequenceNumber(99), mockSequenceNumber(1), mockSequenceNumber(2)), drain());
    }

    @Test
    void sequenceNumbersCompareNumerically() {
        Record longer = mockRecord(1, 5);
        longer.getDynamodb().setSequenceNumber("100");
        Record shorter = mockRecord(2, 5);
        shorter.getDynamodb().setSequenceNumber("99");
        sut.push(longer, shard1);
        sut.push(shorter, shard1);

        assertEquals(List.of("99", "100"), drain());
    }

    @Test
    void tiesKeepInsertionOrder() {
        Record first = mockRecord(1, 5);
        Record second = mockRecord(1, 5);
        sut.push(first, shard1);
        sut.push(second, shard2);

        assertSame(first, sut.pop().getRecord());
        assertSame(second, sut.pop().getRecord());
    }

    @Test
    void pushAllMergesWithBufferedRecords() {
        sut.push(mockRecord(3), shard1);
        sut.pushAll(List.of(
            new SimpleImmutableEntry<>(mockRecord(4), shard2),
            new SimpleImmutableEntry<>(mockRecord(1), shard2),
            new SimpleImmutableEntry<>(mockRecord(2), shard1)));

        assertEquals(4, sut.size());
        assertSame(shard2, sut.peek().getShard());
        assertEquals(List.of(mockSequenceNumber(1), mockSequenceNumber(2), mockSequenceNumber(3),
            mockSequenceNumber(4)), drain());
    }

    @Test
    void removeShardDropsItsRecords() {
        sut.push(mockRecord(1), shard1);
        sut.push(mockRecord(2), shard2);
        sut.push(mockRecord(3), shard1);

        sut.removeShard(shard1);

        assertFalse(sut.containsShard(shard1));
        assertTrue(sut.containsShard(shard2));
        assertEquals(List.of(mockSequenceNumber(2)), drain());
    }

    @Test
    void emptyBuffer() {
        assertThrows(NoSuchElementException.class, sut::pop);
        assertThrows(NoSuchElementException.class, sut::peek);
        sut.push(mockRecord(1), shard1);
        sut.clear();
        assertTrue(sut.isEmpty());
    }

}
