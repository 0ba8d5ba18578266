package com.salesforce.dynamodbv2.mapper.testsupport;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.OperationType;
import com.amazonaws.services.dynamodbv2.model.Record;
import com.amazonaws.services.dynamodbv2.model.SequenceNumberRange;
import com.amazonaws.services.dynamodbv2.model.Shard;
import com.amazonaws.services.dynamodbv2.model.StreamRecord;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class StreamsTestUtil {

    public static final String STREAM_ARN = "arn:aws:dynamodb:us-east-1:123456789012:table/user/stream/2019-01-01T00:00:00.000";

    /**
     * Creates a mock streams record for unit testing purposes.
     *
     * @param sequenceNumber integer representation of sequence number to assign.
     * @return  Mock Streams record.
     */
    public static Record mockRecord(int sequenceNumber) {
        return mockRecord(sequenceNumber, sequenceNumber);
    }

    public static Record mockRecord(int sequenceNumber, long creationTime) {
        return new Record()
            .withEventID(String.valueOf(sequenceNumber))
            .withEventSource("aws:dynamodb")
            .withEventName(OperationType.INSERT)
            .withEventVersion("1.1")
            .withAwsRegion("ddblocal")
            .withDynamodb(new StreamRecord()
                .withSequenceNumber(mockSequenceNumber(sequenceNumber))
                .withSizeBytes(1L)
                .withApproximateCreationDateTime(new Date(creationTime))
            );
    }

    /**
     * Creates a mock record carrying a key and images, as a table with a new and old image stream produces.
     */
    public static Record mockRecord(int sequenceNumber, OperationType eventName, Map<String, AttributeValue> keys,
                                    Map<String, AttributeValue> newImage, Map<String, AttributeValue> oldImage) {
        Record record = mockRecord(sequenceNumber).withEventName(eventName);
        record.getDynamodb()
            .withKeys(keys)
            .withNewImage(newImage)
            .withOldImage(oldImage);
        return record;
    }

    public static String mockSequenceNumber(int sequenceNumber) {
        return String.format("%021d", sequenceNumber);
    }

    public static List<Record> mockRecords(int... sequenceNumbers) {
        return Arrays.stream(sequenceNumbers).mapToObj(StreamsTestUtil::mockRecord).collect(Collectors.toList());
    }

    /**
     * Creates a shard description as returned by DescribeStream.
     *
     * @param parentShardId the parent shard, or null for a root
     * @param open          whether the shard is still open for writes
     */
    public static Shard mockShard(String shardId, String parentShardId, boolean open) {
        SequenceNumberRange range = new SequenceNumberRange().withStartingSequenceNumber(mockSequenceNumber(0));
        if (!open) {
            range.setEndingSequenceNumber(mockSequenceNumber(Integer.MAX_VALUE));
        }
        return new Shard()
            .withShardId(shardId)
            .withParentShardId(parentShardId)
            .withSequenceNumberRange(range);
    }

}
