package com.salesforce.dynamodbv2.mapper.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.amazonaws.services.dynamodbv2.model.ShardIteratorType;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidStreamException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class StreamTokenTest {

    private final StreamToken token = new StreamToken("arn:stream", List.of("s2"), List.of(
        new ShardToken("s1", ShardIteratorType.AFTER_SEQUENCE_NUMBER, "100", null),
        new ShardToken("s2", null, null, "s1")));

    @Test
    void jsonNames() {
        String json = token.toJson();
        assertTrue(json.contains("\"stream_arn\":\"arn:stream\""), json);
        assertTrue(json.contains("\"iterator_type\":\"AFTER_SEQUENCE_NUMBER\""), json);
        assertTrue(json.contains("\"sequence_number\":\"100\""), json);
        assertTrue(json.contains("\"parent\":\"s1\""), json);
    }

    @Test
    void parsesWhatItWrites() {
        assertEquals(token, StreamToken.fromJson(token.toJson()));
    }

    @Test
    void parsedListsAreImmutable() {
        StreamToken parsed = StreamToken.fromJson(token.toJson());
        assertThrows(UnsupportedOperationException.class, () -> parsed.getActive().add("s3"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "not json",
        "[]",
        "{}",
        "{\"stream_arn\": \"arn\", \"active\": []}",
        "{\"stream_arn\": \"arn\", \"active\": [], \"shards\": [{\"parent\": \"s1\"}]}",
        "{\"stream_arn\": \"arn\", \"active\": [], \"shards\": [null]}"
    })
    void malformed(String json) {
        assertThrows(InvalidStreamException.class, () -> StreamToken.fromJson(json));
    }

}
