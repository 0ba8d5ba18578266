/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.session;

import static com.google.common.base.Preconditions.checkNotNull;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.dynamodbv2.AmazonDynamoDB;
import com.amazonaws.services.dynamodbv2.AmazonDynamoDBStreams;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.BatchGetItemRequest;
import com.amazonaws.services.dynamodbv2.model.BatchGetItemResult;
import com.amazonaws.services.dynamodbv2.model.ConditionalCheckFailedException;
import com.amazonaws.services.dynamodbv2.model.CreateTableRequest;
import com.amazonaws.services.dynamodbv2.model.DeleteItemRequest;
import com.amazonaws.services.dynamodbv2.model.DeleteItemResult;
import com.amazonaws.services.dynamodbv2.model.DescribeStreamRequest;
import com.amazonaws.services.dynamodbv2.model.DescribeStreamResult;
import com.amazonaws.services.dynamodbv2.model.ExpiredIteratorException;
import com.amazonaws.services.dynamodbv2.model.GetRecordsRequest;
import com.amazonaws.services.dynamodbv2.model.GetRecordsResult;
import com.amazonaws.services.dynamodbv2.model.GetShardIteratorRequest;
import com.amazonaws.services.dynamodbv2.model.KeysAndAttributes;
import com.amazonaws.services.dynamodbv2.model.QueryRequest;
import com.amazonaws.services.dynamodbv2.model.QueryResult;
import com.amazonaws.services.dynamodbv2.model.ResourceInUseException;
import com.amazonaws.services.dynamodbv2.model.ResourceNotFoundException;
import com.amazonaws.services.dynamodbv2.model.ScanRequest;
import com.amazonaws.services.dynamodbv2.model.ScanResult;
import com.amazonaws.services.dynamodbv2.model.Shard;
import com.amazonaws.services.dynamodbv2.model.ShardIteratorType;
import com.amazonaws.services.dynamodbv2.model.StreamDescription;
import com.amazonaws.services.dynamodbv2.model.TableDescription;
import com.amazonaws.services.dynamodbv2.model.TrimmedDataAccessException;
import com.amazonaws.services.dynamodbv2.model.UpdateItemRequest;
import com.amazonaws.services.dynamodbv2.model.UpdateItemResult;
import com.google.common.base.Strings;
import com.google.common.collect.Iterables;
import com.salesforce.dynamodbv2.mapper.exceptions.ConstraintViolationException;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidStreamException;
import com.salesforce.dynamodbv2.mapper.exceptions.MapperException;
import com.salesforce.dynamodbv2.mapper.exceptions.RecordsExpiredException;
import com.salesforce.dynamodbv2.mapper.exceptions.ShardIteratorExpiredException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin layer over the DynamoDB and DynamoDB Streams clients. Each call is retried while throttled, timed, and its
 * failures are translated into mapper exceptions:
 *
 * <ul>
 * <li>a failed conditional write raises {@link ConstraintViolationException}</li>
 * <li>trimmed stream data raises {@link RecordsExpiredException}</li>
 * <li>a stale shard iterator raises {@link ShardIteratorExpiredException}</li>
 * <li>an unknown stream raises {@link InvalidStreamException}</li>
 * <li>anything else raises {@link MapperException} with the original cause</li>
 * </ul>
 */
public class SessionWrapper {

    private static final Logger LOG = LoggerFactory.getLogger(SessionWrapper.class);

    static final int BATCH_GET_ITEM_CHUNK_SIZE = 100;

    private final AmazonDynamoDB amazonDynamoDb;
    @Nullable
    private final AmazonDynamoDBStreams amazonDynamoDbStreams;
    private final SessionRetry retry;

    private final Timer saveItemTime;
    private final Timer deleteItemTime;
    private final Timer loadItemsTime;
    private final Timer queryTime;
    private final Timer scanTime;
    private final Timer describeStreamTime;
    private final Timer getShardIteratorTime;
    private final Timer getRecordsTime;

    private SessionWrapper(AmazonDynamoDB amazonDynamoDb,
                           @Nullable AmazonDynamoDBStreams amazonDynamoDbStreams,
                           MeterRegistry meterRegistry,
                           @Nullable String metricPrefix,
                           SessionRetry retry) {
        this.amazonDynamoDb = amazonDynamoDb;
        this.amazonDynamoDbStreams = amazonDynamoDbStreams;
        this.retry = retry;

        final String cn = SessionWrapper.class.getSimpleName();
        final String prefix = Strings.isNullOrEmpty(metricPrefix) ? cn : cn + "." + metricPrefix;
        this.saveItemTime = meterRegistry.timer(prefix + ".SaveItem.Time");
        this.deleteItemTime = meterRegistry.timer(prefix + ".DeleteItem.Time");
        this.loadItemsTime = meterRegistry.timer(prefix + ".LoadItems.Time");
        this.queryTime = meterRegistry.timer(prefix + ".Query.Time");
        this.scanTime = meterRegistry.timer(prefix + ".Scan.Time");
        this.describeStreamTime = meterRegistry.timer(prefix + ".DescribeStream.Time");
        this.getShardIteratorTime = meterRegistry.timer(prefix + ".GetShardIterator.Time");
        this.getRecordsTime = meterRegistry.timer(prefix + ".GetRecords.Time");
    }

    public static Builder builder(AmazonDynamoDB amazonDynamoDb) {
        return new Builder(amazonDynamoDb);
    }

    public UpdateItemResult saveItem(UpdateItemRequest request) {
        try {
            return call("saveItem", saveItemTime, () -> amazonDynamoDb.updateItem(request));
        } catch (ConditionalCheckFailedException e) {
            throw new ConstraintViolationException("saveItem", request, e);
        }
    }

    public DeleteItemResult deleteItem(DeleteItemRequest request) {
        try {
            return call("deleteItem", deleteItemTime, () -> amazonDynamoDb.deleteItem(request));
        } catch (ConditionalCheckFailedException e) {
            throw new ConstraintViolationException("deleteItem", request, e);
        }
    }

    /**
     * Loads items across tables. Requests are split into chunks of 100 keys, and unprocessed keys are requested
     * again, after a growing backoff, until every key was processed.
     *
     * @param request table name to the keys to load from it
     * @return table name to the items found; tables without any items found are absent
     */
    public Map<String, List<Map<String, AttributeValue>>> loadItems(Map<String, KeysAndAttributes> request) {
        List<Entry<String, Map<String, AttributeValue>>> keys = new ArrayList<>();
        request.forEach((table, keysAndAttributes) -> keysAndAttributes.getKeys()
            .forEach(key -> keys.add(new SimpleImmutableEntry<>(table, key))));

        Map<String, List<Map<String, AttributeValue>>> loaded = new HashMap<>();
        for (List<Entry<String, Map<String, AttributeValue>>> chunk
            : Iterables.partition(keys, BATCH_GET_ITEM_CHUNK_SIZE)) {
            Map<String, KeysAndAttributes> items = new LinkedHashMap<>();
            for (Entry<String, Map<String, AttributeValue>> key : chunk) {
                items.computeIfAbsent(key.getKey(), table -> copySettings(request.get(table)))
                    .withKeys(key.getValue());
            }
            int round = 0;
            while (items != null && !items.isEmpty()) {
                if (round > 0) {
                    retry.backoff("loadItems", round);
                }
                round++;
                BatchGetItemRequest batchGetItemRequest = new BatchGetItemRequest().withRequestItems(items);
                BatchGetItemResult result = call("loadItems", loadItemsTime,
                    () -> amazonDynamoDb.batchGetItem(batchGetItemRequest));
                if (result.getResponses() != null) {
                    result.getResponses().forEach((table, found) ->
                        loaded.computeIfAbsent(table, t -> new ArrayList<>()).addAll(found));
                }
                items = result.getUnprocessedKeys();
                if (LOG.isDebugEnabled() && items != null && !items.isEmpty()) {
                    LOG.debug("loadItems retrying unprocessed keys for tables {}", items.keySet());
                }
            }
        }
        return loaded;
    }

    /**
     * Runs one query page. Count and ScannedCount are always present on the result.
     */
    public QueryResult query(QueryRequest request) {
        QueryResult result = call("query", queryTime, () -> amazonDynamoDb.query(request));
        int count = result.getItems() == null ? 0 : result.getItems().size();
        if (result.getCount() == null) {
            result.setCount(count);
        }
        if (result.getScannedCount() == null) {
            result.setScannedCount(result.getCount());
        }
        return result;
    }

    /**
     * Runs one scan page. Count and ScannedCount are always present on the result.
     */
    public ScanResult scan(ScanRequest request) {
        ScanResult result = call("scan", scanTime, () -> amazonDynamoDb.scan(request));
        int count = result.getItems() == null ? 0 : result.getItems().size();
        if (result.getCount() == null) {
            result.setCount(count);
        }
        if (result.getScannedCount() == null) {
            result.setScannedCount(result.getCount());
        }
        return result;
    }

    /**
     * Creates a table.
     *
     * @return false if the table already existed
     */
    public boolean createTable(CreateTableRequest request) {
        try {
            call("createTable", null, () -> amazonDynamoDb.createTable(request));
            LOG.info("created table {}", request.getTableName());
            return true;
        } catch (MapperException e) {
            if (e.getCause() instanceof ResourceInUseException) {
                LOG.debug("table {} already exists", request.getTableName());
                return false;
            }
            throw e;
        }
    }

    /**
     * Describes a table.
     *
     * @return the description, or null if the table does not exist
     */
    @Nullable
    public TableDescription describeTable(String tableName) {
        try {
            return call("describeTable", null, () -> amazonDynamoDb.describeTable(tableName)).getTable();
        } catch (MapperException e) {
            if (e.getCause() instanceof ResourceNotFoundException) {
                return null;
            }
            throw e;
        }
    }

    /**
     * Describes a stream, following {@code LastEvaluatedShardId} until every shard is listed.
     *
     * @param streamArn    the stream
     * @param firstShardId if given, only shards after this one are listed
     */
    public StreamDescription describeStream(String streamArn, @Nullable String firstShardId) {
        AmazonDynamoDBStreams streams = streams();
        List<Shard> allShards = new ArrayList<>();
        String lastShardId = firstShardId;
        DescribeStreamResult result;
        try {
            do {
                DescribeStreamRequest request = new DescribeStreamRequest().withStreamArn(streamArn)
                    .withExclusiveStartShardId(lastShardId);
                result = call("describeStream", describeStreamTime, () -> streams.describeStream(request));
                if (result.getStreamDescription().getShards() != null) {
                    allShards.addAll(result.getStreamDescription().getShards());
                }
                lastShardId = result.getStreamDescription().getLastEvaluatedShardId();
            } while (!Strings.isNullOrEmpty(lastShardId));
        } catch (MapperException e) {
            if (e.getCause() instanceof ResourceNotFoundException) {
                throw new InvalidStreamException("unknown stream " + streamArn, e.getCause());
            }
            throw e;
        }
        return result.getStreamDescription().withShards(allShards).withLastEvaluatedShardId(null);
    }

    /**
     * Requests an iterator for a shard.
     *
     * @throws RecordsExpiredException if the sequence number is older than the shard's retention window
     */
    public String getShardIterator(String streamArn, String shardId, ShardIteratorType iteratorType,
                                   @Nullable String sequenceNumber) {
        AmazonDynamoDBStreams streams = streams();
        GetShardIteratorRequest request = new GetShardIteratorRequest()
            .withStreamArn(streamArn)
            .withShardId(shardId)
            .withShardIteratorType(iteratorType)
            .withSequenceNumber(sequenceNumber);
        try {
            return call("getShardIterator", getShardIteratorTime, () -> streams.getShardIterator(request))
                .getShardIterator();
        } catch (TrimmedDataAccessException e) {
            throw new RecordsExpiredException("records for " + shardId + " at " + sequenceNumber + " expired", e);
        }
    }

    /**
     * Fetches one page of records.
     *
     * @throws RecordsExpiredException       if the iterator points at records that were trimmed
     * @throws ShardIteratorExpiredException if the iterator is too old to use
     */
    public GetRecordsResult getStreamRecords(String iteratorId) {
        AmazonDynamoDBStreams streams = streams();
        GetRecordsRequest request = new GetRecordsRequest().withShardIterator(iteratorId);
        try {
            return call("getRecords", getRecordsTime, () -> streams.getRecords(request));
        } catch (TrimmedDataAccessException e) {
            throw new RecordsExpiredException("records for iterator expired", e);
        } catch (ExpiredIteratorException e) {
            throw new ShardIteratorExpiredException("shard iterator expired", e);
        }
    }

    private AmazonDynamoDBStreams streams() {
        if (amazonDynamoDbStreams == null) {
            throw new InvalidStreamException("no AmazonDynamoDBStreams client was configured");
        }
        return amazonDynamoDbStreams;
    }

    /**
     * Runs the call with retries, rethrowing the exceptions callers translate themselves and wrapping any other
     * client failure.
     */
    private <T> T call(String operation, @Nullable Timer timer, Supplier<T> call) {
        Supplier<T> retried = () -> retry.execute(operation, call);
        try {
            return timer == null ? retried.get() : timer.record(retried);
        } catch (ConditionalCheckFailedException | TrimmedDataAccessException | ExpiredIteratorException e) {
            throw e;
        } catch (AmazonClientException e) {
            throw new MapperException(operation + " failed", e);
        }
    }

    private static KeysAndAttributes copySettings(KeysAndAttributes settings) {
        return new KeysAndAttributes()
            .withConsistentRead(settings.getConsistentRead())
            .withProjectionExpression(settings.getProjectionExpression())
            .withExpressionAttributeNames(settings.getExpressionAttributeNames());
    }

    public static class Builder {

        private final AmazonDynamoDB amazonDynamoDb;
        private AmazonDynamoDBStreams amazonDynamoDbStreams;
        private MeterRegistry meterRegistry;
        private String metricPrefix;
        private SessionRetry retry;

        private Builder(AmazonDynamoDB amazonDynamoDb) {
            this.amazonDynamoDb = checkNotNull(amazonDynamoDb, "amazonDynamoDb is required");
        }

        public Builder withAmazonDynamoDbStreams(AmazonDynamoDBStreams amazonDynamoDbStreams) {
            this.amazonDynamoDbStreams = amazonDynamoDbStreams;
            return this;
        }

        public Builder withMeterRegistry(MeterRegistry meterRegistry, String metricPrefix) {
            this.meterRegistry = meterRegistry;
            this.metricPrefix = metricPrefix;
            return this;
        }

        public Builder withRetry(SessionRetry retry) {
            this.retry = retry;
            return this;
        }

        public SessionWrapper build() {
            return new SessionWrapper(amazonDynamoDb,
                amazonDynamoDbStreams,
                meterRegistry == null ? new CompositeMeterRegistry() : meterRegistry,
                metricPrefix,
                retry == null ? new SessionRetry() : retry);
        }

    }

}
