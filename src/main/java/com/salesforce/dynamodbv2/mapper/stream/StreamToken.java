package com.salesforce.dynamodbv2.mapper.stream;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidStreamException;
import java.util.List;
import java.util.Objects;

/**
 * Serializable position of a whole stream: every known shard, and which of them are being read.
 *
 * <pre>
 * {"stream_arn": "...", "active": ["shard-2"], "shards": [{"shard_id": "shard-1"}, {"shard_id": "shard-2", ...}]}
 * </pre>
 */
public final class StreamToken {

    private static final Gson GSON = new Gson();

    @SerializedName("stream_arn")
    private final String streamArn;
    @SerializedName("active")
    private final List<String> active;
    @SerializedName("shards")
    private final List<ShardToken> shards;

    public StreamToken(String streamArn, List<String> active, List<ShardToken> shards) {
        this.streamArn = checkNotNull(streamArn, "streamArn is required");
        this.active = List.copyOf(active);
        this.shards = List.copyOf(shards);
    }

    /**
     * Parses a token produced by {@link #toJson()}.
     *
     * @throws InvalidStreamException if the text isn't a valid token
     */
    public static StreamToken fromJson(String json) {
        StreamToken token;
        try {
            token = GSON.fromJson(json, StreamToken.class);
        } catch (JsonParseException e) {
            throw new InvalidStreamException("malformed stream token", e);
        }
        if (token == null || token.streamArn == null || token.active == null || token.shards == null) {
            throw new InvalidStreamException("stream token is missing stream_arn, active or shards");
        }
        for (ShardToken shard : token.shards) {
            if (shard == null || shard.getShardId() == null) {
                throw new InvalidStreamException("stream token has a shard without shard_id");
            }
        }
        // copy so the lists are immutable
        return new StreamToken(token.streamArn, token.active, token.shards);
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public String getStreamArn() {
        return streamArn;
    }

    public List<String> getActive() {
        return active;
    }

    public List<ShardToken> getShards() {
        return shards;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StreamToken that = (StreamToken) o;
        return streamArn.equals(that.streamArn) && active.equals(that.active) && shards.equals(that.shards);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamArn, active, shards);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("streamArn", streamArn)
            .add("active", active)
            .add("shards", shards)
            .toString();
    }

}
