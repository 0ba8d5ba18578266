package com.salesforce.dynamodbv2.mapper.stream;

import com.amazonaws.services.dynamodbv2.model.ShardIteratorType;
import com.google.common.base.MoreObjects;
import com.google.gson.annotations.SerializedName;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Serializable position of one shard. The stream ARN is left out; it is stored once on the {@link StreamToken}.
 */
public final class ShardToken {

    @SerializedName("shard_id")
    private final String shardId;
    @SerializedName("iterator_type")
    @Nullable
    private final ShardIteratorType iteratorType;
    @SerializedName("sequence_number")
    @Nullable
    private final String sequenceNumber;
    @SerializedName("parent")
    @Nullable
    private final String parent;

    public ShardToken(String shardId, @Nullable ShardIteratorType iteratorType, @Nullable String sequenceNumber,
                      @Nullable String parent) {
        this.shardId = shardId;
        this.iteratorType = iteratorType;
        this.sequenceNumber = sequenceNumber;
        this.parent = parent;
    }

    public String getShardId() {
        return shardId;
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
    public String getParent() {
        return parent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ShardToken that = (ShardToken) o;
        return shardId.equals(that.shardId)
            && iteratorType == that.iteratorType
            && Objects.equals(sequenceNumber, that.sequenceNumber)
            && Objects.equals(parent, that.parent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shardId, iteratorType, sequenceNumber, parent);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .omitNullValues()
            .add("shardId", shardId)
            .add("iteratorType", iteratorType)
            .add("sequenceNumber", sequenceNumber)
            .add("parent", parent)
            .toString();
    }

}
