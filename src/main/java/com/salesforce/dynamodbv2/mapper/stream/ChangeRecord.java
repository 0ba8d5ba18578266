package com.salesforce.dynamodbv2.mapper.stream;

import com.google.common.base.MoreObjects;
import javax.annotation.Nullable;

/**
 * A stream record with its images loaded into model objects. An image is null when the model's stream doesn't
 * include it, or when the record doesn't carry it (e.g. no old image for an insert).
 *
 * @param <M> the model class
 */
public final class ChangeRecord<M> {

    @Nullable
    private final M key;
    @Nullable
    private final M newImage;
    @Nullable
    private final M oldImage;
    private final RecordMetadata metadata;

    public ChangeRecord(@Nullable M key, @Nullable M newImage, @Nullable M oldImage, RecordMetadata metadata) {
        this.key = key;
        this.newImage = newImage;
        this.oldImage = oldImage;
        this.metadata = metadata;
    }

    /**
     * An object with only its key columns loaded.
     */
    @Nullable
    public M getKey() {
        return key;
    }

    @Nullable
    public M getNewImage() {
        return newImage;
    }

    @Nullable
    public M getOldImage() {
        return oldImage;
    }

    public RecordMetadata getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("key", key)
            .add("new", newImage)
            .add("old", oldImage)
            .add("meta", metadata)
            .toString();
    }

}
