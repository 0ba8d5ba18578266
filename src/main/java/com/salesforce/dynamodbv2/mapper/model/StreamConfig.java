/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.model;

import com.amazonaws.services.dynamodbv2.model.StreamSpecification;
import com.amazonaws.services.dynamodbv2.model.StreamViewType;
import com.google.common.base.MoreObjects;
import java.util.EnumSet;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Stream settings of a model. The stream ARN is filled in when the model is bound.
 */
public final class StreamConfig {

    public enum Include {
        KEYS,
        NEW,
        OLD
    }

    private final Set<Include> include;
    @Nullable
    private volatile String arn;

    private StreamConfig(Set<Include> include) {
        this.include = include;
    }

    public static StreamConfig of(Include first, Include... rest) {
        return new StreamConfig(EnumSet.of(first, rest));
    }

    public Set<Include> getInclude() {
        return EnumSet.copyOf(include);
    }

    /**
     * The view type matching the included images. Keys are always part of a record.
     */
    public StreamViewType getViewType() {
        boolean newImage = include.contains(Include.NEW);
        boolean oldImage = include.contains(Include.OLD);
        if (newImage && oldImage) {
            return StreamViewType.NEW_AND_OLD_IMAGES;
        }
        if (newImage) {
            return StreamViewType.NEW_IMAGE;
        }
        if (oldImage) {
            return StreamViewType.OLD_IMAGE;
        }
        return StreamViewType.KEYS_ONLY;
    }

    public StreamSpecification toSpecification() {
        return new StreamSpecification().withStreamEnabled(true).withStreamViewType(getViewType());
    }

    @Nullable
    public String getArn() {
        return arn;
    }

    public void setArn(String arn) {
        this.arn = arn;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("include", include).add("arn", arn).toString();
    }

}
