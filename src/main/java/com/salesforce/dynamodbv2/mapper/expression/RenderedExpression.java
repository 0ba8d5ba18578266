/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.expression;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.DeleteItemRequest;
import com.amazonaws.services.dynamodbv2.model.QueryRequest;
import com.amazonaws.services.dynamodbv2.model.ScanRequest;
import com.amazonaws.services.dynamodbv2.model.UpdateItemRequest;
import com.google.common.base.MoreObjects;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The result of a render pass. Only the expressions that were requested and rendered to something are present, and
 * the name and value maps are only present when non-empty.
 */
public final class RenderedExpression {

    @Nullable
    private final String conditionExpression;
    @Nullable
    private final String filterExpression;
    @Nullable
    private final String keyConditionExpression;
    @Nullable
    private final String projectionExpression;
    @Nullable
    private final String updateExpression;
    @Nullable
    private final Map<String, String> attributeNames;
    @Nullable
    private final Map<String, AttributeValue> attributeValues;

    RenderedExpression(@Nullable String conditionExpression,
                       @Nullable String filterExpression,
                       @Nullable String keyConditionExpression,
                       @Nullable String projectionExpression,
                       @Nullable String updateExpression,
                       Map<String, String> attributeNames,
                       Map<String, AttributeValue> attributeValues) {
        this.conditionExpression = conditionExpression;
        this.filterExpression = filterExpression;
        this.keyConditionExpression = keyConditionExpression;
        this.projectionExpression = projectionExpression;
        this.updateExpression = updateExpression;
        this.attributeNames = attributeNames.isEmpty() ? null : attributeNames;
        this.attributeValues = attributeValues.isEmpty() ? null : attributeValues;
    }

    public Optional<String> getConditionExpression() {
        return Optional.ofNullable(conditionExpression);
    }

    public Optional<String> getFilterExpression() {
        return Optional.ofNullable(filterExpression);
    }

    public Optional<String> getKeyConditionExpression() {
        return Optional.ofNullable(keyConditionExpression);
    }

    public Optional<String> getProjectionExpression() {
        return Optional.ofNullable(projectionExpression);
    }

    public Optional<String> getUpdateExpression() {
        return Optional.ofNullable(updateExpression);
    }

    public Optional<Map<String, String>> getAttributeNames() {
        return Optional.ofNullable(attributeNames);
    }

    public Optional<Map<String, AttributeValue>> getAttributeValues() {
        return Optional.ofNullable(attributeValues);
    }

    public UpdateItemRequest applyTo(UpdateItemRequest request) {
        return request.withConditionExpression(conditionExpression)
            .withUpdateExpression(updateExpression)
            .withExpressionAttributeNames(attributeNames)
            .withExpressionAttributeValues(attributeValues);
    }

    public DeleteItemRequest applyTo(DeleteItemRequest request) {
        return request.withConditionExpression(conditionExpression)
            .withExpressionAttributeNames(attributeNames)
            .withExpressionAttributeValues(attributeValues);
    }

    public QueryRequest applyTo(QueryRequest request) {
        return request.withKeyConditionExpression(keyConditionExpression)
            .withFilterExpression(filterExpression)
            .withProjectionExpression(projectionExpression)
            .withExpressionAttributeNames(attributeNames)
            .withExpressionAttributeValues(attributeValues);
    }

    public ScanRequest applyTo(ScanRequest request) {
        return request.withFilterExpression(filterExpression)
            .withProjectionExpression(projectionExpression)
            .withExpressionAttributeNames(attributeNames)
            .withExpressionAttributeValues(attributeValues);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .omitNullValues()
            .add("ConditionExpression", conditionExpression)
            .add("FilterExpression", filterExpression)
            .add("KeyConditionExpression", keyConditionExpression)
            .add("ProjectionExpression", projectionExpression)
            .add("UpdateExpression", updateExpression)
            .add("ExpressionAttributeNames", attributeNames)
            .add("ExpressionAttributeValues", attributeValues)
            .toString();
    }

}
