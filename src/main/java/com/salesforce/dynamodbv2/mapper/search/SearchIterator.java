/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.search;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.QueryRequest;
import com.amazonaws.services.dynamodbv2.model.QueryResult;
import com.amazonaws.services.dynamodbv2.model.ScanRequest;
import com.amazonaws.services.dynamodbv2.model.ScanResult;
import com.google.common.base.MoreObjects;
import com.salesforce.dynamodbv2.mapper.exceptions.ConstraintViolationException;
import com.salesforce.dynamodbv2.mapper.model.Column;
import com.salesforce.dynamodbv2.mapper.model.ModelSchema;
import com.salesforce.dynamodbv2.mapper.session.SessionWrapper;
import com.salesforce.dynamodbv2.mapper.types.TypeEngine;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.BiConsumer;
import java.util.function.Function;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Iterates the results of a query or scan, following {@code LastEvaluatedKey} from page to page.
 *
 * @param <M> the model class
 */
public class SearchIterator<M> implements Iterator<M> {

    private static final Logger LOG = LoggerFactory.getLogger(SearchIterator.class);

    private final ModelSchema<M> schema;
    private final TypeEngine typeEngine;
    private final BiConsumer<M, Collection<Column<M, ?>>> onLoaded;
    private final Collection<Column<M, ?>> loaded;
    private final int limit;
    private final String operation;
    private final Object request;
    private final Function<Map<String, AttributeValue>, Page> fetch;

    private final Deque<Map<String, AttributeValue>> buffer = new ArrayDeque<>();
    @Nullable
    private Map<String, AttributeValue> lastEvaluatedKey;
    private boolean started;
    private int count;
    private int scanned;
    private int yielded;

    SearchIterator(ModelSchema<M> schema, SessionWrapper session, TypeEngine typeEngine,
                   BiConsumer<M, Collection<Column<M, ?>>> onLoaded, Collection<Column<M, ?>> loaded, int limit,
                   QueryRequest request) {
        this(schema, typeEngine, onLoaded, loaded, limit, "query", request, startKey -> {
            QueryResult result = session.query(request.clone().withExclusiveStartKey(startKey));
            return new Page(result.getItems(), result.getLastEvaluatedKey(), result.getCount(),
                result.getScannedCount());
        });
    }

    SearchIterator(ModelSchema<M> schema, SessionWrapper session, TypeEngine typeEngine,
                   BiConsumer<M, Collection<Column<M, ?>>> onLoaded, Collection<Column<M, ?>> loaded, int limit,
                   ScanRequest request) {
        this(schema, typeEngine, onLoaded, loaded, limit, "scan", request, startKey -> {
            ScanResult result = session.scan(request.clone().withExclusiveStartKey(startKey));
            return new Page(result.getItems(), result.getLastEvaluatedKey(), result.getCount(),
                result.getScannedCount());
        });
    }

    private SearchIterator(ModelSchema<M> schema, TypeEngine typeEngine,
                           BiConsumer<M, Collection<Column<M, ?>>> onLoaded, Collection<Column<M, ?>> loaded,
                           int limit, String operation, Object request,
                           Function<Map<String, AttributeValue>, Page> fetch) {
        this.schema = schema;
        this.typeEngine = typeEngine;
        this.onLoaded = onLoaded;
        this.loaded = loaded;
        this.limit = limit;
        this.operation = operation;
        this.request = request;
        this.fetch = fetch;
    }

    /**
     * Number of items matched so far, after any filter was applied.
     */
    public int getCount() {
        return count;
    }

    /**
     * Number of items evaluated so far, before any filter was applied.
     */
    public int getScanned() {
        return scanned;
    }

    /**
     * True once every page has been fetched and yielded, or the limit was reached.
     */
    public boolean isExhausted() {
        return reachedLimit() || started && lastEvaluatedKey == null && buffer.isEmpty();
    }

    /**
     * Starts over from the first page.
     */
    public void reset() {
        buffer.clear();
        lastEvaluatedKey = null;
        started = false;
        count = 0;
        scanned = 0;
        yielded = 0;
    }

    @Override
    public boolean hasNext() {
        if (reachedLimit()) {
            return false;
        }
        while (buffer.isEmpty()) {
            if (started && lastEvaluatedKey == null) {
                return false;
            }
            fetchPage();
        }
        return true;
    }

    @Override
    public M next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        M obj = schema.newInstance();
        schema.load(obj, buffer.poll(), loaded, typeEngine);
        onLoaded.accept(obj, loaded);
        yielded++;
        return obj;
    }

    /**
     * Returns the first result after starting over.
     *
     * @throws ConstraintViolationException if there are no results
     */
    public M first() {
        reset();
        if (!hasNext()) {
            throw new ConstraintViolationException(operation, request, operation + " did not find any results");
        }
        return next();
    }

    /**
     * Returns the only result after starting over.
     *
     * @throws ConstraintViolationException if there isn't exactly one result
     */
    public M one() {
        reset();
        if (!hasNext()) {
            throw new ConstraintViolationException(operation, request, operation + " did not find any results");
        }
        M obj = next();
        // the limit may hide a second result
        boolean more = !buffer.isEmpty() || lastEvaluatedKey != null && hasMoreIgnoringLimit();
        if (more) {
            throw new ConstraintViolationException(operation, request, operation + " found more than one result");
        }
        return obj;
    }

    private boolean hasMoreIgnoringLimit() {
        while (buffer.isEmpty() && lastEvaluatedKey != null) {
            fetchPage();
        }
        return !buffer.isEmpty();
    }

    private boolean reachedLimit() {
        return limit > 0 && yielded >= limit;
    }

    private void fetchPage() {
        Page page = fetch.apply(lastEvaluatedKey);
        started = true;
        count += page.count;
        scanned += page.scanned;
        lastEvaluatedKey = page.lastEvaluatedKey == null || page.lastEvaluatedKey.isEmpty()
            ? null : page.lastEvaluatedKey;
        if (page.items != null) {
            buffer.addAll(page.items);
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} page of {} items, scanned {}, more={}", operation, page.count, page.scanned,
                lastEvaluatedKey != null);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("operation", operation)
            .add("count", count)
            .add("scanned", scanned)
            .add("exhausted", isExhausted())
            .toString();
    }

    private static class Page {

        private final List<Map<String, AttributeValue>> items;
        private final Map<String, AttributeValue> lastEvaluatedKey;
        private final int count;
        private final int scanned;

        Page(@Nullable List<Map<String, AttributeValue>> items, @Nullable Map<String, AttributeValue> lastEvaluatedKey,
             @Nullable Integer count, @Nullable Integer scanned) {
            this.items = items;
            this.lastEvaluatedKey = lastEvaluatedKey;
            this.count = count == null ? 0 : count;
            this.scanned = scanned == null ? 0 : scanned;
        }
    }

}
