/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.amazonaws.services.dynamodbv2.model.ProjectionType;
import com.google.common.base.MoreObjects;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A global or local secondary index of a model.
 *
 * <p>A local index shares the table's hash key and only declares a range key. The columns an index projects are
 * resolved when the owning {@link ModelSchema} is built.
 *
 * @param <M> the model class
 */
public final class Index<M> {

    public enum IndexType {
        GSI,
        LSI
    }

    private final String name;
    private final IndexType indexType;
    private Column<M, ?> hashKey;
    @Nullable
    private final Column<M, ?> rangeKey;
    private final ProjectionType projectionType;
    private final List<Column<M, ?>> included;
    private final long readUnits;
    private final long writeUnits;
    private Set<Column<M, ?>> projected = Set.of();

    private Index(Builder<M> builder) {
        this.name = builder.name;
        this.indexType = builder.indexType;
        this.hashKey = builder.hashKey;
        this.rangeKey = builder.rangeKey;
        this.projectionType = builder.projectionType;
        this.included = List.copyOf(builder.included);
        this.readUnits = builder.readUnits;
        this.writeUnits = builder.writeUnits;
    }

    public static <M> Builder<M> globalIndex(String name, Column<M, ?> hashKey) {
        return new Builder<>(name, IndexType.GSI, checkNotNull(hashKey, "hashKey is required for a global index"));
    }

    public static <M> Builder<M> localIndex(String name, Column<M, ?> rangeKey) {
        return new Builder<M>(name, IndexType.LSI, null)
            .withRangeKey(checkNotNull(rangeKey, "rangeKey is required for a local index"));
    }

    public String getName() {
        return name;
    }

    public IndexType getIndexType() {
        return indexType;
    }

    public boolean isGlobal() {
        return indexType == IndexType.GSI;
    }

    public Column<M, ?> getHashKey() {
        return hashKey;
    }

    public Optional<Column<M, ?>> getRangeKey() {
        return Optional.ofNullable(rangeKey);
    }

    public ProjectionType getProjectionType() {
        return projectionType;
    }

    public List<Column<M, ?>> getIncluded() {
        return included;
    }

    public long getReadUnits() {
        return readUnits;
    }

    public long getWriteUnits() {
        return writeUnits;
    }

    /**
     * Columns available when querying or scanning this index.
     */
    public Set<Column<M, ?>> getProjected() {
        return projected;
    }

    void resolve(Column<M, ?> tableHashKey, @Nullable Column<M, ?> tableRangeKey, List<Column<M, ?>> columns) {
        if (hashKey == null) {
            hashKey = tableHashKey;
        }
        Set<Column<M, ?>> resolved = new LinkedHashSet<>();
        if (projectionType == ProjectionType.ALL) {
            resolved.addAll(columns);
        } else {
            resolved.add(tableHashKey);
            if (tableRangeKey != null) {
                resolved.add(tableRangeKey);
            }
            resolved.add(hashKey);
            if (rangeKey != null) {
                resolved.add(rangeKey);
            }
            resolved.addAll(included);
        }
        this.projected = Set.copyOf(resolved);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("name", name)
            .add("indexType", indexType)
            .add("projectionType", projectionType)
            .toString();
    }

    public static class Builder<M> {

        private final String name;
        private final IndexType indexType;
        private final Column<M, ?> hashKey;
        private Column<M, ?> rangeKey;
        private ProjectionType projectionType = ProjectionType.KEYS_ONLY;
        private final List<Column<M, ?>> included = new ArrayList<>();
        private long readUnits = 1L;
        private long writeUnits = 1L;

        private Builder(String name, IndexType indexType, @Nullable Column<M, ?> hashKey) {
            checkArgument(name != null && !name.isEmpty(), "index name is required");
            this.name = name;
            this.indexType = indexType;
            this.hashKey = hashKey;
        }

        public Builder<M> withRangeKey(Column<M, ?> rangeKey) {
            this.rangeKey = rangeKey;
            return this;
        }

        public Builder<M> withProjectAll() {
            this.projectionType = ProjectionType.ALL;
            this.included.clear();
            return this;
        }

        public Builder<M> withProjectKeys() {
            this.projectionType = ProjectionType.KEYS_ONLY;
            this.included.clear();
            return this;
        }

        @SafeVarargs
        public final Builder<M> withProjectInclude(Column<M, ?>... columns) {
            checkArgument(columns.length > 0, "include projection needs at least one column");
            this.projectionType = ProjectionType.INCLUDE;
            this.included.clear();
            this.included.addAll(Arrays.asList(columns));
            return this;
        }

        /**
         * Provisioned throughput; only used for global indexes.
         */
        public Builder<M> withThroughput(long readUnits, long writeUnits) {
            this.readUnits = readUnits;
            this.writeUnits = writeUnits;
            return this;
        }

        public Index<M> build() {
            return new Index<>(this);
        }

    }

}
