/*
 * QueryMetrics.java
 *
 * This source file is part of the Shard Merge open source project
 *
 * Copyright 2024 the Shard Merge project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.shardmerge.query.metrics;

import com.google.common.base.MoreObjects;
import com.shardmerge.annotation.API;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;

/**
 * Execution statistics reported by a partition for one page of results. All fields are additive, so the metrics of
 * several pages, or of several partitions, are combined with {@link #add(QueryMetrics)}.
 */
@API(API.Status.UNSTABLE)
public final class QueryMetrics {
    @Nonnull
    public static final QueryMetrics ZERO = newBuilder().build();

    private final long retrievedDocumentCount;
    private final long retrievedDocumentSize;
    private final long outputDocumentCount;
    private final long outputDocumentSize;
    private final long indexHitDocumentCount;
    @Nonnull
    private final Duration totalQueryExecutionTime;
    private final long retries;

    private QueryMetrics(@Nonnull Builder builder) {
        this.retrievedDocumentCount = builder.retrievedDocumentCount;
        this.retrievedDocumentSize = builder.retrievedDocumentSize;
        this.outputDocumentCount = builder.outputDocumentCount;
        this.outputDocumentSize = builder.outputDocumentSize;
        this.indexHitDocumentCount = builder.indexHitDocumentCount;
        this.totalQueryExecutionTime = builder.totalQueryExecutionTime;
        this.retries = builder.retries;
    }

    public long getRetrievedDocumentCount() {
        return retrievedDocumentCount;
    }

    public long getRetrievedDocumentSize() {
        return retrievedDocumentSize;
    }

    public long getOutputDocumentCount() {
        return outputDocumentCount;
    }

    public long getOutputDocumentSize() {
        return outputDocumentSize;
    }

    public long getIndexHitDocumentCount() {
        return indexHitDocumentCount;
    }

    @Nonnull
    public Duration getTotalQueryExecutionTime() {
        return totalQueryExecutionTime;
    }

    public long getRetries() {
        return retries;
    }

    /**
     * Fraction of retrieved documents that were matched by the index, or 1 when nothing was retrieved.
     * @return the index hit ratio
     */
    public double getIndexHitRatio() {
        if (retrievedDocumentCount == 0) {
            return 1.0;
        }
        return (double)indexHitDocumentCount / retrievedDocumentCount;
    }

    /**
     * Sum these metrics with another set.
     * @param other the metrics to add
     * @return a new {@code QueryMetrics} holding the field-wise sum
     */
    @Nonnull
    public QueryMetrics add(@Nonnull QueryMetrics other) {
        return newBuilder()
                .setRetrievedDocumentCount(retrievedDocumentCount + other.retrievedDocumentCount)
                .setRetrievedDocumentSize(retrievedDocumentSize + other.retrievedDocumentSize)
                .setOutputDocumentCount(outputDocumentCount + other.outputDocumentCount)
                .setOutputDocumentSize(outputDocumentSize + other.outputDocumentSize)
                .setIndexHitDocumentCount(indexHitDocumentCount + other.indexHitDocumentCount)
                .setTotalQueryExecutionTime(totalQueryExecutionTime.plus(other.totalQueryExecutionTime))
                .setRetries(retries + other.retries)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QueryMetrics that = (QueryMetrics)o;
        return retrievedDocumentCount == that.retrievedDocumentCount &&
               retrievedDocumentSize == that.retrievedDocumentSize &&
               outputDocumentCount == that.outputDocumentCount &&
               outputDocumentSize == that.outputDocumentSize &&
               indexHitDocumentCount == that.indexHitDocumentCount &&
               retries == that.retries &&
               totalQueryExecutionTime.equals(that.totalQueryExecutionTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(retrievedDocumentCount, retrievedDocumentSize, outputDocumentCount, outputDocumentSize,
                indexHitDocumentCount, totalQueryExecutionTime, retries);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("retrievedDocumentCount", retrievedDocumentCount)
                .add("retrievedDocumentSize", retrievedDocumentSize)
                .add("outputDocumentCount", outputDocumentCount)
                .add("outputDocumentSize", outputDocumentSize)
                .add("indexHitDocumentCount", indexHitDocumentCount)
                .add("totalQueryExecutionTime", totalQueryExecutionTime)
                .add("retries", retries)
                .toString();
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Builder for {@link QueryMetrics}. Unset fields are zero.
     */
    public static class Builder {
        private long retrievedDocumentCount;
        private long retrievedDocumentSize;
        private long outputDocumentCount;
        private long outputDocumentSize;
        private long indexHitDocumentCount;
        @Nonnull
        private Duration totalQueryExecutionTime = Duration.ZERO;
        private long retries;

        private Builder() {
        }

        @Nonnull
        public Builder setRetrievedDocumentCount(long retrievedDocumentCount) {
            this.retrievedDocumentCount = retrievedDocumentCount;
            return this;
        }

        @Nonnull
        public Builder setRetrievedDocumentSize(long retrievedDocumentSize) {
            this.retrievedDocumentSize = retrievedDocumentSize;
            return this;
        }

        @Nonnull
        public Builder setOutputDocumentCount(long outputDocumentCount) {
            this.outputDocumentCount = outputDocumentCount;
            return this;
        }

        @Nonnull
        public Builder setOutputDocumentSize(long outputDocumentSize) {
            this.outputDocumentSize = outputDocumentSize;
            return this;
        }

        @Nonnull
        public Builder setIndexHitDocumentCount(long indexHitDocumentCount) {
            this.indexHitDocumentCount = indexHitDocumentCount;
            return this;
        }

        @Nonnull
        public Builder setTotalQueryExecutionTime(@Nonnull Duration totalQueryExecutionTime) {
            this.totalQueryExecutionTime = totalQueryExecutionTime;
            return this;
        }

        @Nonnull
        public Builder setRetries(long retries) {
            this.retries = retries;
            return this;
        }

        @Nonnull
        public QueryMetrics build() {
            return new QueryMetrics(this);
        }
    }
}
