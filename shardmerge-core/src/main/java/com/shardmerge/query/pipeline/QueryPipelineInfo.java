/*
 * QueryPipelineInfo.java
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

package com.shardmerge.query.pipeline;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.shardmerge.annotation.API;
import com.shardmerge.query.aggregate.AggregateOperator;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * The parts of a distributed query plan that decide which components the {@link ExecutionPipeline} stacks over the
 * partition source.
 */
@API(API.Status.UNSTABLE)
public final class QueryPipelineInfo {
    @Nonnull
    private final List<AggregateOperator> aggregates;
    @Nullable
    private final Integer offset;
    @Nullable
    private final Integer limit;
    @Nullable
    private final Integer top;
    private final boolean crossPartitionSkipTakeEnabled;

    private QueryPipelineInfo(@Nonnull Builder builder) {
        this.aggregates = ImmutableList.copyOf(builder.aggregates);
        this.offset = builder.offset;
        this.limit = builder.limit;
        this.top = builder.top;
        this.crossPartitionSkipTakeEnabled = builder.crossPartitionSkipTakeEnabled;
    }

    @Nonnull
    public List<AggregateOperator> getAggregates() {
        return aggregates;
    }

    public boolean hasAggregates() {
        return !aggregates.isEmpty();
    }

    @Nullable
    public Integer getOffset() {
        return offset;
    }

    @Nullable
    public Integer getLimit() {
        return limit;
    }

    @Nullable
    public Integer getTop() {
        return top;
    }

    public boolean isCrossPartitionSkipTakeEnabled() {
        return crossPartitionSkipTakeEnabled;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("aggregates", aggregates)
                .add("offset", offset)
                .add("limit", limit)
                .add("top", top)
                .add("crossPartitionSkipTakeEnabled", crossPartitionSkipTakeEnabled)
                .toString();
    }

    /**
     * Builder for {@link QueryPipelineInfo}.
     */
    public static class Builder {
        @Nonnull
        private List<AggregateOperator> aggregates = ImmutableList.of();
        @Nullable
        private Integer offset;
        @Nullable
        private Integer limit;
        @Nullable
        private Integer top;
        private boolean crossPartitionSkipTakeEnabled;

        private Builder() {
        }

        private Builder(@Nonnull QueryPipelineInfo info) {
            this.aggregates = info.aggregates;
            this.offset = info.offset;
            this.limit = info.limit;
            this.top = info.top;
            this.crossPartitionSkipTakeEnabled = info.crossPartitionSkipTakeEnabled;
        }

        @Nonnull
        public Builder setAggregates(@Nonnull List<AggregateOperator> aggregates) {
            this.aggregates = aggregates;
            return this;
        }

        @Nonnull
        public Builder setOffset(@Nullable Integer offset) {
            this.offset = offset;
            return this;
        }

        @Nonnull
        public Builder setLimit(@Nullable Integer limit) {
            this.limit = limit;
            return this;
        }

        @Nonnull
        public Builder setTop(@Nullable Integer top) {
            this.top = top;
            return this;
        }

        @Nonnull
        public Builder setCrossPartitionSkipTakeEnabled(boolean crossPartitionSkipTakeEnabled) {
            this.crossPartitionSkipTakeEnabled = crossPartitionSkipTakeEnabled;
            return this;
        }

        @Nonnull
        public QueryPipelineInfo build() {
            return new QueryPipelineInfo(this);
        }
    }
}
