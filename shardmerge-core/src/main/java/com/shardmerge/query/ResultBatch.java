/*
 * ResultBatch.java
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

package com.shardmerge.query;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import com.shardmerge.annotation.API;
import com.shardmerge.query.metrics.PartitionedQueryMetrics;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * One page of results produced by a {@link QueryExecutionComponent}, together with the metadata the page accumulated.
 *
 * <p>
 * A component that transforms a batch from its source changes the items and the continuation and carries every
 * other field through unchanged, using {@link #toBuilder()}.
 * </p>
 *
 * <p>
 * When {@link #getDisallowContinuationMessage()} is set, the source has declared that no continuation may be issued
 * for this query (see {@link #isContinuationSuppressed()}). Components never set this themselves; they only pass it
 * on together with the source's continuation.
 * </p>
 *
 * @param <T> the type of the items
 */
@API(API.Status.UNSTABLE)
public final class ResultBatch<T> {
    @Nonnull
    private final List<T> items;
    private final double requestCharge;
    private final long responseLengthBytes;
    @Nonnull
    private final PartitionedQueryMetrics queryMetrics;
    @Nonnull
    private final ImmutableSet<URI> contactedReplicas;
    @Nullable
    private final String continuation;
    @Nullable
    private final String disallowContinuationMessage;

    private ResultBatch(@Nonnull Builder<T> builder) {
        this.items = builder.items;
        this.requestCharge = builder.requestCharge;
        this.responseLengthBytes = builder.responseLengthBytes;
        this.queryMetrics = builder.queryMetrics;
        this.contactedReplicas = builder.contactedReplicas;
        this.continuation = builder.continuation;
        this.disallowContinuationMessage = builder.disallowContinuationMessage;
    }

    @Nonnull
    public List<T> getItems() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Get the accumulated request charge, an additive cost figure reported by the partitions.
     * @return the request charge of this batch
     */
    public double getRequestCharge() {
        return requestCharge;
    }

    public long getResponseLengthBytes() {
        return responseLengthBytes;
    }

    @Nonnull
    public PartitionedQueryMetrics getQueryMetrics() {
        return queryMetrics;
    }

    @Nonnull
    public Set<URI> getContactedReplicas() {
        return contactedReplicas;
    }

    /**
     * Get the continuation from which the query resumes after this batch.
     * @return the continuation, or {@code null} if the query has no more results or the continuation is suppressed
     */
    @Nullable
    public String getContinuation() {
        return continuation;
    }

    @Nullable
    public String getDisallowContinuationMessage() {
        return disallowContinuationMessage;
    }

    public boolean isContinuationSuppressed() {
        return disallowContinuationMessage != null;
    }

    @Nonnull
    public Builder<T> toBuilder() {
        return new Builder<>(this);
    }

    @Nonnull
    public static <T> Builder<T> newBuilder() {
        return new Builder<>();
    }

    @Nonnull
    public static <T> ResultBatch<T> empty() {
        return new Builder<T>().build();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("items", items.size())
                .add("requestCharge", requestCharge)
                .add("responseLengthBytes", responseLengthBytes)
                .add("continuation", continuation)
                .add("disallowContinuationMessage", disallowContinuationMessage)
                .toString();
    }

    /**
     * Builder for {@link ResultBatch}.
     * @param <T> the type of the items
     */
    public static class Builder<T> {
        @Nonnull
        private List<T> items = Collections.emptyList();
        private double requestCharge;
        private long responseLengthBytes;
        @Nonnull
        private PartitionedQueryMetrics queryMetrics = PartitionedQueryMetrics.EMPTY;
        @Nonnull
        private ImmutableSet<URI> contactedReplicas = ImmutableSet.of();
        @Nullable
        private String continuation;
        @Nullable
        private String disallowContinuationMessage;

        private Builder() {
        }

        private Builder(@Nonnull ResultBatch<T> batch) {
            this.items = batch.items;
            this.requestCharge = batch.requestCharge;
            this.responseLengthBytes = batch.responseLengthBytes;
            this.queryMetrics = batch.queryMetrics;
            this.contactedReplicas = batch.contactedReplicas;
            this.continuation = batch.continuation;
            this.disallowContinuationMessage = batch.disallowContinuationMessage;
        }

        @Nonnull
        public Builder<T> setItems(@Nonnull Collection<? extends T> items) {
            // items may be null, as in the minimum of a column of nulls
            this.items = Collections.unmodifiableList(new ArrayList<>(items));
            return this;
        }

        @Nonnull
        public Builder<T> setRequestCharge(double requestCharge) {
            this.requestCharge = requestCharge;
            return this;
        }

        @Nonnull
        public Builder<T> setResponseLengthBytes(long responseLengthBytes) {
            this.responseLengthBytes = responseLengthBytes;
            return this;
        }

        @Nonnull
        public Builder<T> setQueryMetrics(@Nonnull PartitionedQueryMetrics queryMetrics) {
            this.queryMetrics = queryMetrics;
            return this;
        }

        @Nonnull
        public Builder<T> setContactedReplicas(@Nonnull Collection<URI> contactedReplicas) {
            this.contactedReplicas = ImmutableSet.copyOf(contactedReplicas);
            return this;
        }

        @Nonnull
        public Builder<T> setContinuation(@Nullable String continuation) {
            this.continuation = continuation;
            return this;
        }

        @Nonnull
        public Builder<T> setDisallowContinuationMessage(@Nullable String disallowContinuationMessage) {
            this.disallowContinuationMessage = disallowContinuationMessage;
            return this;
        }

        @Nonnull
        public ResultBatch<T> build() {
            return new ResultBatch<>(this);
        }
    }
}
