/*
 * PartitionedQueryMetrics.java
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

import com.google.common.collect.ImmutableMap;
import com.shardmerge.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link QueryMetrics} keyed by the id of the partition that reported them.
 *
 * <p>
 * Adding two instances takes the union of their partitions. Partitions present on both sides have their metrics
 * summed; the others are carried over as they are.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class PartitionedQueryMetrics {
    @Nonnull
    public static final PartitionedQueryMetrics EMPTY = new PartitionedQueryMetrics(ImmutableMap.of());

    @Nonnull
    private final ImmutableMap<String, QueryMetrics> metricsByPartition;

    private PartitionedQueryMetrics(@Nonnull ImmutableMap<String, QueryMetrics> metricsByPartition) {
        this.metricsByPartition = metricsByPartition;
    }

    @Nonnull
    public static PartitionedQueryMetrics of(@Nonnull Map<String, QueryMetrics> metricsByPartition) {
        if (metricsByPartition.isEmpty()) {
            return EMPTY;
        }
        return new PartitionedQueryMetrics(ImmutableMap.copyOf(metricsByPartition));
    }

    @Nonnull
    public static PartitionedQueryMetrics of(@Nonnull String partitionId, @Nonnull QueryMetrics metrics) {
        return new PartitionedQueryMetrics(ImmutableMap.of(partitionId, metrics));
    }

    @Nonnull
    public PartitionedQueryMetrics add(@Nonnull PartitionedQueryMetrics other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Map<String, QueryMetrics> merged = new LinkedHashMap<>(metricsByPartition);
        for (Map.Entry<String, QueryMetrics> entry : other.metricsByPartition.entrySet()) {
            merged.merge(entry.getKey(), entry.getValue(), QueryMetrics::add);
        }
        return new PartitionedQueryMetrics(ImmutableMap.copyOf(merged));
    }

    @Nullable
    public QueryMetrics get(@Nonnull String partitionId) {
        return metricsByPartition.get(partitionId);
    }

    @Nonnull
    public Set<String> getPartitionIds() {
        return metricsByPartition.keySet();
    }

    @Nonnull
    public Map<String, QueryMetrics> asMap() {
        return metricsByPartition;
    }

    /**
     * Sum the metrics of all partitions.
     * @return the metrics of the whole query
     */
    @Nonnull
    public QueryMetrics total() {
        QueryMetrics total = QueryMetrics.ZERO;
        for (QueryMetrics metrics : metricsByPartition.values()) {
            total = total.add(metrics);
        }
        return total;
    }

    public boolean isEmpty() {
        return metricsByPartition.isEmpty();
    }

    public int size() {
        return metricsByPartition.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return metricsByPartition.equals(((PartitionedQueryMetrics)o).metricsByPartition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricsByPartition);
    }

    @Override
    public String toString() {
        return metricsByPartition.toString();
    }
}
