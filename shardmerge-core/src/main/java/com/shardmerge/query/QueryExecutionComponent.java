/*
 * QueryExecutionComponent.java
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

import com.shardmerge.annotation.API;
import com.shardmerge.query.metrics.PartitionedQueryMetrics;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A stage of the cross-partition execution pipeline.
 *
 * <p>
 * Components are stacked as decorators: each one owns the component below it (its source), pulls pages from it with
 * {@link #drain(int, CancellationToken)} and forwards {@link #stop()}, {@link #close()},
 * {@link #getQueryMetrics()} and {@link #getExecutor()} to it explicitly. The bottom of the stack is supplied by the
 * caller and talks to the partitions.
 * </p>
 *
 * <p>
 * A component belongs to a single query execution and must not be drained by more than one caller at a time.
 * Failures of the returned future are never retried by the component.
 * </p>
 *
 * @param <T> the type of the items produced
 */
@API(API.Status.UNSTABLE)
public interface QueryExecutionComponent<T> extends AutoCloseable {
    /**
     * Whether this component has produced all of its results.
     * @return {@code true} if further drains will produce no items
     */
    boolean isDone();

    /**
     * Produce the next page of results.
     *
     * <p>
     * The cancellation token is checked before any work is done. If cancellation was requested, the returned future
     * completes exceptionally with a {@link QueryCancelledException}.
     * </p>
     *
     * @param maxElements the maximum number of items the caller wants in the page
     * @param cancellationToken the cancellation signal of the current query
     * @return a future that completes with the next page
     */
    @Nonnull
    CompletableFuture<ResultBatch<T>> drain(int maxElements, @Nonnull CancellationToken cancellationToken);

    /**
     * Stop producing results, for example because the query failed further up the stack.
     */
    void stop();

    /**
     * Get the metrics accumulated so far, keyed by partition id.
     * @return the metrics of every partition this component has read from
     */
    @Nonnull
    PartitionedQueryMetrics getQueryMetrics();

    @Nonnull
    Executor getExecutor();

    /**
     * Release the resources held by this component and its source.
     */
    @Override
    void close();
}
