/*
 * SkipExecutionComponent.java
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

package com.shardmerge.query.components;

import com.shardmerge.annotation.API;
import com.shardmerge.query.CancellationToken;
import com.shardmerge.query.ComponentFactory;
import com.shardmerge.query.QueryExecutionComponent;
import com.shardmerge.query.ResultBatch;
import com.shardmerge.query.continuation.ContinuationToken;
import com.shardmerge.query.continuation.TokenKind;
import com.shardmerge.query.metrics.PartitionedQueryMetrics;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A component that skips a specified number of initial items, across as many pages as it takes.
 *
 * <p>
 * The number of items still to skip is written into the continuation as an {@link TokenKind#OFFSET} token, together
 * with the continuation of the source.
 * </p>
 *
 * @param <T> the type of the items
 */
@API(API.Status.UNSTABLE)
public class SkipExecutionComponent<T> implements QueryExecutionComponent<T> {
    @Nonnull
    private final QueryExecutionComponent<T> source;
    private int skipCount;

    private SkipExecutionComponent(@Nonnull QueryExecutionComponent<T> source, int skipCount) {
        this.source = source;
        this.skipCount = skipCount;
    }

    /**
     * Create a skip component, resuming from a continuation if one is given.
     *
     * @param offsetCount the number of items the query skips
     * @param continuationToken the continuation returned with the previous page, if any
     * @param sourceFactory creates the source from the continuation embedded in {@code continuationToken}
     * @param <T> the type of the items
     * @return a future that completes with the new component
     * @throws com.shardmerge.query.BadRequestException if {@code offsetCount} is negative, or the continuation is
     * malformed or has a larger count than {@code offsetCount}
     */
    @Nonnull
    public static <T> CompletableFuture<QueryExecutionComponent<T>> create(int offsetCount,
                                                                          @Nullable String continuationToken,
                                                                          @Nonnull ComponentFactory<T> sourceFactory) {
        ComponentSupport.checkCount("offset", offsetCount);
        final ContinuationToken token = continuationToken == null
                                        ? new ContinuationToken(TokenKind.OFFSET, offsetCount, null)
                                        : ContinuationToken.parse(TokenKind.OFFSET, continuationToken, offsetCount);
        return sourceFactory.create(token.getSourceToken())
                .<QueryExecutionComponent<T>>thenApply(source -> new SkipExecutionComponent<>(source, token.getRemaining()));
    }

    public int getSkipCount() {
        return skipCount;
    }

    @Override
    public boolean isDone() {
        return source.isDone();
    }

    @Nonnull
    @Override
    public CompletableFuture<ResultBatch<T>> drain(int maxElements, @Nonnull CancellationToken cancellationToken) {
        final CompletableFuture<ResultBatch<T>> cancelled = ComponentSupport.checkCancellation(this, cancellationToken);
        if (cancelled != null) {
            return cancelled;
        }
        return source.drain(maxElements, cancellationToken).thenApply(batch -> {
            final List<T> items = batch.getItems();
            final int skipped = Math.min(skipCount, items.size());
            skipCount -= skipped;

            final ResultBatch.Builder<T> builder = batch.toBuilder().setItems(items.subList(skipped, items.size()));
            if (!batch.isContinuationSuppressed()) {
                builder.setContinuation(source.isDone()
                                        ? null
                                        : new ContinuationToken(TokenKind.OFFSET, skipCount, batch.getContinuation()).toJson());
            }
            return builder.build();
        });
    }

    @Override
    public void stop() {
        source.stop();
    }

    @Nonnull
    @Override
    public PartitionedQueryMetrics getQueryMetrics() {
        return source.getQueryMetrics();
    }

    @Nonnull
    @Override
    public Executor getExecutor() {
        return source.getExecutor();
    }

    @Override
    public void close() {
        source.close();
    }
}
