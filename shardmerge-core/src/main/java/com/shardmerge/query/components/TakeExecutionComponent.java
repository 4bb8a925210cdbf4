/*
 * TakeExecutionComponent.java
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
import com.shardmerge.query.QueryInvariantException;
import com.shardmerge.query.ResultBatch;
import com.shardmerge.query.continuation.ContinuationToken;
import com.shardmerge.query.continuation.TokenKind;
import com.shardmerge.query.logging.LogMessageKeys;
import com.shardmerge.query.metrics.PartitionedQueryMetrics;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A component that returns at most a specified number of items across all of its pages.
 *
 * <p>
 * {@code LIMIT} and {@code TOP} queries behave the same and only differ in the field name of their continuation
 * token ({@link TokenKind#LIMIT} or {@link TokenKind#TOP}). The component is done once the allowance is used up or the
 * source is done.
 * </p>
 *
 * @param <T> the type of the items
 */
@API(API.Status.UNSTABLE)
public class TakeExecutionComponent<T> implements QueryExecutionComponent<T> {
    @Nonnull
    private final QueryExecutionComponent<T> source;
    @Nonnull
    private final TokenKind kind;
    private int takeCount;

    private TakeExecutionComponent(@Nonnull QueryExecutionComponent<T> source, @Nonnull TokenKind kind,
                                   int takeCount) {
        this.source = source;
        this.kind = kind;
        this.takeCount = takeCount;
    }

    @Nonnull
    public static <T> CompletableFuture<QueryExecutionComponent<T>> createLimit(int limitCount,
                                                                               @Nullable String continuationToken,
                                                                               @Nonnull ComponentFactory<T> sourceFactory) {
        return create(TokenKind.LIMIT, limitCount, continuationToken, sourceFactory);
    }

    @Nonnull
    public static <T> CompletableFuture<QueryExecutionComponent<T>> createTop(int topCount,
                                                                             @Nullable String continuationToken,
                                                                             @Nonnull ComponentFactory<T> sourceFactory) {
        return create(TokenKind.TOP, topCount, continuationToken, sourceFactory);
    }

    /**
     * Create a take component of the given flavor, resuming from a continuation if one is given.
     *
     * @param kind {@link TokenKind#LIMIT} or {@link TokenKind#TOP}
     * @param count the maximum number of items the query returns
     * @param continuationToken the continuation returned with the previous page, if any
     * @param sourceFactory creates the source from the continuation embedded in {@code continuationToken}
     * @param <T> the type of the items
     * @return a future that completes with the new component
     * @throws com.shardmerge.query.BadRequestException if {@code count} is negative, or the continuation is malformed
     * or has a larger count than {@code count}
     * @throws QueryInvariantException if {@code kind} is not a take flavor
     */
    @Nonnull
    public static <T> CompletableFuture<QueryExecutionComponent<T>> create(@Nonnull TokenKind kind, int count,
                                                                          @Nullable String continuationToken,
                                                                          @Nonnull ComponentFactory<T> sourceFactory) {
        switch (kind) {
            case LIMIT:
            case TOP:
                break;
            default:
                throw new QueryInvariantException("unknown take flavor", LogMessageKeys.TOKEN_KIND, kind);
        }
        ComponentSupport.checkCount(kind.getCountField(), count);
        final ContinuationToken token = continuationToken == null
                                        ? new ContinuationToken(kind, count, null)
                                        : ContinuationToken.parse(kind, continuationToken, count);
        return sourceFactory.create(token.getSourceToken())
                .<QueryExecutionComponent<T>>thenApply(source -> new TakeExecutionComponent<>(source, kind, token.getRemaining()));
    }

    public int getTakeCount() {
        return takeCount;
    }

    @Nonnull
    public TokenKind getKind() {
        return kind;
    }

    @Override
    public boolean isDone() {
        return source.isDone() || takeCount <= 0;
    }

    @Nonnull
    @Override
    public CompletableFuture<ResultBatch<T>> drain(int maxElements, @Nonnull CancellationToken cancellationToken) {
        final CompletableFuture<ResultBatch<T>> cancelled = ComponentSupport.checkCancellation(this, cancellationToken);
        if (cancelled != null) {
            return cancelled;
        }
        if (takeCount <= 0) {
            return CompletableFuture.completedFuture(ResultBatch.empty());
        }
        return source.drain(maxElements, cancellationToken).thenApply(batch -> {
            final List<T> items = batch.getItems();
            final int taken = Math.min(takeCount, items.size());
            takeCount -= taken;

            final ResultBatch.Builder<T> builder = batch.toBuilder().setItems(items.subList(0, taken));
            if (!batch.isContinuationSuppressed()) {
                builder.setContinuation(isDone()
                                        ? null
                                        : new ContinuationToken(kind, takeCount, batch.getContinuation()).toJson());
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
