/*
 * ExecutionPipeline.java
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

import com.shardmerge.annotation.API;
import com.shardmerge.query.CancellationToken;
import com.shardmerge.query.ComponentFactory;
import com.shardmerge.query.QueryCoreArgumentException;
import com.shardmerge.query.QueryCoreException;
import com.shardmerge.query.QueryExecutionComponent;
import com.shardmerge.query.ResultBatch;
import com.shardmerge.query.aggregate.AggregateOperator;
import com.shardmerge.query.components.AggregateExecutionComponent;
import com.shardmerge.query.components.SkipExecutionComponent;
import com.shardmerge.query.components.TakeExecutionComponent;
import com.shardmerge.query.logging.KeyValueLogMessage;
import com.shardmerge.query.logging.LogMessageKeys;
import com.shardmerge.query.metrics.PartitionedQueryMetrics;
import com.shardmerge.query.properties.PipelinePropertyStorage;
import com.shardmerge.query.properties.QueryPipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * The stack of components executing one cross-partition query.
 *
 * <p>
 * Components are stacked over the partition source in a fixed order: aggregate, offset, limit, top, each present only
 * when the {@link QueryPipelineInfo} asks for it. The continuation of a page is the continuation of the topmost
 * component; it embeds the continuations of the components below it, so a pipeline created from it resumes every
 * component where it stopped.
 * </p>
 *
 * <p>
 * If a drain fails, the pipeline stops its components before passing the failure on.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class ExecutionPipeline implements QueryExecutionComponent<Object> {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutionPipeline.class);

    @Nonnull
    private final QueryExecutionComponent<Object> component;
    private final int pageSize;

    private ExecutionPipeline(@Nonnull QueryExecutionComponent<Object> component, int pageSize) {
        this.component = component;
        this.pageSize = pageSize;
    }

    /**
     * Create the pipeline for a query.
     *
     * @param info the components the query needs
     * @param continuation the continuation returned with the previous page, if any
     * @param sourceFactory creates the partition source from its continuation
     * @param properties pipeline properties
     * @param pageSize the number of items {@link #executeNext} asks for
     * @return a future that completes with the pipeline
     * @throws QueryCoreArgumentException if the page size is negative, or the query has an offset or a limit while
     * cross-partition offset and limit are not enabled
     * @throws com.shardmerge.query.BadRequestException if the continuation is not valid for this query
     */
    @Nonnull
    public static CompletableFuture<ExecutionPipeline> create(@Nonnull QueryPipelineInfo info,
                                                              @Nullable String continuation,
                                                              @Nonnull ComponentFactory<Object> sourceFactory,
                                                              @Nonnull PipelinePropertyStorage properties,
                                                              int pageSize) {
        if (pageSize < 0) {
            throw new QueryCoreArgumentException("page size must not be negative", LogMessageKeys.PAGE_SIZE, pageSize);
        }
        if ((info.getOffset() != null || info.getLimit() != null) && !info.isCrossPartitionSkipTakeEnabled()) {
            throw new QueryCoreArgumentException("cross partition offset and limit are not enabled",
                    LogMessageKeys.PIPELINE, info);
        }

        ComponentFactory<Object> factory = sourceFactory;
        if (info.hasAggregates()) {
            final ComponentFactory<Object> aggregateSource = factory;
            final List<AggregateOperator> aggregates = info.getAggregates();
            final Integer drainPageSize = properties.getPropertyValue(QueryPipelineProperties.AGGREGATE_DRAIN_PAGE_SIZE);
            final int aggregatePageSize = drainPageSize == null ? Integer.MAX_VALUE : drainPageSize;
            factory = sourceContinuation -> AggregateExecutionComponent.create(aggregates, sourceContinuation,
                    aggregateSource, aggregatePageSize);
        }
        if (info.getOffset() != null) {
            final ComponentFactory<Object> skipSource = factory;
            final int offset = info.getOffset();
            factory = sourceContinuation -> SkipExecutionComponent.create(offset, sourceContinuation, skipSource);
        }
        if (info.getLimit() != null) {
            final ComponentFactory<Object> limitSource = factory;
            final int limit = info.getLimit();
            factory = sourceContinuation -> TakeExecutionComponent.createLimit(limit, sourceContinuation, limitSource);
        }
        if (info.getTop() != null) {
            final ComponentFactory<Object> topSource = factory;
            final int top = info.getTop();
            factory = sourceContinuation -> TakeExecutionComponent.createTop(top, sourceContinuation, topSource);
        }
        return factory.create(continuation).thenApply(component -> new ExecutionPipeline(component, pageSize));
    }

    /**
     * Drain the next page of the configured page size.
     * @param cancellationToken the cancellation signal of the query
     * @return a future that completes with the next page
     */
    @Nonnull
    public CompletableFuture<ResultBatch<Object>> executeNext(@Nonnull CancellationToken cancellationToken) {
        return drain(pageSize, cancellationToken);
    }

    public int getPageSize() {
        return pageSize;
    }

    @Override
    public boolean isDone() {
        return component.isDone();
    }

    @Nonnull
    @Override
    public CompletableFuture<ResultBatch<Object>> drain(int maxElements, @Nonnull CancellationToken cancellationToken) {
        final CompletableFuture<ResultBatch<Object>> page;
        try {
            page = component.drain(maxElements, cancellationToken);
        } catch (RuntimeException ex) {
            stopAfterFailure(ex);
            throw ex;
        }
        return page.whenComplete((result, err) -> {
            if (err != null) {
                stopAfterFailure(err);
            }
        });
    }

    private void stopAfterFailure(@Nonnull Throwable err) {
        final Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
        if (LOGGER.isWarnEnabled()) {
            final KeyValueLogMessage message = KeyValueLogMessage.build("stopping query pipeline after failure",
                    LogMessageKeys.MESSAGE, cause.getMessage());
            if (cause instanceof QueryCoreException) {
                message.addKeysAndValues(((QueryCoreException)cause).getLogInfo());
            }
            LOGGER.warn(message.toString());
        }
        component.stop();
    }

    @Override
    public void stop() {
        component.stop();
    }

    @Nonnull
    @Override
    public PartitionedQueryMetrics getQueryMetrics() {
        return component.getQueryMetrics();
    }

    @Nonnull
    @Override
    public Executor getExecutor() {
        return component.getExecutor();
    }

    @Override
    public void close() {
        component.close();
    }
}
