/*
 * AggregateExecutionComponent.java
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

import com.apple.foundationdb.async.AsyncUtil;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.shardmerge.annotation.API;
import com.shardmerge.query.CancellationToken;
import com.shardmerge.query.ComponentFactory;
import com.shardmerge.query.QueryExecutionComponent;
import com.shardmerge.query.QueryInvariantException;
import com.shardmerge.query.QueryUnsupportedOperationException;
import com.shardmerge.query.ResultBatch;
import com.shardmerge.query.Undefined;
import com.shardmerge.query.aggregate.AggregateOperator;
import com.shardmerge.query.aggregate.AggregateValue;
import com.shardmerge.query.aggregate.Aggregator;
import com.shardmerge.query.aggregate.Aggregators;
import com.shardmerge.query.logging.KeyValueLogMessage;
import com.shardmerge.query.logging.LogMessageKeys;
import com.shardmerge.query.metrics.PartitionedQueryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A component that computes aggregates over everything its source produces and returns them in a single page.
 *
 * <p>
 * Each row of the source is a {@link List} holding one partial value per aggregate operator, in the order the
 * operators were given. The first drain pulls pages from the source until the source is done, whatever the requested
 * page size, folding the partials into one {@link Aggregator} per operator. It then returns the defined results with
 * no continuation. Request charge, response length, metrics and contacted replicas of all source pages are summed
 * into the returned page.
 * </p>
 *
 * <p>
 * A projection can only bind a single aggregate, so draining with more than one operator fails once the source has
 * been consumed.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class AggregateExecutionComponent implements QueryExecutionComponent<Object> {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(AggregateExecutionComponent.class);

    @Nonnull
    private final QueryExecutionComponent<Object> source;
    @Nonnull
    private final List<AggregateOperator> operators;
    @Nonnull
    private final List<Aggregator> aggregators;
    private final int drainPageSize;
    private boolean done;

    private AggregateExecutionComponent(@Nonnull QueryExecutionComponent<Object> source,
                                        @Nonnull List<AggregateOperator> operators,
                                        int drainPageSize) {
        this.source = source;
        this.operators = operators;
        this.drainPageSize = drainPageSize;
        final ImmutableList.Builder<Aggregator> aggregatorsBuilder = ImmutableList.builder();
        for (AggregateOperator operator : operators) {
            aggregatorsBuilder.add(Aggregators.create(operator));
        }
        this.aggregators = aggregatorsBuilder.build();
    }

    @Nonnull
    public static CompletableFuture<QueryExecutionComponent<Object>> create(@Nonnull List<AggregateOperator> operators,
                                                                           @Nullable String continuationToken,
                                                                           @Nonnull ComponentFactory<Object> sourceFactory) {
        return create(operators, continuationToken, sourceFactory, Integer.MAX_VALUE);
    }

    /**
     * Create an aggregate component.
     *
     * @param operators the aggregates to compute, one per partial value in each source row
     * @param continuationToken the continuation to hand to the source
     * @param sourceFactory creates the source
     * @param drainPageSize the page size requested from the source on each step of the full drain
     * @return a future that completes with the new component
     */
    @Nonnull
    public static CompletableFuture<QueryExecutionComponent<Object>> create(@Nonnull List<AggregateOperator> operators,
                                                                           @Nullable String continuationToken,
                                                                           @Nonnull ComponentFactory<Object> sourceFactory,
                                                                           int drainPageSize) {
        Preconditions.checkArgument(!operators.isEmpty(), "at least one aggregate operator is required");
        Preconditions.checkArgument(drainPageSize > 0, "drain page size must be positive");
        final List<AggregateOperator> operatorList = ImmutableList.copyOf(operators);
        return sourceFactory.create(continuationToken)
                .<QueryExecutionComponent<Object>>thenApply(source ->
                        new AggregateExecutionComponent(source, operatorList, drainPageSize));
    }

    @Nonnull
    public List<AggregateOperator> getOperators() {
        return operators;
    }

    @Override
    public boolean isDone() {
        return done;
    }

    @Nonnull
    @Override
    public CompletableFuture<ResultBatch<Object>> drain(int maxElements, @Nonnull CancellationToken cancellationToken) {
        final CompletableFuture<ResultBatch<Object>> cancelled = ComponentSupport.checkCancellation(this, cancellationToken);
        if (cancelled != null) {
            return cancelled;
        }
        if (done) {
            return CompletableFuture.completedFuture(ResultBatch.empty());
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("starting aggregate drain",
                    LogMessageKeys.AGGREGATE_OPERATOR, operators,
                    LogMessageKeys.PAGE_SIZE, drainPageSize));
        }
        final DrainTotals totals = new DrainTotals();
        return AsyncUtil.whileTrue(() -> {
            if (source.isDone()) {
                return AsyncUtil.READY_FALSE;
            }
            final CompletableFuture<Boolean> cancelledStep = ComponentSupport.checkCancellation(this, cancellationToken);
            if (cancelledStep != null) {
                return cancelledStep;
            }
            return source.drain(drainPageSize, cancellationToken).thenApply(batch -> {
                totals.add(batch);
                for (Object row : batch.getItems()) {
                    aggregateRow(row);
                }
                return !source.isDone();
            });
        }, getExecutor()).thenApply(vignore -> {
            done = true;
            final List<Object> results = bindResults();
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("finished aggregate drain",
                        LogMessageKeys.PAGE_COUNT, totals.pageCount,
                        LogMessageKeys.REQUEST_CHARGE, totals.requestCharge,
                        LogMessageKeys.RESULT_COUNT, results.size()));
            }
            return ResultBatch.newBuilder()
                    .setItems(results)
                    .setRequestCharge(totals.requestCharge)
                    .setResponseLengthBytes(totals.responseLengthBytes)
                    .setQueryMetrics(totals.queryMetrics)
                    .setContactedReplicas(totals.contactedReplicas)
                    .build();
        });
    }

    private void aggregateRow(@Nullable Object row) {
        if (!(row instanceof List<?>) || ((List<?>)row).size() != aggregators.size()) {
            throw new QueryInvariantException("aggregate row must hold one partial value per operator",
                    LogMessageKeys.AGGREGATE_COUNT, aggregators.size(),
                    LogMessageKeys.VALUE, row);
        }
        final List<?> partials = (List<?>)row;
        for (int i = 0; i < aggregators.size(); i++) {
            final Aggregator aggregator = aggregators.get(i);
            aggregator.aggregate(AggregateValue.decode(aggregator.getOperator(), partials.get(i)));
        }
    }

    @Nonnull
    private List<Object> bindResults() {
        if (aggregators.size() != 1) {
            throw new QueryUnsupportedOperationException("only one aggregate function may be bound to a projection",
                    LogMessageKeys.AGGREGATE_COUNT, aggregators.size(),
                    LogMessageKeys.AGGREGATE_OPERATOR, operators);
        }
        final List<Object> results = new ArrayList<>(1);
        for (Aggregator aggregator : aggregators) {
            final Object result = aggregator.getResult();
            if (!Undefined.isUndefined(result)) {
                results.add(result);
            }
        }
        return results;
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

    private static final class DrainTotals {
        private int pageCount;
        private double requestCharge;
        private long responseLengthBytes;
        @Nonnull
        private PartitionedQueryMetrics queryMetrics = PartitionedQueryMetrics.EMPTY;
        @Nonnull
        private final Set<URI> contactedReplicas = new LinkedHashSet<>();

        private void add(@Nonnull ResultBatch<?> batch) {
            pageCount++;
            requestCharge += batch.getRequestCharge();
            responseLengthBytes += batch.getResponseLengthBytes();
            queryMetrics = queryMetrics.add(batch.getQueryMetrics());
            contactedReplicas.addAll(batch.getContactedReplicas());
        }
    }
}
