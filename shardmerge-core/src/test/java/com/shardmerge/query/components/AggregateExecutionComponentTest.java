/*
 * AggregateExecutionComponentTest.java
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

import com.shardmerge.query.CancellationToken;
import com.shardmerge.query.ComponentTestUtils;
import com.shardmerge.query.ListExecutionComponent;
import com.shardmerge.query.QueryCancelledException;
import com.shardmerge.query.QueryExecutionComponent;
import com.shardmerge.query.QueryInvariantException;
import com.shardmerge.query.QueryUnsupportedOperationException;
import com.shardmerge.query.ResultBatch;
import com.shardmerge.query.Undefined;
import com.shardmerge.query.aggregate.AggregateOperator;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AggregateExecutionComponentTest {
    private static List<Object> rows(Object... partials) {
        final Object[] rows = new Object[partials.length];
        for (int i = 0; i < partials.length; i++) {
            rows[i] = Arrays.asList(partials[i]);
        }
        return Arrays.asList(rows);
    }

    @Nonnull
    private static QueryExecutionComponent<Object> aggregate(@Nonnull List<AggregateOperator> operators,
                                                             @Nonnull ListExecutionComponent<Object> source,
                                                             int drainPageSize) {
        return AggregateExecutionComponent.create(operators, null,
                continuation -> CompletableFuture.completedFuture(source), drainPageSize).join();
    }

    @Test
    void countOverAllPages() {
        ListExecutionComponent<Object> source = new ListExecutionComponent<>(rows(2L, 3L, 5L), "0", 2, null);
        QueryExecutionComponent<Object> count = aggregate(List.of(AggregateOperator.COUNT), source, Integer.MAX_VALUE);

        ResultBatch<Object> page = count.drain(1, new CancellationToken()).join();
        assertThat(page.getItems()).containsExactly(10L);
        assertNull(page.getContinuation());
        assertTrue(count.isDone());
        assertEquals(2, source.getDrainCount());

        assertEquals(2.0, page.getRequestCharge());
        assertEquals(30L, page.getResponseLengthBytes());
        assertEquals(3L, page.getQueryMetrics().get("0").getRetrievedDocumentCount());
        assertEquals(1, page.getContactedReplicas().size());
    }

    @Test
    void drainPageSizeIsUsedForTheSource() {
        ListExecutionComponent<Object> source = new ListExecutionComponent<>(rows(1, 2, 3, 4), "0", 10, null);
        QueryExecutionComponent<Object> sum = aggregate(List.of(AggregateOperator.SUM), source, 1);
        assertThat(sum.drain(100, new CancellationToken()).join().getItems()).containsExactly(10.0);
        assertEquals(4, source.getDrainCount());
    }

    @Test
    void averageOfPartials() {
        ListExecutionComponent<Object> source = new ListExecutionComponent<>(
                rows(Map.of("sum", 10, "count", 2), Map.of("sum", 20, "count", 3)), "0", 1, null);
        QueryExecutionComponent<Object> average = aggregate(List.of(AggregateOperator.AVERAGE), source, Integer.MAX_VALUE);
        assertThat(average.drain(100, new CancellationToken()).join().getItems()).containsExactly(6.0);
    }

    @Test
    void undefinedResultIsDropped() {
        ListExecutionComponent<Object> source = new ListExecutionComponent<>(rows(3, Undefined.INSTANCE, 4), "0", 2, null);
        QueryExecutionComponent<Object> max = aggregate(List.of(AggregateOperator.MAX), source, Integer.MAX_VALUE);
        ResultBatch<Object> page = max.drain(100, new CancellationToken()).join();
        assertThat(page.getItems()).isEmpty();
        assertTrue(max.isDone());
    }

    @Test
    void nullMinimumIsKept() {
        ListExecutionComponent<Object> source = new ListExecutionComponent<>(rows(3, null, "x"), "0", 2, null);
        QueryExecutionComponent<Object> min = aggregate(List.of(AggregateOperator.MIN), source, Integer.MAX_VALUE);
        assertThat(min.drain(100, new CancellationToken()).join().getItems()).containsExactly((Object)null);
    }

    @Test
    void emptySource() {
        ListExecutionComponent<Object> source = new ListExecutionComponent<>(List.of(), "0", 2, null);
        QueryExecutionComponent<Object> count = aggregate(List.of(AggregateOperator.COUNT), source, Integer.MAX_VALUE);
        assertThat(count.drain(100, new CancellationToken()).join().getItems()).containsExactly(0L);
        assertEquals(0, source.getDrainCount());
    }

    @Test
    void drainAfterDoneIsEmpty() {
        ListExecutionComponent<Object> source = new ListExecutionComponent<>(rows(1L), "0", 2, null);
        QueryExecutionComponent<Object> count = aggregate(List.of(AggregateOperator.COUNT), source, Integer.MAX_VALUE);
        count.drain(100, new CancellationToken()).join();
        assertThat(count.drain(100, new CancellationToken()).join().getItems()).isEmpty();
        assertEquals(1, source.getDrainCount());
    }

    @Test
    void multipleOperatorsCannotBeBound() {
        ListExecutionComponent<Object> source = new ListExecutionComponent<>(
                List.of(List.of(1L, 2), List.of(1L, 3)), "0", 1, null);
        QueryExecutionComponent<Object> aggregate = aggregate(List.of(AggregateOperator.COUNT, AggregateOperator.SUM),
                source, Integer.MAX_VALUE);
        QueryUnsupportedOperationException ex = ComponentTestUtils.assertFailsWith(
                aggregate.drain(100, new CancellationToken()), QueryUnsupportedOperationException.class);
        assertEquals("only one aggregate function may be bound to a projection", ex.getMessage());
        assertEquals(2, source.getDrainCount());
    }

    @Test
    void rowsMustMatchOperators() {
        ListExecutionComponent<Object> source = new ListExecutionComponent<>(List.of(5L), "0", 1, null);
        QueryExecutionComponent<Object> count = aggregate(List.of(AggregateOperator.COUNT), source, Integer.MAX_VALUE);
        ComponentTestUtils.assertFailsWith(count.drain(100, new CancellationToken()), QueryInvariantException.class);
    }

    @Test
    void cancelledBeforeDrain() {
        ListExecutionComponent<Object> source = new ListExecutionComponent<>(rows(1L, 2L), "0", 1, null);
        QueryExecutionComponent<Object> count = aggregate(List.of(AggregateOperator.COUNT), source, Integer.MAX_VALUE);
        CancellationToken token = new CancellationToken();
        token.cancel();
        ComponentTestUtils.assertFailsWith(count.drain(100, token), QueryCancelledException.class);
        assertEquals(0, source.getDrainCount());
        assertFalse(count.isDone());
    }

    @Test
    void cancelledDuringDrain() {
        final CancellationToken token = new CancellationToken();
        ListExecutionComponent<Object> source = new ListExecutionComponent<Object>(rows(1L, 2L, 3L), "0", 1, null) {
            @Nonnull
            @Override
            public CompletableFuture<ResultBatch<Object>> drain(int maxElements, @Nonnull CancellationToken cancellationToken) {
                final CompletableFuture<ResultBatch<Object>> page = super.drain(maxElements, cancellationToken);
                token.cancel();
                return page;
            }
        };
        QueryExecutionComponent<Object> count = aggregate(List.of(AggregateOperator.COUNT), source, Integer.MAX_VALUE);
        ComponentTestUtils.assertFailsWith(count.drain(100, token), QueryCancelledException.class);
        assertEquals(1, source.getDrainCount());
        assertFalse(count.isDone());
    }
}
