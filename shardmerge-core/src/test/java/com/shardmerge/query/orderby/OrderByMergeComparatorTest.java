/*
 * OrderByMergeComparatorTest.java
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

package com.shardmerge.query.orderby;

import com.shardmerge.query.QueryCoreArgumentException;
import com.shardmerge.query.QueryUnsupportedOperationException;
import com.shardmerge.query.properties.PipelinePropertyStorage;
import com.shardmerge.query.properties.QueryPipelineProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderByMergeComparatorTest {
    private static final OrderByMergeComparator ASCENDING = new OrderByMergeComparator(List.of(SortOrder.ASCENDING));

    private static final class TestCursor implements PartitionCursor {
        @Nonnull
        private final PartitionKeyRange range;
        @Nullable
        private final OrderByQueryResult current;

        TestCursor(@Nonnull String minInclusive, @Nullable List<?> orderByItems) {
            this.range = new PartitionKeyRange("range-" + minInclusive, minInclusive, minInclusive + "FF");
            this.current = orderByItems == null ? null : new OrderByQueryResult("rid-" + minInclusive, orderByItems, null);
        }

        @Override
        public boolean hasMoreResults() {
            return current != null;
        }

        @Nonnull
        @Override
        public OrderByQueryResult getCurrent() {
            if (current == null) {
                throw new IllegalStateException("cursor is exhausted");
            }
            return current;
        }

        @Nonnull
        @Override
        public PartitionKeyRange getPartitionKeyRange() {
            return range;
        }

        @Override
        public String toString() {
            return range.getMinInclusive() + ":" + (current == null ? "done" : current.getOrderByItems());
        }
    }

    @Test
    void sameCursorIsEqual() {
        TestCursor cursor = new TestCursor("00", List.of(1));
        assertThat(ASCENDING.compare(cursor, cursor)).isZero();
    }

    @Test
    void exhaustedCursorSortsLast() {
        TestCursor live = new TestCursor("80", List.of(100));
        TestCursor exhausted = new TestCursor("00", null);
        assertThat(ASCENDING.compare(live, exhausted)).isNegative();
        assertThat(ASCENDING.compare(exhausted, live)).isPositive();
    }

    @Test
    void exhaustedCursorsByRange() {
        TestCursor left = new TestCursor("00", null);
        TestCursor right = new TestCursor("40", null);
        assertThat(ASCENDING.compare(left, right)).isNegative();
        assertThat(ASCENDING.compare(right, left)).isPositive();
    }

    @Test
    void orderedByValues() {
        TestCursor small = new TestCursor("80", List.of(1));
        TestCursor large = new TestCursor("00", List.of(2));
        assertThat(ASCENDING.compare(small, large)).isNegative();

        OrderByMergeComparator descending = new OrderByMergeComparator(List.of(SortOrder.DESCENDING));
        assertThat(descending.compare(small, large)).isPositive();
    }

    @Test
    void laterColumnsBreakTies() {
        OrderByMergeComparator comparator = new OrderByMergeComparator(List.of(SortOrder.ASCENDING, SortOrder.DESCENDING));
        TestCursor cursor1 = new TestCursor("00", List.of("a", 1));
        TestCursor cursor2 = new TestCursor("40", List.of("a", 2));
        assertThat(comparator.compare(cursor1, cursor2)).isPositive();
        assertThat(comparator.compare(cursor2, cursor1)).isNegative();
    }

    @ParameterizedTest
    @EnumSource(SortOrder.class)
    void tiesBrokenByRange(SortOrder sortOrder) {
        OrderByMergeComparator comparator = new OrderByMergeComparator(List.of(sortOrder, sortOrder));
        TestCursor left = new TestCursor("05", List.of("x", 3));
        TestCursor right = new TestCursor("3A", List.of("x", 3));
        assertThat(comparator.compare(left, right)).isNegative();
        assertThat(comparator.compare(right, left)).isPositive();
    }

    @Test
    void mergeOrder() {
        List<TestCursor> cursors = new ArrayList<>(List.of(
                new TestCursor("C0", List.of(5)),
                new TestCursor("00", List.of(5)),
                new TestCursor("80", null),
                new TestCursor("40", List.of(3)),
                new TestCursor("20", null)));
        Collections.shuffle(cursors);
        PriorityQueue<PartitionCursor> queue = new PriorityQueue<>(ASCENDING);
        queue.addAll(cursors);
        List<String> order = new ArrayList<>();
        while (!queue.isEmpty()) {
            order.add(queue.poll().getPartitionKeyRange().getMinInclusive());
        }
        assertThat(order).containsExactly("40", "00", "C0", "20", "80");
    }

    @Test
    void mixedTypesAreRejected() {
        TestCursor number = new TestCursor("00", List.of(1));
        TestCursor string = new TestCursor("40", List.of("1"));
        assertThatThrownBy(() -> ASCENDING.compare(number, string))
                .isInstanceOf(QueryUnsupportedOperationException.class)
                .satisfies(ex -> assertThat(((QueryUnsupportedOperationException)ex).getLogInfo())
                        .containsEntry("left_type", ItemType.NUMBER)
                        .containsEntry("right_type", ItemType.STRING)
                        .containsEntry("value", "1"));
    }

    @Test
    void tupleComparisonAppliesGuard() {
        assertThatThrownBy(() -> ASCENDING.compareOrderByItems(List.of(1), List.of("1")))
                .isInstanceOf(QueryUnsupportedOperationException.class);
        assertThat(ASCENDING.compareOrderByItems(List.of(1), List.of(2))).isNegative();

        OrderByMergeComparator unguarded = new OrderByMergeComparator(OrderByMergeComparator.Config.newBuilder()
                .addSortOrder(SortOrder.DESCENDING)
                .setMixedTypeGuardEnabled(false)
                .build());
        assertThat(unguarded.compareOrderByItems(List.of(1), List.of("1"))).isPositive();
    }

    @Test
    void mismatchInLaterColumnIsRejected() {
        OrderByMergeComparator comparator = new OrderByMergeComparator(List.of(SortOrder.ASCENDING, SortOrder.ASCENDING));
        TestCursor cursor1 = new TestCursor("00", List.of(1, true));
        TestCursor cursor2 = new TestCursor("40", List.of(2, "true"));
        assertThatThrownBy(() -> comparator.compare(cursor1, cursor2))
                .isInstanceOf(QueryUnsupportedOperationException.class);
    }

    @Test
    void mixedTypesAllowedWithoutGuard() {
        OrderByMergeComparator comparator = new OrderByMergeComparator(OrderByMergeComparator.Config.newBuilder()
                .addSortOrder(SortOrder.ASCENDING)
                .setMixedTypeGuardEnabled(false)
                .build());
        TestCursor number = new TestCursor("40", List.of(1));
        TestCursor string = new TestCursor("00", List.of("1"));
        assertThat(comparator.compare(number, string)).isNegative();
    }

    @Test
    void guardFromProperties() {
        PipelinePropertyStorage properties = PipelinePropertyStorage.newBuilder()
                .addProp(QueryPipelineProperties.ORDER_BY_MIXED_TYPE_GUARD, false)
                .build();
        OrderByMergeComparator.Config config = OrderByMergeComparator.Config.fromProperties(properties,
                List.of(SortOrder.DESCENDING));
        assertThat(config.isMixedTypeGuardEnabled()).isFalse();
        assertThat(config.getSortOrders()).containsExactly(SortOrder.DESCENDING);

        OrderByMergeComparator.Config defaults = OrderByMergeComparator.Config.fromProperties(
                PipelinePropertyStorage.getEmptyInstance(), List.of(SortOrder.ASCENDING));
        assertThat(defaults.isMixedTypeGuardEnabled()).isTrue();
    }

    @Test
    void sortOrdersAreRequired() {
        assertThatThrownBy(() -> new OrderByMergeComparator((List<SortOrder>)null))
                .isInstanceOf(QueryCoreArgumentException.class);
        assertThatThrownBy(() -> new OrderByMergeComparator(List.of()))
                .isInstanceOf(QueryCoreArgumentException.class);
    }

    @Test
    void resultAndRangeAccessors() {
        OrderByQueryResult result = new OrderByQueryResult("rid-1", List.of(3), Map.of("id", "doc-1"));
        assertThat(result.getRid()).isEqualTo("rid-1");
        assertThat(result.getOrderByItems()).containsExactly(3);
        assertThat(result.getPayload()).isEqualTo(Map.of("id", "doc-1"));

        PartitionKeyRange range = new TestCursor("40", List.of(3)).getPartitionKeyRange();
        assertThat(range.getId()).isEqualTo("range-40");
        assertThat(range.getMinInclusive()).isEqualTo("40");
        assertThat(range.getMaxExclusive()).isEqualTo("40FF");
    }

    @Test
    void resultsRequireIdAndItems() {
        assertThatThrownBy(() -> new OrderByQueryResult("", List.of(1), null))
                .isInstanceOf(QueryCoreArgumentException.class);
        assertThatThrownBy(() -> new OrderByQueryResult("rid", List.of(), null))
                .isInstanceOf(QueryCoreArgumentException.class);
    }
}
