/*
 * OrderByMergeComparator.java
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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.shardmerge.annotation.API;
import com.shardmerge.query.QueryCoreArgumentException;
import com.shardmerge.query.QueryInvariantException;
import com.shardmerge.query.QueryUnsupportedOperationException;
import com.shardmerge.query.logging.LogMessageKeys;
import com.shardmerge.query.properties.PipelinePropertyStorage;
import com.shardmerge.query.properties.QueryPipelineProperties;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders partition cursors for a k-way merge of order-by results, so that the cursor sorting first holds the next
 * result of the merged stream.
 *
 * <p>
 * Cursors with results sort before exhausted ones, and exhausted cursors are ordered by the lower bound of their
 * partition range. Cursors with results are ordered by the order-by values of their current results, column by column
 * in the configured directions; ties are broken by partition range lower bound, so the leftmost partition wins.
 * </p>
 *
 * <p>
 * When the mixed-type guard is enabled, the order-by values of both cursors must have the same {@link ItemType} in
 * every column. Otherwise the comparison fails with a {@link QueryUnsupportedOperationException}.
 * </p>
 *
 * <p>
 * Instances are immutable and may be shared between threads.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class OrderByMergeComparator implements Comparator<PartitionCursor> {
    @Nonnull
    private final Config config;

    public OrderByMergeComparator(@Nonnull Config config) {
        this.config = config;
    }

    public OrderByMergeComparator(@Nullable List<SortOrder> sortOrders) {
        this(Config.newBuilder().setSortOrders(sortOrders).build());
    }

    @Nonnull
    public Config getConfig() {
        return config;
    }

    @Override
    public int compare(@Nonnull PartitionCursor cursor1, @Nonnull PartitionCursor cursor2) {
        if (cursor1 == cursor2) {
            return 0;
        }
        final boolean hasMore1 = cursor1.hasMoreResults();
        final boolean hasMore2 = cursor2.hasMoreResults();
        if (hasMore1 != hasMore2) {
            return hasMore1 ? -1 : 1;
        }
        if (!hasMore1) {
            return comparePartitionRanges(cursor1, cursor2);
        }

        final List<Object> items1 = cursor1.getCurrent().getOrderByItems();
        final List<Object> items2 = cursor2.getCurrent().getOrderByItems();
        final int comparison = compareOrderByItems(items1, items2);
        if (comparison != 0) {
            return comparison;
        }
        return comparePartitionRanges(cursor1, cursor2);
    }

    /**
     * Compare two order-by tuples column by column in the configured directions. When the mixed-type guard is
     * enabled, the tuples must hold values of the same {@link ItemType} in every sort column.
     * @param items1 the order-by values of the first result
     * @param items2 the order-by values of the second result
     * @return the oriented result of the first column that differs, or 0
     * @throws QueryInvariantException if either tuple has fewer values than there are sort columns
     * @throws QueryUnsupportedOperationException if the guard is enabled and a column mixes types
     */
    public int compareOrderByItems(@Nonnull List<Object> items1, @Nonnull List<Object> items2) {
        checkColumnCount(items1);
        checkColumnCount(items2);
        if (config.isMixedTypeGuardEnabled()) {
            checkTypeMatching(items1, items2);
        }
        final List<SortOrder> sortOrders = config.getSortOrders();
        for (int i = 0; i < sortOrders.size(); i++) {
            final int comparison = ItemComparator.INSTANCE.compare(items1.get(i), items2.get(i));
            if (comparison != 0) {
                return sortOrders.get(i).apply(comparison);
            }
        }
        return 0;
    }

    private void checkColumnCount(@Nonnull List<Object> items) {
        if (items.size() < config.getSortOrders().size()) {
            throw new QueryInvariantException("order by result has fewer values than sort columns",
                    LogMessageKeys.ITEM_COUNT, items.size(),
                    LogMessageKeys.SORT_ORDERS, config.getSortOrders());
        }
    }

    private void checkTypeMatching(@Nonnull List<Object> items1, @Nonnull List<Object> items2) {
        for (int i = 0; i < config.getSortOrders().size(); i++) {
            final ItemType type1 = ItemType.of(items1.get(i));
            final ItemType type2 = ItemType.of(items2.get(i));
            if (type1 != type2) {
                throw new QueryUnsupportedOperationException("order by values of different types cannot be merged across partitions",
                        LogMessageKeys.COLUMN, i,
                        LogMessageKeys.LEFT_TYPE, type1,
                        LogMessageKeys.RIGHT_TYPE, type2,
                        LogMessageKeys.VALUE, items2.get(i));
            }
        }
    }

    private static int comparePartitionRanges(@Nonnull PartitionCursor cursor1, @Nonnull PartitionCursor cursor2) {
        return Integer.signum(cursor1.getPartitionKeyRange().getMinInclusive()
                .compareTo(cursor2.getPartitionKeyRange().getMinInclusive()));
    }

    /**
     * Configuration of an {@link OrderByMergeComparator}.
     */
    public static final class Config {
        @Nonnull
        private final List<SortOrder> sortOrders;
        private final boolean mixedTypeGuardEnabled;

        private Config(@Nonnull List<SortOrder> sortOrders, boolean mixedTypeGuardEnabled) {
            this.sortOrders = sortOrders;
            this.mixedTypeGuardEnabled = mixedTypeGuardEnabled;
        }

        @Nonnull
        public List<SortOrder> getSortOrders() {
            return sortOrders;
        }

        public boolean isMixedTypeGuardEnabled() {
            return mixedTypeGuardEnabled;
        }

        @Nonnull
        public static Builder newBuilder() {
            return new Builder();
        }

        /**
         * Create a configuration whose guard setting comes from
         * {@link QueryPipelineProperties#ORDER_BY_MIXED_TYPE_GUARD}.
         * @param properties the pipeline properties
         * @param sortOrders the directions of the order-by columns
         * @return the configuration
         */
        @Nonnull
        public static Config fromProperties(@Nonnull PipelinePropertyStorage properties,
                                            @Nullable List<SortOrder> sortOrders) {
            final Boolean guard = properties.getPropertyValue(QueryPipelineProperties.ORDER_BY_MIXED_TYPE_GUARD);
            return newBuilder()
                    .setSortOrders(sortOrders)
                    .setMixedTypeGuardEnabled(guard == null || guard)
                    .build();
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("sortOrders", sortOrders)
                    .add("mixedTypeGuardEnabled", mixedTypeGuardEnabled)
                    .toString();
        }

        /**
         * Builder for {@link Config}.
         */
        public static class Builder {
            @Nullable
            private List<SortOrder> sortOrders;
            private boolean mixedTypeGuardEnabled = true;

            private Builder() {
            }

            @Nonnull
            public Builder setSortOrders(@Nullable List<SortOrder> sortOrders) {
                this.sortOrders = sortOrders == null ? null : new ArrayList<>(sortOrders);
                return this;
            }

            @Nonnull
            public Builder addSortOrder(@Nonnull SortOrder sortOrder) {
                if (sortOrders == null) {
                    sortOrders = new ArrayList<>();
                }
                sortOrders.add(sortOrder);
                return this;
            }

            @Nonnull
            public Builder setMixedTypeGuardEnabled(boolean mixedTypeGuardEnabled) {
                this.mixedTypeGuardEnabled = mixedTypeGuardEnabled;
                return this;
            }

            /**
             * Build the configuration.
             * @return the configuration
             * @throws QueryCoreArgumentException if no sort order was given
             */
            @Nonnull
            public Config build() {
                if (sortOrders == null || sortOrders.isEmpty()) {
                    throw new QueryCoreArgumentException("order by merge requires at least one sort order");
                }
                return new Config(ImmutableList.copyOf(sortOrders), mixedTypeGuardEnabled);
            }
        }
    }
}
