/*
 * MinMaxAggregator.java
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

package com.shardmerge.query.aggregate;

import com.shardmerge.annotation.API;
import com.shardmerge.query.Undefined;
import com.shardmerge.query.orderby.ItemComparator;
import com.shardmerge.query.orderby.ItemType;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Keeps the smallest or largest value reported by partitions, ordered by {@link ItemComparator}.
 *
 * <p>
 * The running value starts at the sentinel on the far side of the direction ({@link ItemComparator#MAX_VALUE} for a
 * minimum), so the first real value always replaces it. An undefined partial, or one that is not a primitive,
 * poisons the aggregator: the result stays undefined from then on. Partials of the form {@code {min, max, count}}
 * with a count of zero come from empty ranges and are skipped.
 * </p>
 */
@API(API.Status.INTERNAL)
public class MinMaxAggregator implements Aggregator {
    private final boolean isMin;
    @Nullable
    private Object extremum;
    private boolean poisoned;

    private MinMaxAggregator(boolean isMin) {
        this.isMin = isMin;
        this.extremum = isMin ? ItemComparator.MAX_VALUE : ItemComparator.MIN_VALUE;
    }

    @Nonnull
    public static MinMaxAggregator min() {
        return new MinMaxAggregator(true);
    }

    @Nonnull
    public static MinMaxAggregator max() {
        return new MinMaxAggregator(false);
    }

    @Override
    public void aggregate(@Nonnull AggregateValue localValue) {
        if (poisoned) {
            return;
        }
        final Object value;
        switch (localValue.getKind()) {
            case UNDEFINED:
                poisoned = true;
                return;
            case PARTIAL_MIN_MAX:
                if (localValue.getCount() == 0) {
                    return;
                }
                value = isMin ? localValue.getMin() : localValue.getMax();
                break;
            case SCALAR:
                value = localValue.getScalar();
                break;
            default:
                poisoned = true;
                return;
        }
        if (Undefined.isUndefined(value)
                || !ItemType.isPrimitive(value)
                || !(ItemComparator.isSentinel(extremum) || ItemType.isPrimitive(extremum))) {
            poisoned = true;
            return;
        }
        final int comparison = ItemComparator.INSTANCE.compare(value, extremum);
        if (isMin ? comparison < 0 : comparison > 0) {
            extremum = value;
        }
    }

    @Nullable
    @Override
    public Object getResult() {
        if (poisoned || ItemComparator.isSentinel(extremum)) {
            return Undefined.INSTANCE;
        }
        return extremum;
    }

    @Nonnull
    @Override
    public AggregateOperator getOperator() {
        return isMin ? AggregateOperator.MIN : AggregateOperator.MAX;
    }
}
