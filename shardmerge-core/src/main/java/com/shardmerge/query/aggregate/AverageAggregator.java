/*
 * AverageAggregator.java
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
import com.shardmerge.query.QueryInvariantException;
import com.shardmerge.query.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Combines the {@code {sum, count}} partials reported by partitions into a {@link WeightedAverage}.
 * An undefined partial makes the sum undefined without adding to the count.
 */
@API(API.Status.INTERNAL)
public class AverageAggregator implements Aggregator {
    private static final WeightedAverage UNDEFINED_PARTIAL = new WeightedAverage(MaybeUndefined.undefined(), 0L);

    @Nonnull
    private WeightedAverage state = WeightedAverage.ZERO;

    @Override
    public void aggregate(@Nonnull AggregateValue localValue) {
        switch (localValue.getKind()) {
            case UNDEFINED:
                state = state.add(UNDEFINED_PARTIAL);
                break;
            case PARTIAL_AVERAGE:
                state = state.add(localValue.getAverage());
                break;
            default:
                throw new QueryInvariantException("average partial must be a sum and a count",
                        LogMessageKeys.ACTUAL_TYPE, localValue.getKind());
        }
    }

    @Nullable
    @Override
    public Object getResult() {
        return state.getAverage().toResult();
    }

    @Nonnull
    public WeightedAverage getState() {
        return state;
    }

    @Nonnull
    @Override
    public AggregateOperator getOperator() {
        return AggregateOperator.AVERAGE;
    }
}
