/*
 * Aggregators.java
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

/**
 * Factory for {@link Aggregator}s.
 */
@API(API.Status.UNSTABLE)
public final class Aggregators {
    private Aggregators() {
    }

    /**
     * Create a fresh aggregator for the given operator.
     * @param operator the aggregate function
     * @return a new aggregator with no values folded in
     */
    @Nonnull
    public static Aggregator create(@Nonnull AggregateOperator operator) {
        switch (operator) {
            case AVERAGE:
                return new AverageAggregator();
            case COUNT:
                return new CountAggregator();
            case MAX:
                return MinMaxAggregator.max();
            case MIN:
                return MinMaxAggregator.min();
            case SUM:
                return new SumAggregator();
            default:
                throw new QueryInvariantException("unknown aggregate operator",
                        LogMessageKeys.AGGREGATE_OPERATOR, operator);
        }
    }
}
