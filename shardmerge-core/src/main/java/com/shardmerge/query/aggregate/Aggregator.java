/*
 * Aggregator.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Folds the partial values reported by partitions into one running aggregate.
 *
 * <p>
 * An aggregator belongs to a single query execution and is fed sequentially. The order in which partial values arrive
 * does not change the result.
 * </p>
 */
@API(API.Status.UNSTABLE)
public interface Aggregator {
    /**
     * Fold one partial value into the running aggregate.
     * @param localValue the partial value reported by a partition
     */
    void aggregate(@Nonnull AggregateValue localValue);

    /**
     * Get the aggregate of everything folded in so far. A {@code null} result is the null item value, as in the
     * minimum of a column whose smallest value is null.
     * @return the aggregate, or {@link com.shardmerge.query.Undefined#INSTANCE} if it has no defined value
     */
    @Nullable
    Object getResult();

    @Nonnull
    AggregateOperator getOperator();
}
