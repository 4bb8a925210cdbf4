/*
 * CountAggregator.java
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
 * Adds up the counts reported by partitions. The result is always defined.
 */
@API(API.Status.INTERNAL)
public class CountAggregator implements Aggregator {
    private long count;

    @Override
    public void aggregate(@Nonnull AggregateValue localValue) {
        if (localValue.getKind() != AggregateValue.Kind.SCALAR) {
            throw new QueryInvariantException("count partial must be a number",
                    LogMessageKeys.ACTUAL_TYPE, localValue.getKind());
        }
        count += ((Number)localValue.getScalar()).longValue();
    }

    @Nullable
    @Override
    public Object getResult() {
        return count;
    }

    @Nonnull
    @Override
    public AggregateOperator getOperator() {
        return AggregateOperator.COUNT;
    }
}
