/*
 * QueryPipelineProperties.java
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

package com.shardmerge.query.properties;

import com.shardmerge.annotation.API;
import com.shardmerge.query.QueryInvariantException;

/**
 * Property keys understood by the execution pipeline.
 */
@API(API.Status.EXPERIMENTAL)
public final class QueryPipelineProperties {
    /**
     * Whether the order-by merge comparator checks that the order-by values of the two partitions being compared
     * have the same types, column by column. Cross-partition merges cannot order values of different types the way a
     * single partition's index would, so the check fails the query instead of returning a wrong order. Turning it off
     * is only meant for tests over heterogeneous data.
     */
    public static final PipelinePropertyKey<Boolean> ORDER_BY_MIXED_TYPE_GUARD = PipelinePropertyKey.booleanPropertyKey(
            "com.shardmerge.query.orderby.mixed_type_guard", true);

    /**
     * The page size the aggregate component asks its source for on each step of its full drain.
     */
    public static final PipelinePropertyKey<Integer> AGGREGATE_DRAIN_PAGE_SIZE = PipelinePropertyKey.integerPropertyKey(
            "com.shardmerge.query.aggregate.drain_page_size", Integer.MAX_VALUE);

    private QueryPipelineProperties() {
        throw new QueryInvariantException("should not instantiate class of static prop");
    }
}
