/*
 * PartitionCursor.java
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

import com.shardmerge.annotation.API;

import javax.annotation.Nonnull;

/**
 * The view of a per-partition result stream that the order-by merge needs. Implementations are owned by the merge
 * driver; the comparator only reads them.
 */
@API(API.Status.UNSTABLE)
public interface PartitionCursor {
    boolean hasMoreResults();

    /**
     * Get the result the cursor is positioned on. Only valid while {@link #hasMoreResults()} is {@code true}.
     * @return the current result
     */
    @Nonnull
    OrderByQueryResult getCurrent();

    @Nonnull
    PartitionKeyRange getPartitionKeyRange();
}
