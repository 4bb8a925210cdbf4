/*
 * SortOrder.java
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

/**
 * The direction of one order-by column.
 */
@API(API.Status.UNSTABLE)
public enum SortOrder {
    ASCENDING,
    DESCENDING,
    ;

    /**
     * Orient a comparison result according to this direction.
     * @param comparison the result of an ascending comparison
     * @return {@code comparison} for ascending order, its negation for descending order
     */
    public int apply(int comparison) {
        return this == DESCENDING ? -comparison : comparison;
    }
}
