/*
 * LogMessageKeys.java
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

package com.shardmerge.query.logging;

import com.shardmerge.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Keys used in {@link KeyValueLogMessage}s and in the log info of {@link com.shardmerge.query.QueryCoreException}s.
 * Keeping them in one place makes collisions easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    MESSAGE,
    // continuation tokens
    CONTINUATION,
    TOKEN_KIND,
    TOKEN_COUNT,
    REQUESTED_COUNT,
    // components
    COMPONENT,
    ITEM_COUNT,
    PAGE_COUNT,
    REQUEST_CHARGE,
    // aggregation
    AGGREGATE_OPERATOR,
    AGGREGATE_COUNT,
    RESULT_COUNT,
    ACTUAL_TYPE,
    // order by
    SORT_ORDERS,
    COLUMN,
    LEFT_TYPE,
    RIGHT_TYPE,
    VALUE,
    // pipeline
    PIPELINE,
    PAGE_SIZE,
    PROPERTY,
    ;

    @Nonnull
    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return logKey;
    }
}
