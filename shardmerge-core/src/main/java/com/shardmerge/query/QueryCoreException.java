/*
 * QueryCoreException.java
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

package com.shardmerge.query;

import com.shardmerge.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for failures raised by the query execution pipeline.
 *
 * <p>
 * Besides a message, every instance carries a set of key/value pairs describing the failure. These are meant to be
 * logged alongside the message (see {@link com.shardmerge.query.logging.KeyValueLogMessage}) so that failures can be
 * searched by, for example, the offending continuation token.
 * </p>
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class QueryCoreException extends RuntimeException {
    @Nullable
    private Map<String, Object> logInfo;

    /**
     * Create an exception with the given message and a flattened list of key/value pairs.
     *
     * @param msg error message
     * @param keyValues alternating keys and values
     * @throws IllegalArgumentException if {@code keyValues} has an odd number of elements
     */
    public QueryCoreException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public QueryCoreException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    /**
     * Add a single key/value pair to the log information.
     *
     * @param description the key
     * @param object the value
     * @return this exception
     */
    @Nonnull
    public QueryCoreException addLogInfo(@Nonnull String description, @Nullable Object object) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(description, object);
        return this;
    }

    /**
     * Add a flattened list of key/value pairs to the log information. Even elements are keys and each odd element is
     * the value of the key before it.
     *
     * @param keyValues alternating keys and values
     * @return this exception
     * @throws IllegalArgumentException if {@code keyValues} has an odd number of elements
     */
    @Nonnull
    public QueryCoreException addLogInfo(@Nonnull Object... keyValues) {
        if ((keyValues.length % 2) != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValues.length; i += 2) {
            addLogInfo(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return this;
    }

    @Nonnull
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    /**
     * Flatten the log information into alternating keys and values, in insertion order. The result is accepted by
     * {@link #addLogInfo(Object...)}.
     *
     * @return the flattened log information
     */
    @Nonnull
    public Object[] exportLogInfo() {
        if (logInfo == null) {
            return new Object[0];
        }
        Object[] exported = new Object[2 * logInfo.size()];
        int i = 0;
        for (Map.Entry<String, Object> entry : logInfo.entrySet()) {
            exported[i] = entry.getKey();
            exported[i + 1] = entry.getValue();
            i += 2;
        }
        return exported;
    }
}
