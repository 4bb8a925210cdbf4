/*
 * ItemType.java
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
import com.shardmerge.query.QueryUnsupportedOperationException;
import com.shardmerge.query.Undefined;
import com.shardmerge.query.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Categories of the values that can be ordered. Declaration order is the order of the categories: any value of an
 * earlier category sorts before every value of a later one.
 */
@API(API.Status.UNSTABLE)
public enum ItemType {
    UNDEFINED,
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    ;

    /**
     * Whether the given value is a primitive, i.e., {@code null}, a boolean, a number or a string.
     * {@link Undefined} is not a primitive.
     * @param value the value to inspect
     * @return {@code true} if the value belongs to one of the primitive categories
     */
    public static boolean isPrimitive(@Nullable Object value) {
        return value == null || value instanceof Boolean || value instanceof Number || value instanceof String;
    }

    /**
     * Get the category of a value.
     * @param value an item value
     * @return the category of {@code value}
     * @throws QueryUnsupportedOperationException if the value is neither primitive nor {@link Undefined}
     */
    @Nonnull
    public static ItemType of(@Nullable Object value) {
        if (value == null) {
            return NULL;
        } else if (Undefined.isUndefined(value)) {
            return UNDEFINED;
        } else if (value instanceof Boolean) {
            return BOOLEAN;
        } else if (value instanceof Number) {
            return NUMBER;
        } else if (value instanceof String) {
            return STRING;
        }
        throw new QueryUnsupportedOperationException("value cannot be ordered",
                LogMessageKeys.ACTUAL_TYPE, value.getClass().getName());
    }
}
