/*
 * Undefined.java
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

/**
 * The value of an aggregate that has no defined result, and of a field that is absent from an item.
 * It is distinct from {@code null}, which is a legitimate item value.
 */
@API(API.Status.UNSTABLE)
public final class Undefined {
    @Nonnull
    public static final Undefined INSTANCE = new Undefined();

    private Undefined() {
    }

    public static boolean isUndefined(Object value) {
        return value == INSTANCE;
    }

    @Override
    public String toString() {
        return "undefined";
    }
}
