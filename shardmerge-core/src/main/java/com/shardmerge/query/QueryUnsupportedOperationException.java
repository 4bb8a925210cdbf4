/*
 * QueryUnsupportedOperationException.java
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
 * Functional equivalent of <code>UnsupportedOperationException</code>: the request is well formed but asks for
 * something the pipeline cannot do, like merging an order-by over values of different types.
 */
@API(API.Status.UNSTABLE)
public class QueryUnsupportedOperationException extends QueryCoreException {
    private static final long serialVersionUID = 1;

    public QueryUnsupportedOperationException(@Nonnull String msg, @Nonnull Object... keyValue) {
        super(msg, keyValue);
    }
}
