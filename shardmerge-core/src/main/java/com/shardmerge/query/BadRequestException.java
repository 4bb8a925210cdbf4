/*
 * BadRequestException.java
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
 * Thrown when the request handed to a component cannot be honoured as given, most commonly because the supplied
 * continuation token is malformed or does not belong to the query it is replayed against. Retrying the same request
 * will fail the same way.
 */
@API(API.Status.UNSTABLE)
public class BadRequestException extends QueryCoreArgumentException {
    private static final long serialVersionUID = 1;

    public BadRequestException(@Nonnull String msg, @Nonnull Object... keyValue) {
        super(msg, keyValue);
    }

    public BadRequestException(@Nonnull String msg, @Nonnull Throwable cause) {
        super(msg, cause);
    }
}
