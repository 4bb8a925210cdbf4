/*
 * CancellationToken.java
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
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A cooperative cancellation signal shared by every component of one logical query execution.
 *
 * <p>
 * Components check the token at the start of each drain step. Once {@link #cancel()} has been called, the next check
 * fails the drain with a {@link QueryCancelledException}. Cancelling is idempotent and may be done from any thread.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class CancellationToken {
    /**
     * A token that can never be cancelled.
     */
    @Nonnull
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("the NONE cancellation token cannot be cancelled");
        }
    };

    @Nonnull
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * Throw if cancellation has been requested.
     * @throws QueryCancelledException if {@link #cancel()} has been called
     */
    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new QueryCancelledException("query execution was cancelled");
        }
    }
}
