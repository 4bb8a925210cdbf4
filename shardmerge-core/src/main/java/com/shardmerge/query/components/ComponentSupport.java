/*
 * ComponentSupport.java
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

package com.shardmerge.query.components;

import com.shardmerge.annotation.API;
import com.shardmerge.query.BadRequestException;
import com.shardmerge.query.CancellationToken;
import com.shardmerge.query.QueryCancelledException;
import com.shardmerge.query.logging.KeyValueLogMessage;
import com.shardmerge.query.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.concurrent.CompletableFuture;

/**
 * Checks shared by the components of this package.
 */
@API(API.Status.INTERNAL)
final class ComponentSupport {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(ComponentSupport.class);

    private ComponentSupport() {
    }

    /**
     * Get a failed future if cancellation has been requested.
     * @param component the component about to drain
     * @param cancellationToken the token of the current query
     * @param <R> the type of the future
     * @return a future failed with a {@link QueryCancelledException}, or {@code null} if the drain may go ahead
     */
    @Nullable
    static <R> CompletableFuture<R> checkCancellation(@Nonnull Object component,
                                                      @Nonnull CancellationToken cancellationToken) {
        if (!cancellationToken.isCancellationRequested()) {
            return null;
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("drain cancelled",
                    LogMessageKeys.COMPONENT, component.getClass().getSimpleName()));
        }
        return CompletableFuture.failedFuture(new QueryCancelledException("query execution was cancelled",
                LogMessageKeys.COMPONENT, component.getClass().getSimpleName()));
    }

    static void checkCount(@Nonnull String name, int count) {
        if (count < 0) {
            throw new BadRequestException(name + " count must not be negative",
                    LogMessageKeys.REQUESTED_COUNT, count);
        }
    }
}
