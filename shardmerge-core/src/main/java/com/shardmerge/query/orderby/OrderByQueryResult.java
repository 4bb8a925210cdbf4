/*
 * OrderByQueryResult.java
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

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.shardmerge.annotation.API;
import com.shardmerge.query.QueryCoreArgumentException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A row of an order-by query as returned by a partition: the id of the resource it came from, the values of the
 * order-by columns and the projected payload.
 */
@API(API.Status.UNSTABLE)
public final class OrderByQueryResult {
    @Nonnull
    private final String rid;
    @Nonnull
    private final List<Object> orderByItems;
    @Nullable
    private final Object payload;

    /**
     * Create a result.
     * @param rid the resource id, not empty
     * @param orderByItems one value per order-by column, not empty; values may be {@code null}
     * @param payload the projected row
     * @throws QueryCoreArgumentException if {@code rid} or {@code orderByItems} is empty
     */
    public OrderByQueryResult(@Nonnull String rid, @Nonnull List<?> orderByItems, @Nullable Object payload) {
        if (Strings.isNullOrEmpty(rid)) {
            throw new QueryCoreArgumentException("order by result must have a resource id");
        }
        if (orderByItems.isEmpty()) {
            throw new QueryCoreArgumentException("order by result must have at least one order by item");
        }
        this.rid = rid;
        this.orderByItems = Collections.unmodifiableList(new ArrayList<>(orderByItems));
        this.payload = payload;
    }

    @Nonnull
    public String getRid() {
        return rid;
    }

    @Nonnull
    public List<Object> getOrderByItems() {
        return orderByItems;
    }

    @Nullable
    public Object getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("rid", rid)
                .add("orderByItems", orderByItems)
                .toString();
    }
}
