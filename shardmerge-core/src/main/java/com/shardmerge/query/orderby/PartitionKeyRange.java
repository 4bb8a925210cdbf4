/*
 * PartitionKeyRange.java
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
import com.shardmerge.annotation.API;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * The interval of the key space owned by one partition. Lower bounds order partitions from left to right.
 */
@API(API.Status.UNSTABLE)
public final class PartitionKeyRange {
    @Nonnull
    private final String id;
    @Nonnull
    private final String minInclusive;
    @Nonnull
    private final String maxExclusive;

    public PartitionKeyRange(@Nonnull String id, @Nonnull String minInclusive, @Nonnull String maxExclusive) {
        this.id = id;
        this.minInclusive = minInclusive;
        this.maxExclusive = maxExclusive;
    }

    @Nonnull
    public String getId() {
        return id;
    }

    @Nonnull
    public String getMinInclusive() {
        return minInclusive;
    }

    @Nonnull
    public String getMaxExclusive() {
        return maxExclusive;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PartitionKeyRange that = (PartitionKeyRange)o;
        return id.equals(that.id) && minInclusive.equals(that.minInclusive) && maxExclusive.equals(that.maxExclusive);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, minInclusive, maxExclusive);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("range", "[" + minInclusive + ", " + maxExclusive + ")")
                .toString();
    }
}
