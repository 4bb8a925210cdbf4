/*
 * WeightedAverage.java
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

package com.shardmerge.query.aggregate;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.shardmerge.annotation.API;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * An average kept as a sum and a count so that averages of batches of different sizes combine correctly.
 * Counts always add up. The sum becomes undefined for good as soon as either side's sum is undefined.
 */
@API(API.Status.UNSTABLE)
public final class WeightedAverage {
    @Nonnull
    public static final WeightedAverage ZERO = new WeightedAverage(MaybeUndefined.defined(0.0), 0L);

    @Nonnull
    private final MaybeUndefined<Double> sum;
    private final long count;

    public WeightedAverage(@Nonnull MaybeUndefined<Double> sum, long count) {
        Preconditions.checkArgument(count >= 0, "count must not be negative");
        this.sum = sum;
        this.count = count;
    }

    @Nonnull
    public MaybeUndefined<Double> getSum() {
        return sum;
    }

    public long getCount() {
        return count;
    }

    @Nonnull
    public WeightedAverage add(@Nonnull WeightedAverage other) {
        return new WeightedAverage(sum.combine(other.sum, Double::sum), count + other.count);
    }

    /**
     * Compute the average.
     * @return {@code sum / count}, or undefined if the sum is undefined or nothing was counted
     */
    @Nonnull
    public MaybeUndefined<Double> getAverage() {
        if (!sum.isDefined() || count <= 0) {
            return MaybeUndefined.undefined();
        }
        return MaybeUndefined.defined(sum.get() / count);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        WeightedAverage that = (WeightedAverage)o;
        return count == that.count && sum.equals(that.sum);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sum, count);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("sum", sum)
                .add("count", count)
                .toString();
    }
}
