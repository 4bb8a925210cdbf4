/*
 * ItemComparator.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Comparator;

/**
 * Total order over item values. Values are ordered first by {@link ItemType} and then within their category:
 * {@code false} before {@code true}, numbers numerically, strings by UTF-16 code unit.
 *
 * <p>
 * Two sentinels, {@link #MIN_VALUE} and {@link #MAX_VALUE}, sort before and after every other value respectively.
 * They are used as the starting point of a running minimum or maximum.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class ItemComparator implements Comparator<Object> {
    @Nonnull
    public static final ItemComparator INSTANCE = new ItemComparator();

    /**
     * A value that is less than any other value.
     */
    @Nonnull
    public static final Object MIN_VALUE = new Sentinel("MIN_VALUE");
    /**
     * A value that is greater than any other value.
     */
    @Nonnull
    public static final Object MAX_VALUE = new Sentinel("MAX_VALUE");

    private ItemComparator() {
    }

    public static boolean isSentinel(@Nullable Object value) {
        return value == MIN_VALUE || value == MAX_VALUE;
    }

    @Override
    public int compare(@Nullable Object left, @Nullable Object right) {
        if (left == MIN_VALUE) {
            return right == MIN_VALUE ? 0 : -1;
        }
        if (left == MAX_VALUE) {
            return right == MAX_VALUE ? 0 : 1;
        }
        if (right == MIN_VALUE) {
            return 1;
        }
        if (right == MAX_VALUE) {
            return -1;
        }

        final ItemType leftType = ItemType.of(left);
        final ItemType rightType = ItemType.of(right);
        final int typeComparison = leftType.compareTo(rightType);
        if (typeComparison != 0) {
            return typeComparison;
        }
        switch (leftType) {
            case UNDEFINED:
            case NULL:
                return 0;
            case BOOLEAN:
                return Boolean.compare((Boolean)left, (Boolean)right);
            case NUMBER:
                return compareNumbers((Number)left, (Number)right);
            case STRING:
                return ((String)left).compareTo((String)right);
            default:
                throw new IllegalStateException("unknown item type " + leftType);
        }
    }

    // Zeros of either sign are equal.
    private static int compareNumbers(@Nonnull Number left, @Nonnull Number right) {
        final double leftValue = left.doubleValue();
        final double rightValue = right.doubleValue();
        if (leftValue == rightValue) {
            return 0;
        }
        return Double.compare(leftValue, rightValue);
    }

    private static final class Sentinel {
        @Nonnull
        private final String name;

        private Sentinel(@Nonnull String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
