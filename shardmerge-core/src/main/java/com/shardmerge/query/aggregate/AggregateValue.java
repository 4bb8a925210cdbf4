/*
 * AggregateValue.java
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
import com.shardmerge.query.QueryInvariantException;
import com.shardmerge.query.Undefined;
import com.shardmerge.query.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * A partial aggregate value reported by one partition, decoded from its raw form.
 *
 * <p>
 * Partitions report partial aggregates as JSON-like values ({@link Map}, {@link Number}, {@link String},
 * {@link Boolean}, {@code null} or {@link Undefined}). Their shape depends on the operator:
 * </p>
 * <ul>
 *     <li>a raw number for {@link AggregateOperator#COUNT} and {@link AggregateOperator#SUM}</li>
 *     <li>{@code {"sum": ..., "count": ...}} for {@link AggregateOperator#AVERAGE}, where {@code sum} may be absent</li>
 *     <li>{@code {"min": ..., "max": ..., "count": ...}} or a raw value for {@link AggregateOperator#MIN} and
 *     {@link AggregateOperator#MAX}</li>
 * </ul>
 * <p>
 * {@link #decode} turns them into one of the {@link Kind}s once, so that aggregators never inspect shapes.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class AggregateValue {
    static final String SUM_FIELD = "sum";
    static final String COUNT_FIELD = "count";
    static final String MIN_FIELD = "min";
    static final String MAX_FIELD = "max";

    private static final AggregateValue UNDEFINED = new AggregateValue(Kind.UNDEFINED, null, null, Undefined.INSTANCE,
            Undefined.INSTANCE, 0L);

    /**
     * The shapes a partial aggregate value can take.
     */
    public enum Kind {
        UNDEFINED,
        SCALAR,
        PARTIAL_AVERAGE,
        PARTIAL_MIN_MAX,
    }

    @Nonnull
    private final Kind kind;
    @Nullable
    private final Object scalar;
    @Nullable
    private final WeightedAverage average;
    @Nullable
    private final Object min;
    @Nullable
    private final Object max;
    private final long count;

    private AggregateValue(@Nonnull Kind kind, @Nullable Object scalar, @Nullable WeightedAverage average,
                           @Nullable Object min, @Nullable Object max, long count) {
        this.kind = kind;
        this.scalar = scalar;
        this.average = average;
        this.min = min;
        this.max = max;
        this.count = count;
    }

    @Nonnull
    public static AggregateValue undefined() {
        return UNDEFINED;
    }

    @Nonnull
    public static AggregateValue scalar(@Nullable Object value) {
        if (Undefined.isUndefined(value)) {
            return UNDEFINED;
        }
        return new AggregateValue(Kind.SCALAR, value, null, Undefined.INSTANCE, Undefined.INSTANCE, 0L);
    }

    @Nonnull
    public static AggregateValue partialAverage(@Nonnull WeightedAverage average) {
        return new AggregateValue(Kind.PARTIAL_AVERAGE, null, average, Undefined.INSTANCE, Undefined.INSTANCE,
                average.getCount());
    }

    /**
     * Create a partial min/max value.
     * @param min the minimum seen by the partition, or {@link Undefined#INSTANCE} if it was not reported
     * @param max the maximum seen by the partition, or {@link Undefined#INSTANCE} if it was not reported
     * @param count the number of values the partition looked at
     * @return the partial value
     */
    @Nonnull
    public static AggregateValue partialMinMax(@Nullable Object min, @Nullable Object max, long count) {
        return new AggregateValue(Kind.PARTIAL_MIN_MAX, null, null, min, max, count);
    }

    /**
     * Decode a raw partial value reported for the given operator.
     * @param operator the operator the value was computed for
     * @param raw the raw value
     * @return the decoded value
     * @throws QueryInvariantException if the raw value does not have a shape the operator accepts. A {@code null}
     * count or sum is accepted and decodes to zero.
     */
    @Nonnull
    public static AggregateValue decode(@Nonnull AggregateOperator operator, @Nullable Object raw) {
        if (Undefined.isUndefined(raw)) {
            return UNDEFINED;
        }
        switch (operator) {
            case COUNT:
            case SUM:
                // a partition with nothing to count or add may report null
                if (raw == null) {
                    return scalar(0L);
                }
                if (!(raw instanceof Number)) {
                    throw invalidShape(operator, raw);
                }
                return scalar(raw);
            case AVERAGE:
                return decodeAverage(raw);
            case MIN:
            case MAX:
                if (raw instanceof Map<?, ?> && ((Map<?, ?>)raw).containsKey(COUNT_FIELD)) {
                    final Map<?, ?> partial = (Map<?, ?>)raw;
                    return partialMinMax(field(partial, MIN_FIELD), field(partial, MAX_FIELD),
                            count(operator, partial));
                }
                return scalar(raw);
            default:
                throw new QueryInvariantException("unknown aggregate operator",
                        LogMessageKeys.AGGREGATE_OPERATOR, operator);
        }
    }

    @Nonnull
    private static AggregateValue decodeAverage(@Nullable Object raw) {
        if (!(raw instanceof Map<?, ?>)) {
            throw invalidShape(AggregateOperator.AVERAGE, raw);
        }
        final Map<?, ?> partial = (Map<?, ?>)raw;
        final Object sum = field(partial, SUM_FIELD);
        final MaybeUndefined<Double> decodedSum;
        if (sum instanceof Number) {
            decodedSum = MaybeUndefined.defined(((Number)sum).doubleValue());
        } else if (sum == null || Undefined.isUndefined(sum)) {
            decodedSum = MaybeUndefined.undefined();
        } else {
            throw invalidShape(AggregateOperator.AVERAGE, raw);
        }
        return partialAverage(new WeightedAverage(decodedSum, count(AggregateOperator.AVERAGE, partial)));
    }

    @Nullable
    private static Object field(@Nonnull Map<?, ?> partial, @Nonnull String name) {
        return partial.containsKey(name) ? partial.get(name) : Undefined.INSTANCE;
    }

    private static long count(@Nonnull AggregateOperator operator, @Nonnull Map<?, ?> partial) {
        final Object count = partial.get(COUNT_FIELD);
        if (!(count instanceof Number) || ((Number)count).longValue() < 0) {
            throw invalidShape(operator, partial);
        }
        return ((Number)count).longValue();
    }

    @Nonnull
    private static QueryInvariantException invalidShape(@Nonnull AggregateOperator operator, @Nullable Object raw) {
        return new QueryInvariantException("partial aggregate value has an unexpected shape",
                LogMessageKeys.AGGREGATE_OPERATOR, operator,
                LogMessageKeys.ACTUAL_TYPE, raw == null ? "null" : raw.getClass().getSimpleName(),
                LogMessageKeys.VALUE, raw);
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    @Nullable
    public Object getScalar() {
        Preconditions.checkState(kind == Kind.SCALAR, "not a scalar value");
        return scalar;
    }

    @Nonnull
    public WeightedAverage getAverage() {
        Preconditions.checkState(average != null, "not a partial average");
        return average;
    }

    @Nullable
    public Object getMin() {
        return min;
    }

    @Nullable
    public Object getMax() {
        return max;
    }

    public long getCount() {
        return count;
    }

    @Override
    public String toString() {
        final MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(this).add("kind", kind);
        switch (kind) {
            case SCALAR:
                helper.add("value", scalar);
                break;
            case PARTIAL_AVERAGE:
                helper.add("average", average);
                break;
            case PARTIAL_MIN_MAX:
                helper.add("min", min).add("max", max).add("count", count);
                break;
            default:
                break;
        }
        return helper.toString();
    }
}
