/*
 * AggregateValueTest.java
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

import com.shardmerge.query.QueryInvariantException;
import com.shardmerge.query.Undefined;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AggregateValueTest {
    @ParameterizedTest
    @EnumSource(AggregateOperator.class)
    void undefinedDecodesToUndefined(AggregateOperator operator) {
        assertEquals(AggregateValue.Kind.UNDEFINED, AggregateValue.decode(operator, Undefined.INSTANCE).getKind());
    }

    @Test
    void countAndSumAreScalars() {
        AggregateValue count = AggregateValue.decode(AggregateOperator.COUNT, 7L);
        assertEquals(AggregateValue.Kind.SCALAR, count.getKind());
        assertEquals(7L, count.getScalar());

        AggregateValue sum = AggregateValue.decode(AggregateOperator.SUM, 2.5);
        assertEquals(AggregateValue.Kind.SCALAR, sum.getKind());
        assertEquals(2.5, sum.getScalar());
    }

    @Test
    void nonNumericSumIsRejected() {
        assertThrows(QueryInvariantException.class, () -> AggregateValue.decode(AggregateOperator.SUM, "3"));
        assertThrows(QueryInvariantException.class, () -> AggregateValue.decode(AggregateOperator.COUNT, List.of(1)));
    }

    @Test
    void nullCountAndSumDecodeToZero() {
        AggregateValue count = AggregateValue.decode(AggregateOperator.COUNT, null);
        assertEquals(AggregateValue.Kind.SCALAR, count.getKind());
        assertEquals(0L, count.getScalar());

        Aggregator sum = Aggregators.create(AggregateOperator.SUM);
        sum.aggregate(AggregateValue.decode(AggregateOperator.SUM, 2.5));
        sum.aggregate(AggregateValue.decode(AggregateOperator.SUM, null));
        assertEquals(2.5, sum.getResult());

        Aggregator counter = Aggregators.create(AggregateOperator.COUNT);
        counter.aggregate(AggregateValue.decode(AggregateOperator.COUNT, 3L));
        counter.aggregate(AggregateValue.decode(AggregateOperator.COUNT, null));
        assertEquals(3L, counter.getResult());
    }

    @Test
    void averagePartial() {
        AggregateValue value = AggregateValue.decode(AggregateOperator.AVERAGE, Map.of("sum", 10, "count", 2));
        assertEquals(AggregateValue.Kind.PARTIAL_AVERAGE, value.getKind());
        assertEquals(new WeightedAverage(MaybeUndefined.defined(10.0), 2), value.getAverage());
    }

    @Test
    void averagePartialWithoutSum() {
        AggregateValue value = AggregateValue.decode(AggregateOperator.AVERAGE, Map.of("count", 4));
        assertFalse(value.getAverage().getSum().isDefined());
        assertEquals(4, value.getAverage().getCount());

        Map<String, Object> nullSum = new HashMap<>();
        nullSum.put("sum", null);
        nullSum.put("count", 1);
        assertFalse(AggregateValue.decode(AggregateOperator.AVERAGE, nullSum).getAverage().getSum().isDefined());
    }

    @Test
    void averagePartialMustHaveCount() {
        assertThrows(QueryInvariantException.class,
                () -> AggregateValue.decode(AggregateOperator.AVERAGE, Map.of("sum", 10)));
        assertThrows(QueryInvariantException.class,
                () -> AggregateValue.decode(AggregateOperator.AVERAGE, Map.of("sum", 10, "count", -1)));
        assertThrows(QueryInvariantException.class,
                () -> AggregateValue.decode(AggregateOperator.AVERAGE, 10));
    }

    @Test
    void minMaxPartial() {
        AggregateValue value = AggregateValue.decode(AggregateOperator.MIN, Map.of("min", "a", "count", 3));
        assertEquals(AggregateValue.Kind.PARTIAL_MIN_MAX, value.getKind());
        assertEquals("a", value.getMin());
        assertSame(Undefined.INSTANCE, value.getMax());
        assertEquals(3, value.getCount());
    }

    @Test
    void minMaxPartialWithNullValue() {
        Map<String, Object> partial = new HashMap<>();
        partial.put("max", null);
        partial.put("count", 1);
        AggregateValue value = AggregateValue.decode(AggregateOperator.MAX, partial);
        assertNull(value.getMax());
    }

    @Test
    void minMaxRawValues() {
        assertEquals(AggregateValue.Kind.SCALAR, AggregateValue.decode(AggregateOperator.MAX, 5).getKind());
        assertEquals(AggregateValue.Kind.SCALAR, AggregateValue.decode(AggregateOperator.MAX, null).getKind());
        // an object without a count is a value, not a partial
        AggregateValue object = AggregateValue.decode(AggregateOperator.MIN, Map.of("min", 1));
        assertEquals(AggregateValue.Kind.SCALAR, object.getKind());
        assertEquals(AggregateValue.Kind.SCALAR, AggregateValue.decode(AggregateOperator.MIN, List.of(1, 2)).getKind());
    }
}
