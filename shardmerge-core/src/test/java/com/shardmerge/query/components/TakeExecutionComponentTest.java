/*
 * TakeExecutionComponentTest.java
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

import com.shardmerge.query.BadRequestException;
import com.shardmerge.query.CancellationToken;
import com.shardmerge.query.ComponentTestUtils;
import com.shardmerge.query.ListExecutionComponent;
import com.shardmerge.query.QueryCancelledException;
import com.shardmerge.query.QueryExecutionComponent;
import com.shardmerge.query.QueryInvariantException;
import com.shardmerge.query.ResultBatch;
import com.shardmerge.query.continuation.ContinuationToken;
import com.shardmerge.query.continuation.TokenKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TakeExecutionComponentTest {
    private static List<Integer> items(int count) {
        return IntStream.range(0, count).boxed().collect(Collectors.toList());
    }

    @ParameterizedTest(name = "limitBound [sourceSize = {0}, pageSize = {1}]")
    @CsvSource({"10, 1", "10, 2", "10, 4", "10, 10", "3, 2", "2, 1", "2, 5", "0, 3"})
    void limitBound(int sourceSize, int pageSize) {
        QueryExecutionComponent<Integer> limit = TakeExecutionComponent.createLimit(3, null,
                ListExecutionComponent.factory(items(sourceSize), pageSize)).join();
        List<Integer> returned = new ArrayList<>();
        while (!limit.isDone()) {
            ResultBatch<Integer> page = limit.drain(100, new CancellationToken()).join();
            returned.addAll(page.getItems());
            assertThat(returned).hasSizeLessThanOrEqualTo(3);
            // done exactly when three items were returned or the source ran out
            assertEquals(returned.size() == 3 || returned.size() == sourceSize, limit.isDone());
        }
        assertEquals(items(Math.min(3, sourceSize)), returned);
    }

    @Test
    void limitContinuations() {
        QueryExecutionComponent<Integer> limit = TakeExecutionComponent.createLimit(3, null,
                ListExecutionComponent.factory(items(10), 2)).join();
        List<ResultBatch<Integer>> pages = ComponentTestUtils.drainAll(limit, 100);
        assertEquals(2, pages.size());
        assertEquals("{\"limit\":1,\"sourceToken\":\"2\"}", pages.get(0).getContinuation());
        assertNull(pages.get(1).getContinuation());
        assertThat(pages.get(1).getItems()).containsExactly(2);
    }

    @Test
    void topUsesItsOwnField() {
        QueryExecutionComponent<Integer> top = TakeExecutionComponent.createTop(3, null,
                ListExecutionComponent.factory(items(10), 2)).join();
        ResultBatch<Integer> page = top.drain(100, new CancellationToken()).join();
        assertEquals(new ContinuationToken(TokenKind.TOP, 1, "2"),
                ContinuationToken.parse(TokenKind.TOP, page.getContinuation()));
    }

    @Test
    void resumeFromContinuation() {
        String continuation = new ContinuationToken(TokenKind.LIMIT, 2, "5").toJson();
        QueryExecutionComponent<Integer> limit = TakeExecutionComponent.createLimit(4, continuation,
                ListExecutionComponent.factory(items(10), 3)).join();
        List<Integer> returned = ComponentTestUtils.items(ComponentTestUtils.drainAll(limit, 100));
        assertThat(returned).containsExactly(5, 6);
    }

    @Test
    void exhaustedAllowanceDoesNotDrainSource() {
        ListExecutionComponent<Integer> source = new ListExecutionComponent<>(items(10), "0", 4, null);
        QueryExecutionComponent<Integer> limit = TakeExecutionComponent.<Integer>createLimit(0, null,
                continuation -> CompletableFuture.completedFuture(source)).join();
        assertTrue(limit.isDone());
        assertThat(limit.drain(10, new CancellationToken()).join().getItems()).isEmpty();
        assertEquals(0, source.getDrainCount());
    }

    @Test
    void suppressedContinuationIsInherited() {
        QueryExecutionComponent<Integer> limit = TakeExecutionComponent.<Integer>createLimit(5, null,
                continuation -> CompletableFuture.completedFuture(
                        new ListExecutionComponent<>(items(10), "0", 2, continuation)
                                .setDisallowContinuationMessage("no continuations"))).join();
        ResultBatch<Integer> page = limit.drain(100, new CancellationToken()).join();
        assertThat(page.getItems()).containsExactly(0, 1);
        assertNull(page.getContinuation());
        assertEquals("no continuations", page.getDisallowContinuationMessage());
    }

    @ParameterizedTest
    @EnumSource(value = TokenKind.class, names = {"LIMIT", "TOP"})
    void tamperedTokenIsRejected(TokenKind kind) {
        String token = new ContinuationToken(kind, 9, null).toJson();
        assertThrows(BadRequestException.class,
                () -> TakeExecutionComponent.create(kind, 3, token, ListExecutionComponent.factory(items(10), 2)));
    }

    @Test
    void tokenOfOtherFlavorIsRejected() {
        String token = new ContinuationToken(TokenKind.TOP, 1, null).toJson();
        assertThrows(BadRequestException.class,
                () -> TakeExecutionComponent.createLimit(3, token, ListExecutionComponent.factory(items(10), 2)));
    }

    @Test
    void negativeCountIsRejected() {
        assertThrows(BadRequestException.class,
                () -> TakeExecutionComponent.createTop(-2, null, ListExecutionComponent.factory(items(10), 2)));
    }

    @Test
    void offsetIsNotATakeFlavor() {
        assertThrows(QueryInvariantException.class,
                () -> TakeExecutionComponent.create(TokenKind.OFFSET, 3, null, ListExecutionComponent.factory(items(10), 2)));
    }

    @Test
    void cancelledDrainReturnsNothing() {
        QueryExecutionComponent<Integer> limit = TakeExecutionComponent.createLimit(3, null,
                ListExecutionComponent.factory(items(10), 2)).join();
        CancellationToken token = new CancellationToken();
        token.cancel();
        ComponentTestUtils.assertFailsWith(limit.drain(2, token), QueryCancelledException.class);
        assertEquals(3, ((TakeExecutionComponent<Integer>)limit).getTakeCount());
        assertFalse(limit.isDone());
    }
}
