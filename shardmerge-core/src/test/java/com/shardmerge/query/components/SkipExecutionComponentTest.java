/*
 * SkipExecutionComponentTest.java
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
import com.shardmerge.query.ResultBatch;
import com.shardmerge.query.continuation.ContinuationToken;
import com.shardmerge.query.continuation.TokenKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SkipExecutionComponentTest {
    private static final List<Integer> TWELVE = IntStream.range(0, 12).boxed().collect(Collectors.toList());

    @Test
    void skipAcrossBatches() {
        QueryExecutionComponent<Integer> skip = SkipExecutionComponent.create(5, null,
                ListExecutionComponent.factory(TWELVE, 4)).join();

        List<ResultBatch<Integer>> pages = ComponentTestUtils.drainAll(skip, 100);
        assertEquals(3, pages.size());
        assertThat(pages.get(0).getItems(), empty());
        assertThat(pages.get(1).getItems(), contains(5, 6, 7));
        assertThat(pages.get(2).getItems(), contains(8, 9, 10, 11));
        assertEquals(TWELVE.subList(5, 12), ComponentTestUtils.items(pages));

        ContinuationToken first = ContinuationToken.parse(TokenKind.OFFSET, pages.get(0).getContinuation());
        ContinuationToken second = ContinuationToken.parse(TokenKind.OFFSET, pages.get(1).getContinuation());
        assertEquals(new ContinuationToken(TokenKind.OFFSET, 1, "4"), first);
        assertEquals(new ContinuationToken(TokenKind.OFFSET, 0, "8"), second);
        assertThat(second.getRemaining(), lessThan(first.getRemaining()));
        assertNull(pages.get(2).getContinuation());
    }

    @Test
    void skipCountDropsPageByPage() {
        SkipExecutionComponent<Integer> skip = (SkipExecutionComponent<Integer>)SkipExecutionComponent.create(5, null,
                ListExecutionComponent.factory(TWELVE, 4)).join();
        assertEquals(5, skip.getSkipCount());
        skip.drain(100, new CancellationToken()).join();
        assertEquals(1, skip.getSkipCount());
        skip.drain(100, new CancellationToken()).join();
        assertEquals(0, skip.getSkipCount());
        skip.drain(100, new CancellationToken()).join();
        assertEquals(0, skip.getSkipCount());
        assertTrue(skip.isDone());
    }

    @Test
    void resumeFromEveryContinuation() {
        final List<Integer> actual = new ArrayList<>();
        String continuation = null;
        int pages = 0;
        do {
            QueryExecutionComponent<Integer> skip = SkipExecutionComponent.create(5, continuation,
                    ListExecutionComponent.factory(TWELVE, 4)).join();
            ResultBatch<Integer> page = skip.drain(100, new CancellationToken()).join();
            actual.addAll(page.getItems());
            continuation = page.getContinuation();
            pages++;
        } while (continuation != null);
        assertEquals(3, pages);
        assertEquals(TWELVE.subList(5, 12), actual);
    }

    @Test
    void offsetBeyondSource() {
        QueryExecutionComponent<Integer> skip = SkipExecutionComponent.create(20, null,
                ListExecutionComponent.factory(TWELVE, 5)).join();
        List<ResultBatch<Integer>> pages = ComponentTestUtils.drainAll(skip, 100);
        assertThat(ComponentTestUtils.items(pages), empty());
        assertTrue(skip.isDone());
        assertNull(pages.get(pages.size() - 1).getContinuation());
    }

    @Test
    void zeroOffsetPassesEverythingThrough() {
        QueryExecutionComponent<Integer> skip = SkipExecutionComponent.create(0, null,
                ListExecutionComponent.factory(TWELVE, 12)).join();
        assertEquals(TWELVE, ComponentTestUtils.items(ComponentTestUtils.drainAll(skip, 100)));
    }

    @Test
    void metadataIsCarriedThrough() {
        QueryExecutionComponent<Integer> skip = SkipExecutionComponent.create(2, null,
                ListExecutionComponent.factory(TWELVE, 3)).join();
        ResultBatch<Integer> page = skip.drain(100, new CancellationToken()).join();
        assertThat(page.getItems(), contains(2));
        assertEquals(1.0, page.getRequestCharge());
        assertEquals(30L, page.getResponseLengthBytes());
        assertEquals(1, page.getContactedReplicas().size());
        assertEquals(3L, page.getQueryMetrics().get("0").getRetrievedDocumentCount());
        assertEquals(3L, skip.getQueryMetrics().total().getOutputDocumentCount());
    }

    @Test
    void suppressedContinuationIsInherited() {
        QueryExecutionComponent<Integer> skip = SkipExecutionComponent.<Integer>create(1, null,
                continuation -> CompletableFuture.completedFuture(
                        new ListExecutionComponent<>(TWELVE, "0", 4, continuation)
                                .setDisallowContinuationMessage("continuations are disabled"))).join();
        ResultBatch<Integer> page = skip.drain(100, new CancellationToken()).join();
        assertThat(page.getItems(), contains(1, 2, 3));
        assertTrue(page.isContinuationSuppressed());
        assertEquals("continuations are disabled", page.getDisallowContinuationMessage());
        assertNull(page.getContinuation());
        assertFalse(skip.isDone());
    }

    @Test
    void tamperedTokenIsRejected() {
        String token = new ContinuationToken(TokenKind.OFFSET, 5, "4").toJson();
        assertThrows(BadRequestException.class,
                () -> SkipExecutionComponent.create(3, token, ListExecutionComponent.factory(TWELVE, 4)));
    }

    @Test
    void malformedTokenIsRejected() {
        assertThrows(BadRequestException.class,
                () -> SkipExecutionComponent.create(3, "{offset", ListExecutionComponent.factory(TWELVE, 4)));
    }

    @Test
    void negativeOffsetIsRejected() {
        assertThrows(BadRequestException.class,
                () -> SkipExecutionComponent.create(-1, null, ListExecutionComponent.factory(TWELVE, 4)));
    }

    @Test
    void sourceIsCreatedFromEmbeddedToken() {
        AtomicReference<String> sourceContinuation = new AtomicReference<>();
        SkipExecutionComponent.<Integer>create(2, new ContinuationToken(TokenKind.OFFSET, 1, "8").toJson(), continuation -> {
            sourceContinuation.set(continuation);
            return CompletableFuture.completedFuture(new ListExecutionComponent<>(TWELVE, "0", 4, continuation));
        }).join();
        assertEquals("8", sourceContinuation.get());
    }

    @Test
    void cancelledDrainReturnsNothing() {
        ListExecutionComponent<Integer> source = new ListExecutionComponent<>(TWELVE, "0", 4, null);
        QueryExecutionComponent<Integer> skip = SkipExecutionComponent.<Integer>create(1, null,
                continuation -> CompletableFuture.completedFuture(source)).join();
        CancellationToken token = new CancellationToken();
        token.cancel();
        QueryCancelledException ex = ComponentTestUtils.assertFailsWith(skip.drain(4, token), QueryCancelledException.class);
        assertNotNull(ex.getMessage());
        assertEquals(0, source.getDrainCount());
    }

    @Test
    void lifecycleIsForwarded() {
        ListExecutionComponent<Integer> source = new ListExecutionComponent<>(TWELVE, "0", 4, null);
        QueryExecutionComponent<Integer> skip = SkipExecutionComponent.<Integer>create(1, null,
                continuation -> CompletableFuture.completedFuture(source)).join();
        assertEquals(source.getExecutor(), skip.getExecutor());
        skip.stop();
        assertTrue(source.isStopped());
        skip.close();
        assertTrue(source.isClosed());
    }
}
