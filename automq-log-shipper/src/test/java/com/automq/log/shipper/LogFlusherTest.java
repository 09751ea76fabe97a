/*
 * Copyright 2025, AutoMQ HK Limited.
 *
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.automq.log.shipper;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(60)
@Tag("LogShipperUnit")
public class LogFlusherTest {
    private static final String GROUP = "/automq/test";
    private static final String STREAM = "broker-2025-01-02-03-UTC";

    private MockLogSinkClient client;
    private LogEventQueue queue;
    private LogStreamNameProvider streamNameProvider;
    private LogFlusher flusher;

    @BeforeEach
    public void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-02T03:04:05Z"), ZoneOffset.UTC);
        client = new MockLogSinkClient();
        queue = new LogEventQueue(clock);
        streamNameProvider = new LogStreamNameProvider(client, GROUP, "broker", clock);
        flusher = new LogFlusher(queue, streamNameProvider, client, GROUP, 50);
    }

    @AfterEach
    public void tearDown() {
        flusher.close();
    }

    private List<String> messages(List<LogEvent> events) {
        return events.stream().map(LogEvent::message).collect(Collectors.toList());
    }

    @Test
    public void testInvalidInterval() {
        assertThrows(IllegalArgumentException.class, () -> new LogFlusher(queue, streamNameProvider, client, GROUP, 0));
    }

    @Test
    public void testFlushEmptyQueue() {
        assertEquals(0, flusher.flush());
        assertTrue(client.describeCalls.isEmpty());
        assertTrue(client.putCalls.isEmpty());
    }

    @Test
    public void testFlushDrainsAllBatches() {
        String large = "x".repeat(400_000);
        List<String> added = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            queue.add(large + i);
            added.add(large + i);
        }

        assertEquals(5, flusher.flush());

        assertEquals(3, client.putCalls.size());
        assertEquals(added, messages(client.shippedEvents()));
        client.putCalls.forEach(call -> {
            assertEquals(GROUP, call.logGroupName);
            assertEquals(STREAM, call.logStreamName);
        });
        assertEquals(List.of(STREAM), client.describeCalls);
        assertEquals(List.of(STREAM), client.createCalls);
        assertEquals(0, queue.size());
    }

    @Test
    public void testStreamCheckedOnceAcrossFlushes() {
        queue.add("message 1");
        flusher.flush();
        queue.add("message 2");
        flusher.flush();

        assertEquals(2, client.putCalls.size());
        assertEquals(1, client.describeCalls.size());
        assertEquals(1, client.createCalls.size());
    }

    @Test
    public void testPutFailureDropsBatchAndKeepsRest() {
        String large = "x".repeat(600_000);
        queue.add(large + 0);
        queue.add(large + 1);
        client.failNextPuts.set(1);

        assertEquals(0, flusher.flush());
        assertTrue(client.putCalls.isEmpty());
        assertEquals(1, queue.size());

        assertEquals(1, flusher.flush());
        assertEquals(List.of(large + 1), messages(client.shippedEvents()));
        assertEquals(0, queue.size());
    }

    @Test
    public void testDescribeFailureAbortsCycle() {
        queue.add("message 1");
        client.failNextDescribes.set(1);

        assertEquals(0, flusher.flush());
        assertTrue(client.putCalls.isEmpty());
        assertEquals(0, queue.size());
        assertFalse(streamNameProvider.isCached(STREAM));

        queue.add("message 2");
        assertEquals(1, flusher.flush());
        assertEquals(List.of("message 2"), messages(client.shippedEvents()));
        assertEquals(2, client.describeCalls.size());
    }

    @Test
    public void testScheduledFlush() {
        flusher.start();
        queue.add("message 1");
        queue.add("message 2");

        await().atMost(Duration.ofSeconds(10))
            .until(() -> client.shippedEvents().size() == 2);
        assertEquals(List.of("message 1", "message 2"), messages(client.shippedEvents()));

        queue.add("message 3");
        await().atMost(Duration.ofSeconds(10))
            .until(() -> client.shippedEvents().size() == 3);
    }

    @Test
    public void testRestartReplacesSchedule() {
        flusher.start();
        flusher.start();
        queue.add("message 1");

        await().atMost(Duration.ofSeconds(10)).until(() -> client.shippedEvents().size() == 1);
        assertEquals(1, client.putCalls.size());
    }

    @Test
    public void testConcurrentFlushesAreSerialized() throws Exception {
        client.putLatencyMs = 5;
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 4; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    startLatch.await();
                    int shipped = 0;
                    for (int i = 0; i < 50; i++) {
                        queue.add("thread " + thread + " message " + i);
                        shipped += flusher.flush();
                    }
                    return shipped;
                }));
            }
            startLatch.countDown();
            int shipped = 0;
            for (Future<Integer> future : futures) {
                shipped += future.get();
            }
            shipped += flusher.flush();

            assertEquals(200, shipped);
            assertEquals(200, client.shippedEvents().size());
            assertEquals(1, client.maxInflightPuts.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testCloseFlushesRemainingEvents() {
        flusher.start();
        for (int i = 0; i < 12_000; i++) {
            queue.add("message " + i);
        }
        flusher.close();

        assertEquals(12_000, client.shippedEvents().size());
        assertEquals("message 0", client.shippedEvents().get(0).message());
        assertEquals("message 11999", client.shippedEvents().get(11_999).message());
        assertTrue(client.closed);
        assertEquals(0, queue.size());
    }

    @Test
    public void testCloseIsIdempotent() {
        queue.add("message 1");
        flusher.close();
        flusher.close();
        flusher.start();

        assertEquals(1, client.putCalls.size());
        assertFalse(flusher.isFlushing());
    }
}
