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

import com.automq.log.shipper.util.Utils;
import com.google.common.annotations.VisibleForTesting;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static com.automq.log.shipper.LogShipperConstants.MAX_BATCH_BYTES;
import static com.automq.log.shipper.LogShipperConstants.MAX_EVENTS_PER_BATCH;
import static com.automq.log.shipper.LogShipperConstants.MAX_EVENT_BYTES;
import static com.automq.log.shipper.LogShipperConstants.TRUNCATION_SUFFIX;

/**
 * In-memory FIFO of log events waiting to be shipped.
 * <p>
 * Every buffered event fits in a single PutLogEvents call: messages longer than
 * {@link LogShipperConstants#MAX_EVENT_BYTES} in UTF-8 are cut down and suffixed with
 * {@link LogShipperConstants#TRUNCATION_SUFFIX} on the way in. Events handed out by
 * {@link #nextBatch()} are gone from the queue whether or not the upload succeeds.
 */
public class LogEventQueue {
    private final Deque<LogEvent> queue = new ArrayDeque<>();
    private final Clock clock;

    public LogEventQueue() {
        this(Clock.systemUTC());
    }

    public LogEventQueue(Clock clock) {
        this.clock = clock;
    }

    public void add(String message) {
        String safeMessage = truncate(message == null ? "" : message);
        LogEvent event = new LogEvent(safeMessage, clock.millis());
        synchronized (this) {
            queue.addLast(event);
        }
    }

    /**
     * Removes and returns the longest queue prefix within the batch byte and count limits.
     */
    public synchronized LogEventBatch nextBatch() {
        if (queue.isEmpty()) {
            return LogEventBatch.empty();
        }
        List<LogEvent> batch = new ArrayList<>(Math.min(queue.size(), MAX_EVENTS_PER_BATCH));
        long batchBytes = 0;
        while (!queue.isEmpty() && batch.size() < MAX_EVENTS_PER_BATCH) {
            LogEvent event = queue.peekFirst();
            if (batchBytes + event.sizeInBytes() > MAX_BATCH_BYTES) {
                break;
            }
            batch.add(queue.pollFirst());
            batchBytes += event.sizeInBytes();
        }
        return new LogEventBatch(batch, !queue.isEmpty());
    }

    /**
     * @return a snapshot of the buffered events, detached from the queue
     */
    public synchronized List<LogEvent> get() {
        return new ArrayList<>(queue);
    }

    public synchronized int size() {
        return queue.size();
    }

    public synchronized void reset() {
        queue.clear();
    }

    @VisibleForTesting
    static String truncate(String message) {
        if (Utils.utf8Length(message) <= MAX_EVENT_BYTES) {
            return message;
        }
        // longest prefix, in chars, that still fits together with the suffix
        int low = 0;
        int high = message.length();
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (Utils.utf8Length(message.substring(0, mid) + TRUNCATION_SUFFIX) <= MAX_EVENT_BYTES) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        if (low > 0 && Character.isHighSurrogate(message.charAt(low - 1))) {
            low--;
        }
        return message.substring(0, low) + TRUNCATION_SUFFIX;
    }
}
