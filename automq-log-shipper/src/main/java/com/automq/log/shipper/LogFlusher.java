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

import com.automq.log.shipper.sink.LogSinkClient;
import com.automq.log.shipper.util.ThreadUtils;
import com.automq.log.shipper.util.Utils;
import com.google.common.annotations.VisibleForTesting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drains a {@link LogEventQueue} into the sink, one batch per PutLogEvents call.
 * <p>
 * Flush cycles run on a timer and once more on {@link #close()}. They are serialized by a single
 * flush lock, so a shutdown flush never interleaves with a scheduled one. A failed batch is
 * dropped: it has already left the queue, and the next cycle continues with what remains.
 */
public class LogFlusher {
    private static final Logger LOGGER = LoggerFactory.getLogger(LogFlusher.class);

    private final LogEventQueue queue;
    private final LogStreamNameProvider streamNameProvider;
    private final LogSinkClient client;
    private final String logGroupName;
    private final long flushIntervalMs;

    private final ReentrantLock flushLock = new ReentrantLock();
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> flushTask;
    private volatile boolean closed;

    public LogFlusher(LogEventQueue queue, LogStreamNameProvider streamNameProvider, LogSinkClient client,
        String logGroupName, long flushIntervalMs) {
        if (flushIntervalMs <= 0) {
            throw new IllegalArgumentException("Flush interval must be positive, got " + flushIntervalMs);
        }
        this.queue = queue;
        this.streamNameProvider = streamNameProvider;
        this.client = client;
        this.logGroupName = logGroupName;
        this.flushIntervalMs = flushIntervalMs;
        this.scheduler = ThreadUtils.newSingleThreadScheduledExecutor("automq-cloudwatch-log-flusher", true, LOGGER);
    }

    /**
     * Starts the periodic flush, replacing the current schedule if there is one.
     */
    public synchronized void start() {
        if (closed) {
            LOGGER.warn("LogFlusher is already closed.");
            return;
        }
        if (flushTask != null) {
            flushTask.cancel(false);
        }
        flushTask = scheduler.scheduleAtFixedRate(this::flush, flushIntervalMs, flushIntervalMs, TimeUnit.MILLISECONDS);
        LOGGER.info("LogFlusher started for log group {} with flush interval {}ms", logGroupName, flushIntervalMs);
    }

    /**
     * Runs one flush cycle: ships batches until the queue is drained or a call fails.
     *
     * @return the number of events accepted by the sink during this cycle
     */
    public int flush() {
        flushLock.lock();
        try {
            return flush0();
        } finally {
            flushLock.unlock();
        }
    }

    private int flush0() {
        int shipped = 0;
        try {
            boolean hasMore = true;
            while (hasMore) {
                LogEventBatch batch = queue.nextBatch();
                if (batch.isEmpty()) {
                    break;
                }
                String logStreamName = streamNameProvider.currentLogStreamName().get();
                client.putLogEvents(logGroupName, logStreamName, batch.events()).get();
                shipped += batch.size();
                hasMore = batch.hasMore();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Flush of log group {} was interrupted", logGroupName);
        } catch (ExecutionException | RuntimeException e) {
            LOGGER.error("Failed to flush logs to CloudWatch log group {}", logGroupName, Utils.cause(e));
        }
        return shipped;
    }

    /**
     * Stops the timer, flushes everything still queued and releases the sink client.
     */
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            if (flushTask != null) {
                flushTask.cancel(false);
                flushTask = null;
            }
        }
        ThreadUtils.shutdownExecutor(scheduler, 30, TimeUnit.SECONDS, LOGGER);
        int shipped = flush();
        client.close();
        LOGGER.info("LogFlusher closed, {} log events flushed on shutdown", shipped);
    }

    @VisibleForTesting
    boolean isFlushing() {
        return flushLock.isLocked();
    }
}
