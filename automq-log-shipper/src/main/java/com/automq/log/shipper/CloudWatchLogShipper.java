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
import com.google.common.annotations.VisibleForTesting;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Buffers log lines in memory and ships them to a CloudWatch Logs group in the background.
 * <p>
 * {@link #log(Object, Runnable)} never touches the network, so producers never wait on CloudWatch.
 * Delivery is best effort: events still buffered when the process dies, or in a batch whose
 * upload fails, are lost.
 */
public class CloudWatchLogShipper {
    private static final Logger LOGGER = LoggerFactory.getLogger(CloudWatchLogShipper.class);

    private final LogEventQueue queue;
    private final LogFlusher flusher;

    private CloudWatchLogShipper(LogEventQueue queue, LogFlusher flusher) {
        this.queue = queue;
        this.flusher = flusher;
    }

    /**
     * Creates a shipper and starts its flush timer. No CloudWatch call is made until the first flush.
     *
     * @return the started shipper, or {@code null} when shipping is disabled by configuration
     * @throws IllegalArgumentException if the log group name is blank or the sink client cannot be built
     */
    public static CloudWatchLogShipper create(LogShipperConfig config) {
        if (!config.isEnabled()) {
            LOGGER.warn("CloudWatch log shipping is disabled by configuration.");
            return null;
        }
        LogSinkClient client = config.sinkClient();
        if (client == null) {
            throw new IllegalArgumentException("No CloudWatch Logs client available for log group " + config.logGroupName());
        }
        return create(config, client, Clock.systemUTC());
    }

    @VisibleForTesting
    static CloudWatchLogShipper create(LogShipperConfig config, LogSinkClient client, Clock clock) {
        String logGroupName = config.logGroupName();
        if (StringUtils.isBlank(logGroupName)) {
            throw new IllegalArgumentException("Log group name cannot be empty");
        }
        if (config.batchSize().isPresent()) {
            LOGGER.info("Ignoring configured batch size {}, batches are bounded by the CloudWatch Logs limits",
                config.batchSize().getAsInt());
        }
        LogEventQueue queue = new LogEventQueue(clock);
        LogStreamNameProvider streamNameProvider = new LogStreamNameProvider(client, logGroupName,
            config.logStreamNamePrefix(), clock);
        LogFlusher flusher = new LogFlusher(queue, streamNameProvider, client, logGroupName, config.flushIntervalMs());
        CloudWatchLogShipper shipper = new CloudWatchLogShipper(queue, flusher);
        flusher.start();
        return shipper;
    }

    /**
     * Queues the message carried by {@code record} and acknowledges it. The acknowledgement is
     * always sent, even when the message could not be extracted.
     */
    public void log(Object record, Runnable ack) {
        try {
            queue.add(LogMessageExtractor.extract(record));
        } catch (RuntimeException e) {
            LOGGER.error("Failed to queue log record", e);
        } finally {
            ack.run();
        }
    }

    public void append(String message) {
        queue.add(message);
    }

    /**
     * Flushes everything queued so far and releases the CloudWatch client.
     */
    public void close() {
        flusher.close();
    }

    @VisibleForTesting
    LogEventQueue queue() {
        return queue;
    }

    @VisibleForTesting
    LogFlusher flusher() {
        return flusher;
    }
}
