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
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Names the log stream for the current UTC hour and makes sure it exists.
 * <p>
 * Stream names look like {@code {prefix}-yyyy-MM-dd-HH-UTC}, so the stream rotates at every hour
 * boundary. A name is only checked (and created when missing) once per process; the check is
 * retried on the next call if it fails.
 */
public class LogStreamNameProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(LogStreamNameProvider.class);
    private static final DateTimeFormatter HOUR_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH");

    private final LogSinkClient client;
    private final String logGroupName;
    private final String prefix;
    private final Clock clock;
    private final Set<String> checkedStreams = ConcurrentHashMap.newKeySet();

    public LogStreamNameProvider(LogSinkClient client, String logGroupName, String prefix) {
        this(client, logGroupName, prefix, Clock.systemUTC());
    }

    public LogStreamNameProvider(LogSinkClient client, String logGroupName, String prefix, Clock clock) {
        if (StringUtils.isBlank(logGroupName)) {
            throw new IllegalArgumentException("Log group name cannot be empty");
        }
        this.client = client;
        this.logGroupName = logGroupName;
        this.prefix = StringUtils.defaultString(prefix);
        this.clock = clock;
    }

    public CompletableFuture<String> currentLogStreamName() {
        String streamName = logStreamName();
        if (checkedStreams.contains(streamName)) {
            return CompletableFuture.completedFuture(streamName);
        }
        return client.describeLogStreams(logGroupName, streamName)
            .thenCompose(existing -> {
                if (existing != null && existing.contains(streamName)) {
                    return CompletableFuture.<Void>completedFuture(null);
                }
                LOGGER.info("Log stream {} not found in log group {}, creating it", streamName, logGroupName);
                return client.createLogStream(logGroupName, streamName);
            })
            .thenApply(nil -> {
                checkedStreams.add(streamName);
                return streamName;
            });
    }

    String logStreamName() {
        String hour = LocalDateTime.now(clock.withZone(ZoneOffset.UTC)).format(HOUR_FORMATTER);
        return prefix + (prefix.isEmpty() ? "" : "-") + hour + "-UTC";
    }

    @VisibleForTesting
    boolean isCached(String streamName) {
        return checkedStreams.contains(streamName);
    }
}
