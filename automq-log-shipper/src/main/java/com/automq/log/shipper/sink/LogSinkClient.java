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

package com.automq.log.shipper.sink;

import com.automq.log.shipper.LogEvent;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The remote log ingestion service. All calls are asynchronous and may complete
 * exceptionally with a transport level error.
 */
public interface LogSinkClient {

    /**
     * Lists the names of the log streams in the group that start with the prefix.
     */
    CompletableFuture<List<String>> describeLogStreams(String logGroupName, String logStreamNamePrefix);

    CompletableFuture<Void> createLogStream(String logGroupName, String logStreamName);

    /**
     * Uploads one batch. The events must already satisfy the per-call size and count limits.
     */
    CompletableFuture<Void> putLogEvents(String logGroupName, String logStreamName, List<LogEvent> events);

    void close();
}
