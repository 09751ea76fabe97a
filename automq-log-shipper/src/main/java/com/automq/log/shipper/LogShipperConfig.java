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

import java.util.OptionalInt;

public interface LogShipperConfig {

    boolean isEnabled();

    String logGroupName();

    /**
     * @return the log stream name prefix, empty when streams are named by hour only
     */
    String logStreamNamePrefix();

    long flushIntervalMs();

    /**
     * The configured batch size, if any. Batches are always cut by the CloudWatch Logs limits
     * in {@link LogShipperConstants}, so this value is informational only.
     */
    OptionalInt batchSize();

    /**
     * @return the client used to reach CloudWatch Logs, or {@code null} if it cannot be built
     */
    LogSinkClient sinkClient();
}
