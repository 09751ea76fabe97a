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

public class LogShipperConstants {
    private LogShipperConstants() {
    }

    public static final String LOG_PROPERTIES_FILE = "automq-cloudwatch-log.properties";

    public static final String LOG_CLOUDWATCH_ENABLE_KEY = "log.cloudwatch.enable";
    public static final boolean DEFAULT_LOG_CLOUDWATCH_ENABLE = false;

    public static final String LOG_CLOUDWATCH_GROUP_NAME_KEY = "log.cloudwatch.group.name";
    public static final String LOG_CLOUDWATCH_STREAM_PREFIX_KEY = "log.cloudwatch.stream.prefix";
    public static final String DEFAULT_LOG_CLOUDWATCH_STREAM_PREFIX = "";

    public static final String LOG_CLOUDWATCH_FLUSH_INTERVAL_KEY = "log.cloudwatch.flush.interval.ms";
    public static final long DEFAULT_LOG_CLOUDWATCH_FLUSH_INTERVAL_MS = 3000L;

    // Accepted for compatibility, the batch limits below always apply.
    public static final String LOG_CLOUDWATCH_BATCH_SIZE_KEY = "log.cloudwatch.batch.size";

    public static final String LOG_CLOUDWATCH_REGION_KEY = "log.cloudwatch.region";
    public static final String LOG_CLOUDWATCH_ENDPOINT_KEY = "log.cloudwatch.endpoint";
    public static final String LOG_CLOUDWATCH_ACCESS_KEY = "log.cloudwatch.access.key";
    public static final String LOG_CLOUDWATCH_SECRET_KEY = "log.cloudwatch.secret.key";

    // https://docs.aws.amazon.com/AmazonCloudWatchLogs/latest/APIReference/API_PutLogEvents.html
    // The maximum batch size is 1,048,576 bytes, calculated as the sum of all event messages in UTF-8 plus 26 bytes per event.
    public static final int MAX_BATCH_BYTES = 1024 * 1024;
    public static final int EVENT_OVERHEAD = 26;
    public static final int MAX_EVENT_BYTES = MAX_BATCH_BYTES - EVENT_OVERHEAD;
    public static final int MAX_EVENTS_PER_BATCH = 10000;

    public static final String TRUNCATION_SUFFIX = "[TRUNCATED]";
}
