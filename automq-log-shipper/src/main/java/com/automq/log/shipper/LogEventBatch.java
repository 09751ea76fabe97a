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

import java.util.Collections;
import java.util.List;

/**
 * A queue prefix that fits in one PutLogEvents call.
 */
public final class LogEventBatch {
    private static final LogEventBatch EMPTY = new LogEventBatch(Collections.emptyList(), false);

    private final List<LogEvent> events;
    private final boolean hasMore;

    public LogEventBatch(List<LogEvent> events, boolean hasMore) {
        this.events = Collections.unmodifiableList(events);
        this.hasMore = hasMore;
    }

    public static LogEventBatch empty() {
        return EMPTY;
    }

    public List<LogEvent> events() {
        return events;
    }

    /**
     * @return whether events were still buffered after this batch was taken
     */
    public boolean hasMore() {
        return hasMore;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }

    public long sizeInBytes() {
        long bytes = 0;
        for (LogEvent event : events) {
            bytes += event.sizeInBytes();
        }
        return bytes;
    }
}
