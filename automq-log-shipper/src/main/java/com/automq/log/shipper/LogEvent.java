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

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A single buffered log line and the time it was captured.
 */
public final class LogEvent {
    private final String message;
    private final long timestampMillis;
    private final int messageBytes;

    public LogEvent(String message, long timestampMillis) {
        this.message = Objects.requireNonNull(message, "message");
        this.timestampMillis = timestampMillis;
        this.messageBytes = message.getBytes(StandardCharsets.UTF_8).length;
    }

    public String message() {
        return message;
    }

    public long timestampMillis() {
        return timestampMillis;
    }

    /**
     * @return the UTF-8 length of the message
     */
    public int messageBytes() {
        return messageBytes;
    }

    /**
     * @return the number of bytes this event counts against a CloudWatch Logs batch
     */
    public int sizeInBytes() {
        return messageBytes + LogShipperConstants.EVENT_OVERHEAD;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LogEvent event = (LogEvent) o;
        return timestampMillis == event.timestampMillis && message.equals(event.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, timestampMillis);
    }

    @Override
    public String toString() {
        return "LogEvent{" +
            "timestampMillis=" + timestampMillis +
            ", messageBytes=" + messageBytes +
            '}';
    }
}
