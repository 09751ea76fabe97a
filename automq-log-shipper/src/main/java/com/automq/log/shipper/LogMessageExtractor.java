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

import java.util.Map;

/**
 * Pulls the line to ship out of a log record handed over by a logging framework adapter.
 * <p>
 * Plain text is shipped as is. For map shaped records the fully formatted line stored under
 * {@link #FORMATTED_MESSAGE_KEY} wins over the raw {@link #MESSAGE_KEY} field. Anything else
 * is shipped as an empty line.
 */
public final class LogMessageExtractor {
    public static final String FORMATTED_MESSAGE_KEY = "@formatted";
    public static final String MESSAGE_KEY = "message";

    private LogMessageExtractor() {
    }

    public static String extract(Object record) {
        if (record instanceof CharSequence) {
            return record.toString();
        }
        if (record instanceof Map) {
            Map<?, ?> fields = (Map<?, ?>) record;
            Object formatted = fields.get(FORMATTED_MESSAGE_KEY);
            if (formatted != null) {
                return formatted.toString();
            }
            Object message = fields.get(MESSAGE_KEY);
            if (message != null) {
                return message.toString();
            }
        }
        return "";
    }
}
