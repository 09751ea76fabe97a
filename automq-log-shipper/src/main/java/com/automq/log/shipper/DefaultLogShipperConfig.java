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

import com.automq.log.shipper.sink.CloudWatchLogsSinkClient;
import com.automq.log.shipper.sink.LogSinkClient;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.OptionalInt;
import java.util.Properties;

import static com.automq.log.shipper.LogShipperConstants.DEFAULT_LOG_CLOUDWATCH_ENABLE;
import static com.automq.log.shipper.LogShipperConstants.DEFAULT_LOG_CLOUDWATCH_FLUSH_INTERVAL_MS;
import static com.automq.log.shipper.LogShipperConstants.DEFAULT_LOG_CLOUDWATCH_STREAM_PREFIX;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_ACCESS_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_BATCH_SIZE_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_ENABLE_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_ENDPOINT_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_FLUSH_INTERVAL_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_GROUP_NAME_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_REGION_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_SECRET_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_STREAM_PREFIX_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_PROPERTIES_FILE;

public class DefaultLogShipperConfig implements LogShipperConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultLogShipperConfig.class);

    private final Properties props;
    private LogSinkClient sinkClient;

    public DefaultLogShipperConfig() {
        this(null);
    }

    public DefaultLogShipperConfig(Properties overrideProps) {
        this.props = new Properties();
        if (overrideProps != null) {
            this.props.putAll(overrideProps);
        } else {
            try (InputStream input = getClass().getClassLoader().getResourceAsStream(LOG_PROPERTIES_FILE)) {
                if (input != null) {
                    props.load(input);
                    LOGGER.info("Loaded log configuration from {}", LOG_PROPERTIES_FILE);
                } else {
                    LOGGER.warn("Could not find {}, using default log configurations.", LOG_PROPERTIES_FILE);
                }
            } catch (IOException ex) {
                LOGGER.error("Failed to load log configuration from {}.", LOG_PROPERTIES_FILE, ex);
            }
        }
    }

    @Override
    public boolean isEnabled() {
        return Boolean.parseBoolean(props.getProperty(LOG_CLOUDWATCH_ENABLE_KEY, String.valueOf(DEFAULT_LOG_CLOUDWATCH_ENABLE)));
    }

    @Override
    public String logGroupName() {
        return StringUtils.trimToEmpty(props.getProperty(LOG_CLOUDWATCH_GROUP_NAME_KEY));
    }

    @Override
    public String logStreamNamePrefix() {
        return StringUtils.trimToEmpty(props.getProperty(LOG_CLOUDWATCH_STREAM_PREFIX_KEY, DEFAULT_LOG_CLOUDWATCH_STREAM_PREFIX));
    }

    @Override
    public long flushIntervalMs() {
        String value = props.getProperty(LOG_CLOUDWATCH_FLUSH_INTERVAL_KEY);
        if (StringUtils.isBlank(value)) {
            return DEFAULT_LOG_CLOUDWATCH_FLUSH_INTERVAL_MS;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid value '{}' for '{}', using default {}ms.", value, LOG_CLOUDWATCH_FLUSH_INTERVAL_KEY,
                DEFAULT_LOG_CLOUDWATCH_FLUSH_INTERVAL_MS);
            return DEFAULT_LOG_CLOUDWATCH_FLUSH_INTERVAL_MS;
        }
    }

    @Override
    public OptionalInt batchSize() {
        String value = props.getProperty(LOG_CLOUDWATCH_BATCH_SIZE_KEY);
        if (StringUtils.isBlank(value)) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid value '{}' for '{}', ignoring it.", value, LOG_CLOUDWATCH_BATCH_SIZE_KEY);
            return OptionalInt.empty();
        }
    }

    @Override
    public synchronized LogSinkClient sinkClient() {
        if (this.sinkClient != null) {
            return this.sinkClient;
        }
        String region = props.getProperty(LOG_CLOUDWATCH_REGION_KEY);
        if (StringUtils.isBlank(region)) {
            LOGGER.error("Mandatory log config '{}' is not set.", LOG_CLOUDWATCH_REGION_KEY);
            return null;
        }
        this.sinkClient = CloudWatchLogsSinkClient.builder()
            .region(region)
            .endpoint(props.getProperty(LOG_CLOUDWATCH_ENDPOINT_KEY))
            .credentials(props.getProperty(LOG_CLOUDWATCH_ACCESS_KEY), props.getProperty(LOG_CLOUDWATCH_SECRET_KEY))
            .build();
        return this.sinkClient;
    }
}
