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

import com.google.common.annotations.VisibleForTesting;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.spi.ErrorCode;
import org.apache.log4j.spi.LoggingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_ACCESS_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_BATCH_SIZE_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_ENABLE_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_ENDPOINT_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_FLUSH_INTERVAL_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_GROUP_NAME_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_REGION_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_SECRET_KEY;
import static com.automq.log.shipper.LogShipperConstants.LOG_CLOUDWATCH_STREAM_PREFIX_KEY;

/**
 * Log4j appender that forwards every event to a {@link CloudWatchLogShipper}.
 * <pre>
 * log4j.appender.cloudwatch=com.automq.log.shipper.CloudWatchLogsAppender
 * log4j.appender.cloudwatch.enable=true
 * log4j.appender.cloudwatch.logGroupName=/automq/broker
 * log4j.appender.cloudwatch.logStreamNamePrefix=node-0
 * log4j.appender.cloudwatch.region=us-east-1
 * log4j.appender.cloudwatch.layout=org.apache.log4j.PatternLayout
 * log4j.appender.cloudwatch.layout.ConversionPattern=[%d] %p %m (%c)%n
 * </pre>
 * Events logged by the shipper itself are never shipped, so the appender can sit on the root logger.
 */
public class CloudWatchLogsAppender extends AppenderSkeleton {
    private static final Logger LOGGER = LoggerFactory.getLogger(CloudWatchLogsAppender.class);
    private static final Runnable NOOP_ACK = () -> { };
    private static final String INTERNAL_LOGGER_PREFIX = CloudWatchLogsAppender.class.getPackage().getName() + ".";

    private final Properties props = new Properties();
    private volatile CloudWatchLogShipper shipper;

    public CloudWatchLogsAppender() {
        super();
    }

    @VisibleForTesting
    CloudWatchLogsAppender(CloudWatchLogShipper shipper) {
        this();
        this.shipper = shipper;
    }

    public void setEnable(boolean enable) {
        setProperty(LOG_CLOUDWATCH_ENABLE_KEY, String.valueOf(enable));
    }

    public void setLogGroupName(String logGroupName) {
        setProperty(LOG_CLOUDWATCH_GROUP_NAME_KEY, logGroupName);
    }

    public void setLogStreamNamePrefix(String logStreamNamePrefix) {
        setProperty(LOG_CLOUDWATCH_STREAM_PREFIX_KEY, logStreamNamePrefix);
    }

    public void setFlushInterval(long flushIntervalMs) {
        setProperty(LOG_CLOUDWATCH_FLUSH_INTERVAL_KEY, String.valueOf(flushIntervalMs));
    }

    public void setBatchSize(int batchSize) {
        setProperty(LOG_CLOUDWATCH_BATCH_SIZE_KEY, String.valueOf(batchSize));
    }

    public void setRegion(String region) {
        setProperty(LOG_CLOUDWATCH_REGION_KEY, region);
    }

    public void setEndpoint(String endpoint) {
        setProperty(LOG_CLOUDWATCH_ENDPOINT_KEY, endpoint);
    }

    public void setAccessKey(String accessKey) {
        setProperty(LOG_CLOUDWATCH_ACCESS_KEY, accessKey);
    }

    public void setSecretKey(String secretKey) {
        setProperty(LOG_CLOUDWATCH_SECRET_KEY, secretKey);
    }

    private void setProperty(String key, String value) {
        if (StringUtils.isNotBlank(value)) {
            props.setProperty(key, value.trim());
        }
    }

    @Override
    public void activateOptions() {
        super.activateOptions();
        if (shipper != null) {
            return;
        }
        try {
            shipper = CloudWatchLogShipper.create(new DefaultLogShipperConfig(props));
            if (shipper == null) {
                return;
            }
            LOGGER.info("CloudWatchLogsAppender {} initialized for log group {}.", getName(),
                props.getProperty(LOG_CLOUDWATCH_GROUP_NAME_KEY));
        } catch (Exception e) {
            errorHandler.error("Failed to initialize CloudWatchLogsAppender " + getName(), e, ErrorCode.GENERIC_FAILURE);
        }
    }

    @Override
    protected void append(LoggingEvent event) {
        CloudWatchLogShipper current = shipper;
        if (current == null || isInternal(event)) {
            return;
        }
        try {
            current.log(toRecord(event), NOOP_ACK);
        } catch (RuntimeException e) {
            errorHandler.error("Failed to append log event to CloudWatch Logs", e, ErrorCode.WRITE_FAILURE);
        }
    }

    private static boolean isInternal(LoggingEvent event) {
        String loggerName = event.getLoggerName();
        return loggerName != null && loggerName.startsWith(INTERNAL_LOGGER_PREFIX);
    }

    private Map<String, Object> toRecord(LoggingEvent event) {
        Map<String, Object> record = new HashMap<>();
        if (layout != null) {
            StringBuilder line = new StringBuilder(layout.format(event));
            if (layout.ignoresThrowable()) {
                String[] throwableStrRep = event.getThrowableStrRep();
                if (throwableStrRep != null) {
                    for (String stack : throwableStrRep) {
                        line.append(stack).append("\n");
                    }
                }
            }
            record.put(LogMessageExtractor.FORMATTED_MESSAGE_KEY, line.toString());
        }
        String rendered = event.getRenderedMessage();
        if (rendered != null) {
            record.put(LogMessageExtractor.MESSAGE_KEY, rendered);
        }
        return record;
    }

    @Override
    public void close() {
        CloudWatchLogShipper current;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            current = shipper;
            shipper = null;
        }
        // the flusher logs while draining, which may re-enter doAppend on another thread
        if (current != null) {
            try {
                current.close();
            } catch (Exception e) {
                LOGGER.error("Failed to close CloudWatchLogsAppender {}", getName(), e);
            }
        }
    }

    @Override
    public boolean requiresLayout() {
        return false;
    }
}
