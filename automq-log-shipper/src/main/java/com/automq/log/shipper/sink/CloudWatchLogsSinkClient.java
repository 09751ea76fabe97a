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

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProviderChain;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.async.SdkAsyncHttpClient;
import software.amazon.awssdk.http.nio.netty.NettyNioAsyncHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsAsyncClient;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsAsyncClientBuilder;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogStreamRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.DescribeLogStreamsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.InputLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.LogStream;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsRequest;

/**
 * {@link LogSinkClient} backed by the AWS SDK v2 asynchronous CloudWatch Logs client.
 */
public class CloudWatchLogsSinkClient implements LogSinkClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(CloudWatchLogsSinkClient.class);

    private final CloudWatchLogsAsyncClient client;

    public CloudWatchLogsSinkClient(CloudWatchLogsAsyncClient client) {
        this.client = client;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public CompletableFuture<List<String>> describeLogStreams(String logGroupName, String logStreamNamePrefix) {
        DescribeLogStreamsRequest request = DescribeLogStreamsRequest.builder()
            .logGroupName(logGroupName)
            .logStreamNamePrefix(logStreamNamePrefix)
            .build();
        return client.describeLogStreams(request)
            .thenApply(rsp -> rsp.logStreams().stream()
                .map(LogStream::logStreamName)
                .collect(Collectors.toList()));
    }

    @Override
    public CompletableFuture<Void> createLogStream(String logGroupName, String logStreamName) {
        CreateLogStreamRequest request = CreateLogStreamRequest.builder()
            .logGroupName(logGroupName)
            .logStreamName(logStreamName)
            .build();
        return client.createLogStream(request).thenApply(rsp -> {
            LOGGER.info("Created log stream {} in log group {}", logStreamName, logGroupName);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> putLogEvents(String logGroupName, String logStreamName, List<LogEvent> events) {
        List<InputLogEvent> logEvents = new ArrayList<>(events.size());
        for (LogEvent event : events) {
            logEvents.add(InputLogEvent.builder()
                .message(event.message())
                .timestamp(event.timestampMillis())
                .build());
        }
        PutLogEventsRequest request = PutLogEventsRequest.builder()
            .logGroupName(logGroupName)
            .logStreamName(logStreamName)
            .logEvents(logEvents)
            .build();
        return client.putLogEvents(request).thenApply(rsp -> {
            if (rsp.rejectedLogEventsInfo() != null) {
                LOGGER.warn("Some log events were rejected by log stream {}: {}", logStreamName, rsp.rejectedLogEventsInfo());
            }
            return null;
        });
    }

    @Override
    public void close() {
        client.close();
    }

    public static class Builder {
        private String region;
        private String endpoint;
        private String accessKey;
        private String secretKey;

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder credentials(String accessKey, String secretKey) {
            this.accessKey = accessKey;
            this.secretKey = secretKey;
            return this;
        }

        public CloudWatchLogsSinkClient build() {
            if (StringUtils.isBlank(region)) {
                throw new IllegalArgumentException("region must be set");
            }
            CloudWatchLogsAsyncClientBuilder builder = CloudWatchLogsAsyncClient.builder().region(Region.of(region.trim()));
            if (StringUtils.isNotBlank(endpoint)) {
                builder.endpointOverride(URI.create(endpoint.trim()));
            }
            SdkAsyncHttpClient httpClient = NettyNioAsyncHttpClient.builder().build();
            builder.httpClient(httpClient);
            builder.credentialsProvider(credentialsProviderChain());
            return new CloudWatchLogsSinkClient(builder.build());
        }

        private AwsCredentialsProvider credentialsProviderChain() {
            List<AwsCredentialsProvider> providers = new ArrayList<>();
            if (StringUtils.isNotBlank(accessKey) && StringUtils.isNotBlank(secretKey)) {
                providers.add(StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey.trim(), secretKey.trim())));
            }
            providers.add(DefaultCredentialsProvider.create());
            return AwsCredentialsProviderChain.builder()
                .reuseLastProviderEnabled(true)
                .credentialsProviders(providers)
                .build();
        }
    }
}
