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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsAsyncClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogStreamRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogStreamResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.DescribeLogStreamsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.DescribeLogStreamsResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.InputLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.LogStream;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceNotFoundException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("LogShipperUnit")
public class CloudWatchLogsSinkClientTest {
    private CloudWatchLogsAsyncClient asyncClient;
    private CloudWatchLogsSinkClient client;

    @BeforeEach
    public void setUp() {
        asyncClient = mock(CloudWatchLogsAsyncClient.class);
        client = new CloudWatchLogsSinkClient(asyncClient);
    }

    @Test
    public void testDescribeLogStreams() throws Exception {
        when(asyncClient.describeLogStreams(any(DescribeLogStreamsRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(DescribeLogStreamsResponse.builder()
                .logStreams(LogStream.builder().logStreamName("app-2025-01-02-03-UTC").build(),
                    LogStream.builder().logStreamName("app-2025-01-02-03-UTC-1").build())
                .build()));

        List<String> names = client.describeLogStreams("/automq/test", "app-2025-01-02-03-UTC").get();
        assertEquals(List.of("app-2025-01-02-03-UTC", "app-2025-01-02-03-UTC-1"), names);

        ArgumentCaptor<DescribeLogStreamsRequest> captor = ArgumentCaptor.forClass(DescribeLogStreamsRequest.class);
        verify(asyncClient).describeLogStreams(captor.capture());
        assertEquals("/automq/test", captor.getValue().logGroupName());
        assertEquals("app-2025-01-02-03-UTC", captor.getValue().logStreamNamePrefix());
    }

    @Test
    public void testCreateLogStream() throws Exception {
        when(asyncClient.createLogStream(any(CreateLogStreamRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(CreateLogStreamResponse.builder().build()));

        client.createLogStream("/automq/test", "app-2025-01-02-03-UTC").get();

        ArgumentCaptor<CreateLogStreamRequest> captor = ArgumentCaptor.forClass(CreateLogStreamRequest.class);
        verify(asyncClient).createLogStream(captor.capture());
        assertEquals("/automq/test", captor.getValue().logGroupName());
        assertEquals("app-2025-01-02-03-UTC", captor.getValue().logStreamName());
    }

    @Test
    public void testPutLogEvents() throws Exception {
        when(asyncClient.putLogEvents(any(PutLogEventsRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(PutLogEventsResponse.builder().build()));

        client.putLogEvents("/automq/test", "app-2025-01-02-03-UTC",
            List.of(new LogEvent("message 1", 1000L), new LogEvent("message 2", 2000L))).get();

        ArgumentCaptor<PutLogEventsRequest> captor = ArgumentCaptor.forClass(PutLogEventsRequest.class);
        verify(asyncClient).putLogEvents(captor.capture());
        PutLogEventsRequest request = captor.getValue();
        assertEquals("/automq/test", request.logGroupName());
        assertEquals("app-2025-01-02-03-UTC", request.logStreamName());
        assertEquals(List.of(
            InputLogEvent.builder().message("message 1").timestamp(1000L).build(),
            InputLogEvent.builder().message("message 2").timestamp(2000L).build()), request.logEvents());
    }

    @Test
    public void testFailurePropagates() {
        when(asyncClient.putLogEvents(any(PutLogEventsRequest.class)))
            .thenReturn(CompletableFuture.failedFuture(ResourceNotFoundException.builder().message("no such group").build()));

        ExecutionException ex = assertThrows(ExecutionException.class,
            () -> client.putLogEvents("/automq/missing", "stream", List.of(new LogEvent("m", 1L))).get());
        assertInstanceOf(ResourceNotFoundException.class, ex.getCause());
    }

    @Test
    public void testClose() {
        client.close();
        verify(asyncClient).close();
    }

    @Test
    public void testBuilderRequiresRegion() {
        assertThrows(IllegalArgumentException.class, () -> CloudWatchLogsSinkClient.builder().build());
    }
}
