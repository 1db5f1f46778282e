package dev.mars.mq.amqp;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import com.rabbitmq.client.Channel;
import dev.mars.mq.api.Acknowledger;
import dev.mars.mq.api.Job;
import dev.mars.mq.api.error.CannotAcknowledgeException;
import dev.mars.mq.api.error.ConnectionLostException;
import dev.mars.mq.api.error.MqErrorCodes;
import dev.mars.mq.api.error.MqException;
import dev.mars.mq.core.metrics.MqMetrics;
import dev.mars.mq.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * Channel interactions of the AMQP acknowledger, using a mocked channel.
 */
@Tag(TestCategories.CORE)
class AmqpAcknowledgerTest {

    private static final long TAG = 7L;

    private AutoCloseable mockitoCloseable;
    private SimpleMeterRegistry registry;
    private Job job;

    @Mock
    private AmqpQueue queue;

    @Mock
    private AmqpBroker broker;

    @Mock
    private Channel channel;

    @BeforeEach
    void setUp() {
        mockitoCloseable = MockitoAnnotations.openMocks(this);
        registry = new SimpleMeterRegistry();
        MqMetrics metrics = new MqMetrics("ack-test");
        metrics.bindTo(registry);

        when(queue.getName()).thenReturn("jobs");
        when(queue.getBroker()).thenReturn(broker);
        when(broker.getMetrics()).thenReturn(metrics);
        when(channel.isOpen()).thenReturn(true);

        job = new Job();
        job.setId("job-7");
        job.setRaw(new byte[]{1});
        job.setAcknowledger(new AmqpAcknowledger(job, queue, channel, TAG));
    }

    @AfterEach
    void tearDown() throws Exception {
        mockitoCloseable.close();
    }

    @Test
    void testAckUsesDeliveryTag() throws Exception {
        job.ack();

        verify(channel).basicAck(TAG, false);
        assertEquals(Acknowledger.State.ACKED, job.getAcknowledger().getState());
        assertEquals(1.0, registry.find(MqMetrics.JOBS_ACKED).counter().count());
    }

    @Test
    void testRejectWithRequeueNacks() throws Exception {
        job.reject(true);

        verify(channel).basicNack(TAG, false, true);
        verify(queue, never()).publishToBuried(any());
    }

    @Test
    void testRejectWithoutRequeuePublishesToBuriedThenAcks() throws Exception {
        job.setErrorType("invalid");

        job.reject(false);

        InOrder order = inOrder(queue, channel);
        order.verify(queue).publishToBuried(job);
        order.verify(channel).basicAck(TAG, false);
        verify(channel, never()).basicReject(anyLong(), anyBoolean());
        assertEquals(1.0, registry.find(MqMetrics.JOBS_BURIED).counter().count());
    }

    @Test
    void testBuryFallsBackToDeadLettering() throws Exception {
        doThrow(new MqException(MqErrorCodes.PUBLISH_FAILED, "exchange unavailable"))
            .when(queue).publishToBuried(job);

        job.reject(false);

        verify(channel).basicReject(TAG, false);
        verify(channel, never()).basicAck(anyLong(), anyBoolean());
    }

    @Test
    void testClosedChannelReportsConnectionLost() throws Exception {
        when(channel.isOpen()).thenReturn(false);

        assertThrows(ConnectionLostException.class, job::ack);
        verify(channel, never()).basicAck(anyLong(), anyBoolean());
    }

    @Test
    void testChannelFailureReportsConnectionLost() throws Exception {
        doThrow(new IOException("connection reset")).when(channel).basicNack(TAG, false, true);

        ConnectionLostException e = assertThrows(ConnectionLostException.class, () -> job.reject(true));
        assertEquals(MqErrorCodes.CONNECTION_LOST, e.getCode());
    }

    @Test
    void testSecondDispositionFails() throws Exception {
        job.ack();

        assertThrows(CannotAcknowledgeException.class, () -> job.reject(false));
        verify(channel, times(1)).basicAck(TAG, false);
    }
}
