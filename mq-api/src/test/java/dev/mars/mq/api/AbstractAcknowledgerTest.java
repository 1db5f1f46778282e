package dev.mars.mq.api;

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

import dev.mars.mq.api.error.CannotAcknowledgeException;
import dev.mars.mq.api.error.MqErrorCodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class AbstractAcknowledgerTest {

    private Job job;
    private RecordingAcknowledger acknowledger;

    @BeforeEach
    void setUp() {
        job = Job.create();
        job.setRaw(new byte[]{1, 2, 3});
        acknowledger = new RecordingAcknowledger(job);
        job.setAcknowledger(acknowledger);
    }

    @Test
    void testAckTransitionsOnce() throws Exception {
        assertEquals(Acknowledger.State.PENDING, acknowledger.getState());

        job.ack();

        assertEquals(Acknowledger.State.ACKED, acknowledger.getState());
        assertEquals(List.of("ack"), acknowledger.calls);
    }

    @Test
    void testRejectPassesRequeueFlag() throws Exception {
        job.reject(true);

        assertEquals(Acknowledger.State.REJECTED, acknowledger.getState());
        assertEquals(List.of("reject:true"), acknowledger.calls);
    }

    @Test
    @DisplayName("Any second disposition fails with CannotAcknowledge")
    void testSecondDispositionFails() throws Exception {
        job.ack();

        CannotAcknowledgeException e = assertThrows(CannotAcknowledgeException.class, job::ack);
        assertEquals(MqErrorCodes.CANNOT_ACKNOWLEDGE, e.getCode());
        assertThrows(CannotAcknowledgeException.class, () -> job.reject(false));
        assertThrows(CannotAcknowledgeException.class, () -> job.reject(true));

        assertEquals(List.of("ack"), acknowledger.calls);
        assertEquals(Acknowledger.State.ACKED, acknowledger.getState());
    }

    @Test
    void testRejectThenAckFails() throws Exception {
        job.reject(false);

        assertThrows(CannotAcknowledgeException.class, job::ack);
        assertEquals(List.of("reject:false"), acknowledger.calls);
    }

    @Test
    @DisplayName("Concurrent dispositions settle exactly once")
    void testConcurrentDispositions() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger failures = new AtomicInteger();
        try {
            for (int i = 0; i < threads; i++) {
                boolean ack = i % 2 == 0;
                executor.submit(() -> {
                    start.await();
                    try {
                        if (ack) {
                            job.ack();
                        } else {
                            job.reject(true);
                        }
                    } catch (CannotAcknowledgeException e) {
                        failures.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }

        assertEquals(threads - 1, failures.get());
        assertEquals(1, acknowledger.calls.size());
    }

    private static class RecordingAcknowledger extends AbstractAcknowledger {
        private final List<String> calls = new ArrayList<>();

        RecordingAcknowledger(Job job) {
            super(job);
        }

        @Override
        protected synchronized void doAck() {
            calls.add("ack");
        }

        @Override
        protected synchronized void doReject(boolean requeue) {
            calls.add("reject:" + requeue);
        }
    }
}
