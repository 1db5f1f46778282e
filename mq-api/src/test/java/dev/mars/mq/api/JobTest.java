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

import dev.mars.mq.api.codec.ContentTypes;
import dev.mars.mq.api.error.CannotAcknowledgeException;
import dev.mars.mq.api.error.CodecException;
import dev.mars.mq.api.error.MqErrorCodes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class JobTest {

    @Test
    @DisplayName("create() fills id, priority, timestamp and content type")
    void testCreateDefaults() {
        Instant before = Instant.now();
        Job job = Job.create();

        assertNotNull(job.getId());
        assertEquals(Priority.NORMAL, job.getPriority());
        assertNotNull(job.getTimestamp());
        assertFalse(job.getTimestamp().isBefore(before));
        assertEquals(ContentTypes.DEFAULT, job.getContentType());
        assertEquals(0, job.getRetries());
        assertEquals("", job.getErrorType());
        assertEquals(0, job.size());
        assertTrue(job.isEmpty());
        assertNull(job.getAcknowledger());
    }

    @Test
    void testIdsAreUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(Job.create().getId());
        }
        assertEquals(1000, ids.size());
    }

    @Test
    void testCustomIdGenerator() {
        Job job = Job.create(() -> "fixed-id");
        assertEquals("fixed-id", job.getId());
    }

    @Test
    @DisplayName("Payload encodes and decodes with the job's content type")
    void testEncodeDecode() throws Exception {
        Job job = Job.create();
        job.encode(Map.of("order", 42, "customer", "acme"));
        assertTrue(job.size() > 0);

        @SuppressWarnings("unchecked")
        Map<String, Object> decoded = job.decode(Map.class);
        assertEquals(42, decoded.get("order"));
        assertEquals("acme", decoded.get("customer"));

        job.setContentType(ContentTypes.JSON);
        job.encode("hello");
        assertEquals("\"hello\"", new String(job.getRaw()));
    }

    @Test
    void testUnknownContentTypeFails() {
        Job job = Job.create();
        job.setContentType("application/protobuf");

        CodecException e = assertThrows(CodecException.class, () -> job.encode("x"));
        assertEquals(MqErrorCodes.UNKNOWN_CONTENT_TYPE, e.getCode());
    }

    @Test
    @DisplayName("Acknowledging a job that was never delivered fails")
    void testAckWithoutAcknowledger() {
        Job job = Job.create();
        job.setRaw(new byte[]{1});

        assertThrows(CannotAcknowledgeException.class, job::ack);
        assertThrows(CannotAcknowledgeException.class, () -> job.reject(true));
        assertThrows(CannotAcknowledgeException.class, () -> job.reject(false));
    }

    @Test
    void testNullErrorTypeAndRawAreNormalized() {
        Job job = new Job();
        job.setErrorType(null);
        job.setRaw(null);

        assertEquals("", job.getErrorType());
        assertNotNull(job.getRaw());
        assertEquals(0, job.size());
    }

    @Test
    void testToStringOmitsPayload() {
        Job job = Job.create();
        job.setRaw("secret-payload".getBytes());

        String text = job.toString();
        assertTrue(text.contains(job.getId()));
        assertTrue(text.contains("size=14"));
        assertFalse(text.contains("secret-payload"));
    }
}
