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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.LongString;
import dev.mars.mq.api.Job;
import dev.mars.mq.api.Priority;
import dev.mars.mq.api.codec.ContentTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

/**
 * Conversion between jobs and AMQP messages. Retries and error type travel as
 * headers; every other field maps to a standard message property.
 */
public final class AmqpHeaders {

    private static final Logger logger = LoggerFactory.getLogger(AmqpHeaders.class);

    /** Delivery mode of messages that survive a broker restart. */
    static final int PERSISTENT = 2;

    private AmqpHeaders() {
    }

    public static AMQP.BasicProperties toProperties(Job job, AmqpConfiguration config) {
        Map<String, Object> headers = new HashMap<>();
        if (job.getRetries() > 0) {
            headers.put(config.getRetriesHeader(), job.getRetries());
        }
        if (job.getErrorType() != null && !job.getErrorType().isEmpty()) {
            headers.put(config.getErrorHeader(), job.getErrorType());
        }

        Instant timestamp = job.getTimestamp() != null ? job.getTimestamp() : Instant.now();
        Priority priority = job.getPriority() != null ? job.getPriority() : Priority.NORMAL;
        return new AMQP.BasicProperties.Builder()
            .deliveryMode(PERSISTENT)
            .messageId(job.getId())
            .priority(priority.getValue())
            .timestamp(Date.from(timestamp))
            .contentType(job.getContentType())
            .headers(headers)
            .build();
    }

    public static Job toJob(AMQP.BasicProperties properties, byte[] body, AmqpConfiguration config) {
        Job job = new Job();
        job.setId(properties.getMessageId());
        job.setPriority(properties.getPriority() != null
            ? Priority.fromValue(properties.getPriority())
            : Priority.NORMAL);
        job.setTimestamp(properties.getTimestamp() != null ? properties.getTimestamp().toInstant() : null);
        job.setContentType(properties.getContentType() != null ? properties.getContentType() : ContentTypes.DEFAULT);
        job.setRaw(body);

        Map<String, Object> headers = properties.getHeaders();
        if (headers != null) {
            job.setRetries(retriesFrom(headers.get(config.getRetriesHeader())));
            job.setErrorType(errorTypeFrom(headers.get(config.getErrorHeader())));
        }
        return job;
    }

    /**
     * Normalizes a retries header to an int. Publishers encode the counter with
     * different integer widths, and some as text.
     */
    public static int retriesFrom(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            long retries = ((Number) value).longValue();
            return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, retries));
        }
        if (value instanceof LongString || value instanceof String) {
            String text = value.toString().trim();
            try {
                return Integer.parseInt(text);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non numeric retries header: '{}'", text);
                return 0;
            }
        }
        logger.warn("Ignoring retries header of unsupported type {}", value.getClass().getName());
        return 0;
    }

    public static String errorTypeFrom(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof LongString || value instanceof String) {
            return value.toString();
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, java.nio.charset.StandardCharsets.UTF_8);
        }
        logger.warn("Ignoring error header of unsupported type {}", value.getClass().getName());
        return "";
    }
}
