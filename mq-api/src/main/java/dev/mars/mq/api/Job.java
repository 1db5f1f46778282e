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

import com.fasterxml.jackson.core.type.TypeReference;
import dev.mars.mq.api.codec.ContentTypes;
import dev.mars.mq.api.codec.PayloadCodecs;
import dev.mars.mq.api.error.CannotAcknowledgeException;
import dev.mars.mq.api.error.MqException;

import java.time.Instant;

/**
 * A unit of work published to a {@link Queue}, with its metadata.
 *
 * <p>A job without payload is invalid and is refused at publish time. Jobs
 * delivered by a {@link JobIter} carry an {@link Acknowledger}; jobs created
 * locally do not, and acknowledging them fails.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class Job {

    private static final byte[] EMPTY = new byte[0];

    private String id;
    private Priority priority = Priority.NORMAL;
    private Instant timestamp;
    private int retries;
    private String errorType = "";
    private String contentType = ContentTypes.DEFAULT;
    private byte[] raw = EMPTY;
    private volatile Acknowledger acknowledger;

    public Job() {
    }

    /**
     * Creates a new job with a unique ID, normal priority, the current
     * timestamp and the default content type.
     */
    public static Job create() {
        return create(JobIdGenerator.uuid());
    }

    public static Job create(JobIdGenerator idGenerator) {
        Job job = new Job();
        job.id = idGenerator.generate();
        job.priority = Priority.NORMAL;
        job.timestamp = Instant.now();
        job.contentType = ContentTypes.DEFAULT;
        return job;
    }

    /**
     * Encodes the payload with the codec of this job's content type and stores it as the raw content.
     */
    public void encode(Object payload) throws MqException {
        this.raw = PayloadCodecs.forContentType(contentType).encode(payload);
    }

    /**
     * Decodes the raw content with the codec of this job's content type.
     */
    public <T> T decode(Class<T> type) throws MqException {
        return PayloadCodecs.forContentType(contentType).decode(raw, type);
    }

    public <T> T decode(TypeReference<T> type) throws MqException {
        return PayloadCodecs.forContentType(contentType).decode(raw, type);
    }

    /**
     * Acknowledges the job through its acknowledger.
     *
     * @throws CannotAcknowledgeException if the job does not come from a queue
     */
    public void ack() throws MqException {
        Acknowledger current = acknowledger;
        if (current == null) {
            throw new CannotAcknowledgeException();
        }
        current.ack();
    }

    /**
     * Rejects the job through its acknowledger.
     *
     * @param requeue whether the job goes back to the queue instead of the buried queue
     * @throws CannotAcknowledgeException if the job does not come from a queue
     */
    public void reject(boolean requeue) throws MqException {
        Acknowledger current = acknowledger;
        if (current == null) {
            throw new CannotAcknowledgeException();
        }
        current.reject(requeue);
    }

    /**
     * Gets the size of the raw content in bytes.
     */
    public int size() {
        return raw == null ? 0 : raw.length;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Priority getPriority() { return priority; }
    public void setPriority(Priority priority) { this.priority = priority; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public int getRetries() { return retries; }
    public void setRetries(int retries) { this.retries = retries; }

    public String getErrorType() { return errorType; }
    public void setErrorType(String errorType) { this.errorType = errorType == null ? "" : errorType; }

    public String getContentType() { return contentType; }
    public void setContentType(String contentType) { this.contentType = contentType; }

    /**
     * Gets the raw content. The array is not copied.
     */
    public byte[] getRaw() { return raw; }
    public void setRaw(byte[] raw) { this.raw = raw == null ? EMPTY : raw; }

    public Acknowledger getAcknowledger() { return acknowledger; }
    public void setAcknowledger(Acknowledger acknowledger) { this.acknowledger = acknowledger; }

    @Override
    public String toString() {
        return "Job{" +
                "id='" + id + '\'' +
                ", priority=" + priority +
                ", timestamp=" + timestamp +
                ", retries=" + retries +
                ", errorType='" + errorType + '\'' +
                ", contentType='" + contentType + '\'' +
                ", size=" + size() +
                '}';
    }
}
