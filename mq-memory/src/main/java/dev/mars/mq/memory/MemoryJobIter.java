package dev.mars.mq.memory;

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

import dev.mars.mq.api.Job;
import dev.mars.mq.api.JobIter;
import dev.mars.mq.api.error.AlreadyClosedException;
import dev.mars.mq.api.error.EndOfStreamException;
import dev.mars.mq.api.error.MqErrorCodes;
import dev.mars.mq.api.error.MqException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Iterator over a {@link MemoryQueue}. The advertised window is a semaphore:
 * a slot is taken before a job is handed out and given back by the job's
 * acknowledger.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class MemoryJobIter implements JobIter {

    private static final Logger logger = LoggerFactory.getLogger(MemoryJobIter.class);

    private final MemoryQueue queue;
    private final Semaphore slots;
    private final int window;
    private final boolean finite;
    private final Duration pollInterval;
    private volatile boolean closed;

    MemoryJobIter(MemoryQueue queue, int advertisedWindow) {
        this.queue = queue;
        this.window = Math.max(0, advertisedWindow);
        this.slots = advertisedWindow > 0 ? new Semaphore(advertisedWindow) : null;
        this.finite = queue.getBroker().isFinite();
        this.pollInterval = queue.getBroker().getPollInterval();
    }

    @Override
    public Job next() throws MqException {
        acquire();
        boolean handedOut = false;
        try {
            Job job = nextJob();
            job.setAcknowledger(new MemoryAcknowledger(job, queue, slots));
            handedOut = true;
            queue.getBroker().getMetrics().recordDelivered(queue.getName());
            logger.debug("Delivered job {} from queue {}", job.getId(), queue.getName());
            return job;
        } finally {
            if (!handedOut) {
                release();
            }
        }
    }

    private Job nextJob() throws MqException {
        try {
            while (true) {
                if (closed) {
                    throw new AlreadyClosedException();
                }
                if (finite) {
                    MemoryQueue.Entry entry = queue.poll();
                    if (entry == null) {
                        throw new EndOfStreamException();
                    }
                    return entry.job();
                }
                MemoryQueue.Entry entry = queue.poll(pollInterval);
                if (entry != null) {
                    if (closed) {
                        // closed while waiting, give the job back
                        queue.putBack(entry);
                        throw new AlreadyClosedException();
                    }
                    return entry.job();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MqException(MqErrorCodes.INTERRUPTED, "Interrupted while waiting for a job on queue " + queue.getName(), e);
        }
    }

    private void acquire() throws MqException {
        if (slots == null) {
            return;
        }
        try {
            while (!slots.tryAcquire(pollInterval.toNanos(), TimeUnit.NANOSECONDS)) {
                if (closed) {
                    throw new AlreadyClosedException();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MqException(MqErrorCodes.INTERRUPTED, "Interrupted while waiting for a window slot on queue " + queue.getName(), e);
        }
    }

    private void release() {
        if (slots != null) {
            slots.release();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            queue.removeIterator(this);
            logger.debug("Closed iterator on queue {}", queue.getName());
        }
    }

    /**
     * Gets the number of free window slots, or -1 for an unbounded window.
     */
    public int availableSlots() {
        return slots != null ? slots.availablePermits() : -1;
    }

    public int getWindow() {
        return window;
    }
}
