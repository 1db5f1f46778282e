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
import dev.mars.mq.api.Queue;
import dev.mars.mq.api.RepublishCondition;
import dev.mars.mq.api.RepublishConditions;
import dev.mars.mq.api.TxCallback;
import dev.mars.mq.api.error.AlreadyClosedException;
import dev.mars.mq.api.error.EmptyJobException;
import dev.mars.mq.api.error.MqErrorCodes;
import dev.mars.mq.api.error.MqException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory queue. Pending jobs are handed out highest priority first, in
 * publication order within a priority. A dequeued job leaves the pending set,
 * so iterators over the same queue compete for jobs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class MemoryQueue implements Queue {

    private static final Logger logger = LoggerFactory.getLogger(MemoryQueue.class);

    private static final Comparator<Entry> DISPATCH_ORDER = Comparator
        .comparingInt((Entry e) -> e.job.getPriority() != null ? e.job.getPriority().getValue() : 0)
        .reversed()
        .thenComparingLong(e -> e.sequence);

    private final String name;
    private final MemoryBroker broker;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition jobAvailable = lock.newCondition();
    private final PriorityQueue<Entry> pending = new PriorityQueue<>(DISPATCH_ORDER);
    private final List<Job> buried = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    private final Set<MemoryJobIter> iterators = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    MemoryQueue(String name, MemoryBroker broker) {
        this.name = name;
        this.broker = broker;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void publish(Job job) throws MqException {
        validate(job);
        ensureOpen();
        enqueue(List.of(copyOf(job)));
        broker.getMetrics().recordPublished(name);
        logger.debug("Published job {} to queue {}", job.getId(), name);
    }

    @Override
    public void publishDelayed(Job job, Duration delay) throws MqException {
        validate(job);
        Objects.requireNonNull(delay, "Delay cannot be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Delay cannot be negative: " + delay);
        }
        ensureOpen();

        Job copy = copyOf(job);
        try {
            broker.getScheduler().schedule(() -> {
                if (!closed) {
                    enqueue(List.of(copy));
                    broker.getMetrics().recordPublished(name);
                    logger.debug("Delayed job {} is now visible in queue {}", copy.getId(), name);
                }
            }, delay.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            throw new AlreadyClosedException("Broker is closed", e);
        }
        logger.debug("Scheduled job {} on queue {} with delay {}", job.getId(), name, delay);
    }

    @Override
    public void transaction(TxCallback callback) throws MqException {
        Objects.requireNonNull(callback, "Transaction callback cannot be null");
        ensureOpen();

        MemoryTransactionQueue staging = new MemoryTransactionQueue(name);
        try {
            callback.execute(staging);
        } catch (MqException e) {
            logger.debug("Transaction on queue {} failed, discarding {} staged jobs", name, staging.getStaged().size());
            throw e;
        } catch (Exception e) {
            logger.debug("Transaction on queue {} failed, discarding {} staged jobs", name, staging.getStaged().size());
            throw new MqException(MqErrorCodes.TRANSACTION_FAILED, "Transaction callback failed: " + e.getMessage(), e);
        }

        List<Job> staged = staging.getStaged();
        enqueue(staged);
        staged.forEach(job -> broker.getMetrics().recordPublished(name));
        logger.debug("Committed transaction with {} jobs on queue {}", staged.size(), name);
    }

    @Override
    public JobIter consume(int advertisedWindow) throws MqException {
        ensureOpen();
        MemoryJobIter iter = new MemoryJobIter(this, advertisedWindow);
        iterators.add(iter);
        logger.debug("Opened iterator on queue {} with window {}", name, advertisedWindow);
        return iter;
    }

    @Override
    public void republishBuried(RepublishCondition... conditions) throws MqException {
        ensureOpen();
        int republished = 0;
        lock.lock();
        try {
            Iterator<Job> it = buried.iterator();
            while (it.hasNext()) {
                Job job = it.next();
                if (RepublishConditions.complyAll(job, conditions)) {
                    it.remove();
                    job.setErrorType("");
                    pending.add(new Entry(job, sequence.getAndIncrement()));
                    republished++;
                }
            }
            if (republished > 0) {
                jobAvailable.signalAll();
            }
        } finally {
            lock.unlock();
        }
        for (int i = 0; i < republished; i++) {
            broker.getMetrics().recordRepublished(name);
        }
        logger.debug("Republished {} buried jobs on queue {}", republished, name);
    }

    /**
     * Removes the next job without waiting.
     */
    Entry poll() {
        lock.lock();
        try {
            return pending.poll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the next job, waiting up to the timeout for one to be published.
     */
    Entry poll(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (pending.isEmpty()) {
                if (nanos <= 0) {
                    return null;
                }
                nanos = jobAvailable.awaitNanos(nanos);
            }
            return pending.poll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts a rejected delivery back as a new pending job. The consumer keeps
     * its own instance, so the stored job is a copy.
     */
    void requeue(Job job) {
        enqueue(List.of(copyOf(job)));
        logger.debug("Requeued job {} on queue {}", job.getId(), name);
    }

    /**
     * Returns a job that was dequeued but never handed out, keeping its place.
     */
    void putBack(Entry entry) {
        lock.lock();
        try {
            pending.add(entry);
            jobAvailable.signalAll();
        } finally {
            lock.unlock();
        }
        logger.debug("Put back job {} on queue {}", entry.job.getId(), name);
    }

    void bury(Job job) {
        lock.lock();
        try {
            buried.add(copyOf(job));
        } finally {
            lock.unlock();
        }
        logger.debug("Buried job {} on queue {} with error type '{}'", job.getId(), name, job.getErrorType());
    }

    /**
     * Gets the number of jobs waiting to be delivered.
     */
    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gets the number of buried jobs.
     */
    public int buriedCount() {
        lock.lock();
        try {
            return buried.size();
        } finally {
            lock.unlock();
        }
    }

    MemoryBroker getBroker() {
        return broker;
    }

    void removeIterator(MemoryJobIter iter) {
        iterators.remove(iter);
    }

    void close() {
        closed = true;
        for (MemoryJobIter iter : new ArrayList<>(iterators)) {
            iter.close();
        }
        iterators.clear();
    }

    private void enqueue(List<Job> jobs) {
        if (jobs.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            for (Job job : jobs) {
                pending.add(new Entry(job, sequence.getAndIncrement()));
            }
            jobAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void ensureOpen() throws AlreadyClosedException {
        if (closed) {
            throw new AlreadyClosedException("Queue " + name + " belongs to a closed broker");
        }
    }

    static void validate(Job job) throws EmptyJobException {
        if (job == null || job.size() == 0) {
            throw new EmptyJobException();
        }
    }

    /**
     * Copies the job so that later changes by the publisher do not leak into the queue.
     */
    static Job copyOf(Job job) {
        Job copy = new Job();
        copy.setId(job.getId());
        copy.setPriority(job.getPriority());
        copy.setTimestamp(job.getTimestamp());
        copy.setRetries(job.getRetries());
        copy.setErrorType(job.getErrorType());
        copy.setContentType(job.getContentType());
        copy.setRaw(job.getRaw().clone());
        return copy;
    }

    static final class Entry {
        private final Job job;
        private final long sequence;

        private Entry(Job job, long sequence) {
            this.job = job;
            this.sequence = sequence;
        }

        Job job() {
            return job;
        }
    }

    @Override
    public String toString() {
        return "MemoryQueue{name='" + name + "'}";
    }
}
