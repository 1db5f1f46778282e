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

import dev.mars.mq.api.error.MqException;

/**
 * Iterator over the jobs of a {@link Queue}. Safe for use by several threads.
 *
 * <p>{@link #next()} blocks until a job is available; closing the iterator is
 * the only way to unblock it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public interface JobIter extends AutoCloseable {

    /**
     * Waits for the next job. The returned job must be acknowledged with
     * {@link Job#ack()} or {@link Job#reject(boolean)} to free its window slot.
     *
     * @throws dev.mars.mq.api.error.AlreadyClosedException if the iterator is or becomes closed
     * @throws dev.mars.mq.api.error.EndOfStreamException if the backend is finite and the queue is empty
     */
    Job next() throws MqException;

    boolean isClosed();

    /**
     * Closes the iterator. Idempotent; blocked {@link #next()} callers fail at their next poll.
     */
    @Override
    void close();
}
