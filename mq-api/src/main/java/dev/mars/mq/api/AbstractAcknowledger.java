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
import dev.mars.mq.api.error.MqException;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for backend acknowledgers. Guards the single
 * {@code PENDING -> ACKED | REJECTED} transition so backends only implement
 * the disposition itself; a second call fails with {@link CannotAcknowledgeException}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public abstract class AbstractAcknowledger implements Acknowledger {

    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);

    protected final Job job;

    protected AbstractAcknowledger(Job job) {
        this.job = Objects.requireNonNull(job, "Job cannot be null");
    }

    @Override
    public final void ack() throws MqException {
        settle(State.ACKED);
        doAck();
    }

    @Override
    public final void reject(boolean requeue) throws MqException {
        settle(State.REJECTED);
        doReject(requeue);
    }

    @Override
    public State getState() {
        return state.get();
    }

    private void settle(State target) throws CannotAcknowledgeException {
        if (!state.compareAndSet(State.PENDING, target)) {
            throw new CannotAcknowledgeException(
                "can't acknowledge job " + job.getId() + ", it was already " + state.get().name().toLowerCase());
        }
    }

    /**
     * Performs the acknowledgement. Called at most once.
     */
    protected abstract void doAck() throws MqException;

    /**
     * Performs the rejection. Called at most once, and never after {@link #doAck()}.
     */
    protected abstract void doReject(boolean requeue) throws MqException;
}
