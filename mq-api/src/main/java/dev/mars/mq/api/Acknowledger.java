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
 * Acknowledgement capability attached to a job when a {@link JobIter} delivers it.
 * Once the job is acknowledged through either method it is considered delivered
 * by the queue; an acknowledger can be used exactly once.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public interface Acknowledger {

    /**
     * Called when the job has finished.
     *
     * @throws MqException with code {@code CANNOT_ACKNOWLEDGE} if the job was already acknowledged
     */
    void ack() throws MqException;

    /**
     * Called when the job has errored.
     *
     * @param requeue {@code true} to put the job back in the queue, {@code false}
     *                to move it to the buried queue until it is republished
     * @throws MqException with code {@code CANNOT_ACKNOWLEDGE} if the job was already acknowledged
     */
    void reject(boolean requeue) throws MqException;

    /**
     * Gets the disposition state of the delivery.
     */
    State getState();

    /**
     * Disposition state of a single delivery.
     */
    enum State {
        /** Delivered, waiting for ack or reject. */
        PENDING,
        ACKED,
        REJECTED
    }
}
