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

import dev.mars.mq.api.AbstractAcknowledger;
import dev.mars.mq.api.Job;

import java.util.concurrent.Semaphore;

/**
 * Acknowledger of a job delivered by a {@link MemoryJobIter}. Both outcomes
 * give the window slot back once the disposition is done.
 */
class MemoryAcknowledger extends AbstractAcknowledger {

    private final MemoryQueue queue;
    private final Semaphore slots;

    MemoryAcknowledger(Job job, MemoryQueue queue, Semaphore slots) {
        super(job);
        this.queue = queue;
        this.slots = slots;
    }

    @Override
    protected void doAck() {
        release();
        queue.getBroker().getMetrics().recordAcked(queue.getName());
    }

    @Override
    protected void doReject(boolean requeue) {
        try {
            if (requeue) {
                queue.requeue(job);
            } else {
                queue.bury(job);
            }
            queue.getBroker().getMetrics().recordRejected(queue.getName(), requeue);
        } finally {
            release();
        }
    }

    private void release() {
        if (slots != null) {
            slots.release();
        }
    }
}
