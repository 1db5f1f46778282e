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
import dev.mars.mq.api.TxCallback;
import dev.mars.mq.api.error.MqErrorCodes;
import dev.mars.mq.api.error.MqException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Staging queue handed to a transaction callback. Publishes are buffered and
 * merged into the real queue only when the callback succeeds; delayed publishes
 * are staged immediately.
 */
class MemoryTransactionQueue implements Queue {

    private final String name;
    private final List<Job> staged = new ArrayList<>();

    MemoryTransactionQueue(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public synchronized void publish(Job job) throws MqException {
        MemoryQueue.validate(job);
        staged.add(MemoryQueue.copyOf(job));
    }

    @Override
    public void publishDelayed(Job job, Duration delay) throws MqException {
        publish(job);
    }

    @Override
    public void transaction(TxCallback callback) throws MqException {
        throw invalid("nested transactions");
    }

    @Override
    public JobIter consume(int advertisedWindow) throws MqException {
        throw invalid("consume");
    }

    @Override
    public void republishBuried(RepublishCondition... conditions) throws MqException {
        throw invalid("republishBuried");
    }

    synchronized List<Job> getStaged() {
        return new ArrayList<>(staged);
    }

    private MqException invalid(String operation) {
        return new MqException(MqErrorCodes.INVALID_OPERATION,
            operation + " is not allowed inside a transaction on queue " + name);
    }
}
