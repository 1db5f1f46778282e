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

import java.util.Objects;

/**
 * Factory and evaluation helpers for {@link RepublishCondition}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class RepublishConditions {

    private RepublishConditions() {
    }

    /**
     * Checks whether the job complies with every condition. An empty or null
     * condition list matches everything.
     */
    public static boolean complyAll(Job job, RepublishCondition... conditions) {
        if (conditions == null) {
            return true;
        }
        for (RepublishCondition condition : conditions) {
            if (condition != null && !condition.test(job)) {
                return false;
            }
        }
        return true;
    }

    public static RepublishCondition errorTypeIs(String errorType) {
        return job -> Objects.equals(job.getErrorType(), errorType);
    }

    public static RepublishCondition retriesAtMost(int retries) {
        return job -> job.getRetries() <= retries;
    }

    public static RepublishCondition priorityAtLeast(Priority priority) {
        return job -> job.getPriority() != null && job.getPriority().getValue() >= priority.getValue();
    }
}
