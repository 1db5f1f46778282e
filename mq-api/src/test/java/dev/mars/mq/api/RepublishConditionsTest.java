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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class RepublishConditionsTest {

    @Test
    void testNoConditionsMatchesEverything() {
        Job job = Job.create();
        assertTrue(RepublishConditions.complyAll(job));
        assertTrue(RepublishConditions.complyAll(job, (RepublishCondition[]) null));
    }

    @Test
    void testConditionsAreConjunctive() {
        Job job = Job.create();
        job.setErrorType("timeout");
        job.setRetries(2);
        job.setPriority(Priority.HIGH);

        assertTrue(RepublishConditions.complyAll(job,
                RepublishConditions.errorTypeIs("timeout"),
                RepublishConditions.retriesAtMost(3),
                RepublishConditions.priorityAtLeast(Priority.NORMAL)));

        assertFalse(RepublishConditions.complyAll(job,
                RepublishConditions.errorTypeIs("timeout"),
                RepublishConditions.retriesAtMost(1)));

        assertFalse(RepublishConditions.complyAll(job,
                RepublishConditions.priorityAtLeast(Priority.URGENT)));
    }
}
