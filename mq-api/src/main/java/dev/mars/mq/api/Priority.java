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

/**
 * Priority levels of a job. Levels are numerically comparable and travel over
 * the wire as their numeric value.
 *
 * <p>Consumers prefer higher priority jobs when several are available at the
 * time of consumption. This is a best-effort ordering, not a guarantee that
 * survives restarts.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public enum Priority {
    LOW(0),
    NORMAL(4),
    HIGH(6),
    URGENT(8);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * Maps a wire value back to a level. Values between levels map to the
     * highest level not above them; anything below zero maps to {@link #LOW}.
     *
     * @param value the numeric priority
     * @return the matching level
     */
    public static Priority fromValue(int value) {
        Priority result = LOW;
        for (Priority priority : values()) {
            if (priority.value <= value) {
                result = priority;
            }
        }
        return result;
    }

    /** The highest numeric value any level uses. */
    public static int maxValue() {
        return URGENT.value;
    }
}
