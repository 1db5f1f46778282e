package dev.mars.mq.api.error;

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
 * Thrown by operations attempted on a closed iterator or broker.
 */
public class AlreadyClosedException extends MqException {

    private static final long serialVersionUID = 1L;

    public AlreadyClosedException() {
        super(MqErrorCodes.ALREADY_CLOSED, "already closed");
    }

    public AlreadyClosedException(String message) {
        super(MqErrorCodes.ALREADY_CLOSED, message);
    }

    public AlreadyClosedException(String message, Throwable cause) {
        super(MqErrorCodes.ALREADY_CLOSED, message, cause);
    }
}
