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
 * Thrown once the reconnect loop has used up its configured attempts.
 */
public class ReconnectFailedException extends MqException {

    private static final long serialVersionUID = 1L;

    public ReconnectFailedException() {
        super(MqErrorCodes.RECONNECT_FAILED, "reconnection attempts exhausted");
    }

    public ReconnectFailedException(String message) {
        super(MqErrorCodes.RECONNECT_FAILED, message);
    }

    public ReconnectFailedException(String message, Throwable cause) {
        super(MqErrorCodes.RECONNECT_FAILED, message, cause);
    }
}
