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
 * Base exception for every failure reported by a {@code Broker}, {@code Queue},
 * {@code JobIter} or {@code Acknowledger}.
 *
 * <p>Each instance carries one of the codes defined in {@link MqErrorCodes} so that
 * embedding callers can tell error kinds apart without depending on concrete
 * exception types.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class MqException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String code;

    public MqException(String code, String message) {
        super(message);
        this.code = code;
    }

    public MqException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Gets the standard error code of this failure.
     *
     * @return the error code, e.g. {@code MQERR0050}
     */
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}
