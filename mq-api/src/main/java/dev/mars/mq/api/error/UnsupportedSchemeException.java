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
 * Thrown when no broker creator is registered for the scheme of a broker URI,
 * or when the URI has no usable scheme at all.
 */
public class UnsupportedSchemeException extends MqException {

    private static final long serialVersionUID = 1L;

    private final String scheme;

    public UnsupportedSchemeException(String scheme, String message) {
        super(MqErrorCodes.UNSUPPORTED_SCHEME, message);
        this.scheme = scheme;
    }

    public UnsupportedSchemeException(String scheme, String message, Throwable cause) {
        super(MqErrorCodes.UNSUPPORTED_SCHEME, message, cause);
        this.scheme = scheme;
    }

    /**
     * @return the offending scheme, or {@code null} if the URI had none
     */
    public String getScheme() {
        return scheme;
    }
}
