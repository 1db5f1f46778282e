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
 * Thrown synchronously by payload encoding and decoding, either because the
 * content type is not recognized or because the payload does not match the
 * expected shape.
 */
public class CodecException extends MqException {

    private static final long serialVersionUID = 1L;

    public CodecException(String code, String message) {
        super(code, message);
    }

    public CodecException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }

    public static CodecException unknownContentType(String contentType) {
        return new CodecException(MqErrorCodes.UNKNOWN_CONTENT_TYPE, "unknown content type: " + contentType);
    }
}
