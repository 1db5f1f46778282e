package dev.mars.mq.api.codec;

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

import com.fasterxml.jackson.core.type.TypeReference;
import dev.mars.mq.api.error.CodecException;

/**
 * Encodes job payloads to their wire bytes and back for one content type.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public interface PayloadCodec {

    /**
     * Gets the content type this codec produces and accepts.
     *
     * @return the content type, e.g. {@code application/json}
     */
    String getContentType();

    /**
     * Encodes the payload.
     *
     * @param payload the payload, may be {@code null}
     * @return the encoded bytes
     * @throws CodecException if the payload cannot be represented in this format
     */
    byte[] encode(Object payload) throws CodecException;

    /**
     * Decodes the bytes into an instance of the given type.
     *
     * @param raw the encoded bytes
     * @param type the target type
     * @return the decoded payload
     * @throws CodecException if the bytes do not match the expected shape
     */
    <T> T decode(byte[] raw, Class<T> type) throws CodecException;

    /**
     * Decodes the bytes into an instance of the given generic type.
     *
     * @param raw the encoded bytes
     * @param type the target type reference
     * @return the decoded payload
     * @throws CodecException if the bytes do not match the expected shape
     */
    <T> T decode(byte[] raw, TypeReference<T> type) throws CodecException;
}
