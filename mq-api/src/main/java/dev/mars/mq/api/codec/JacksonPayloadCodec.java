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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.mq.api.error.CodecException;
import dev.mars.mq.api.error.MqErrorCodes;
import org.msgpack.jackson.dataformat.MessagePackFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link PayloadCodec} backed by a Jackson {@link ObjectMapper}. The same class
 * serves JSON, YAML and MessagePack; only the underlying factory differs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class JacksonPayloadCodec implements PayloadCodec {

    private final String contentType;
    private final ObjectMapper objectMapper;

    public JacksonPayloadCodec(String contentType, ObjectMapper objectMapper) {
        this.contentType = Objects.requireNonNull(contentType, "Content type cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
    }

    public static JacksonPayloadCodec json() {
        return new JacksonPayloadCodec(ContentTypes.JSON, configure(new ObjectMapper()));
    }

    public static JacksonPayloadCodec yaml() {
        return new JacksonPayloadCodec(ContentTypes.YAML, configure(new ObjectMapper(new YAMLFactory())));
    }

    public static JacksonPayloadCodec msgpack() {
        return new JacksonPayloadCodec(ContentTypes.MSGPACK, configure(new ObjectMapper(new MessagePackFactory())));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Override
    public String getContentType() {
        return contentType;
    }

    @Override
    public byte[] encode(Object payload) throws CodecException {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new CodecException(MqErrorCodes.ENCODE_FAILED,
                "Failed to encode payload as " + contentType + ": " + e.getMessage(), e);
        }
    }

    @Override
    public <T> T decode(byte[] raw, Class<T> type) throws CodecException {
        try {
            return objectMapper.readValue(raw, type);
        } catch (IOException e) {
            throw new CodecException(MqErrorCodes.DECODE_FAILED,
                "Failed to decode " + contentType + " payload into " + type.getName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public <T> T decode(byte[] raw, TypeReference<T> type) throws CodecException {
        try {
            return objectMapper.readValue(raw, type);
        } catch (IOException e) {
            throw new CodecException(MqErrorCodes.DECODE_FAILED,
                "Failed to decode " + contentType + " payload into " + type.getType() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "JacksonPayloadCodec{contentType='" + contentType + "'}";
    }
}
