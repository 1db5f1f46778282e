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

import dev.mars.mq.api.error.CodecException;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lookup of payload codecs by content type. MessagePack, JSON and YAML are
 * available out of the box; further codecs can be registered at startup.
 */
public final class PayloadCodecs {

    private static final Map<String, PayloadCodec> CODECS = new ConcurrentHashMap<>();

    static {
        register(JacksonPayloadCodec.msgpack());
        register(JacksonPayloadCodec.json());
        register(JacksonPayloadCodec.yaml());
    }

    private PayloadCodecs() {
        // Utility class - no instantiation
    }

    /**
     * Registers a codec, replacing any codec previously registered for the same content type.
     */
    public static void register(PayloadCodec codec) {
        if (codec == null || codec.getContentType() == null || codec.getContentType().isBlank()) {
            throw new IllegalArgumentException("Codec and its content type cannot be null or empty");
        }
        CODECS.put(normalize(codec.getContentType()), codec);
    }

    /**
     * Gets the codec for a content type. Parameters such as {@code ; charset=utf-8} are ignored.
     *
     * @throws CodecException if no codec handles the content type
     */
    public static PayloadCodec forContentType(String contentType) throws CodecException {
        PayloadCodec codec = contentType != null ? CODECS.get(normalize(contentType)) : null;
        if (codec == null) {
            throw CodecException.unknownContentType(contentType);
        }
        return codec;
    }

    public static boolean isSupported(String contentType) {
        return contentType != null && CODECS.containsKey(normalize(contentType));
    }

    public static Set<String> getSupportedContentTypes() {
        return Set.copyOf(CODECS.keySet());
    }

    private static String normalize(String contentType) {
        int separator = contentType.indexOf(';');
        String base = separator >= 0 ? contentType.substring(0, separator) : contentType;
        return base.trim().toLowerCase();
    }
}
