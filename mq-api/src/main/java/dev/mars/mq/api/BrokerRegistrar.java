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

import java.util.Map;

/**
 * Registration side of the broker registry. Backends register a creator for
 * the URI schemes they handle; schemes are case-insensitive.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public interface BrokerRegistrar {

    /**
     * Registers a creator for a scheme, replacing any previous one.
     */
    void registerBroker(String scheme, BrokerCreator creator);

    /**
     * Removes the creator for a scheme. Unknown schemes are ignored.
     */
    void unregisterBroker(String scheme);

    /**
     * Creates a broker for a URI of a registered scheme.
     */
    @FunctionalInterface
    interface BrokerCreator {
        Broker create(String uri, Map<String, Object> configuration) throws Exception;
    }
}
