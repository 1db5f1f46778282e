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

import dev.mars.mq.api.error.MqException;

import java.util.Map;
import java.util.Set;

/**
 * Creates brokers from URIs, dispatching on the scheme.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public interface BrokerProvider {

    /**
     * Creates a broker using the provider's default configuration.
     *
     * @throws dev.mars.mq.api.error.UnsupportedSchemeException if the URI is malformed or its scheme is unknown
     */
    Broker newBroker(String uri) throws MqException;

    /**
     * Creates a broker with additional configuration entries passed to the backend.
     */
    Broker newBroker(String uri, Map<String, Object> configuration) throws MqException;

    Set<String> getSupportedSchemes();

    boolean isSchemeSupported(String scheme);
}
