package dev.mars.mq.core.provider;

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

import dev.mars.mq.api.Broker;
import dev.mars.mq.api.BrokerProvider;
import dev.mars.mq.api.BrokerRegistrar;
import dev.mars.mq.api.error.MqErrorCodes;
import dev.mars.mq.api.error.MqException;
import dev.mars.mq.api.error.UnsupportedSchemeException;
import dev.mars.mq.core.config.MqConfiguration;
import dev.mars.mq.core.metrics.MqMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Registry of broker creators keyed by URI scheme.
 *
 * <p>Backends register themselves through their registrar, for instance
 * {@code MemoryBrokerRegistrar.registerWith(provider)}. The configuration and
 * metrics of the provider are handed to every creator under
 * {@link #CONFIGURATION_KEY} and {@link #METRICS_KEY}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class DefaultBrokerProvider implements BrokerProvider, BrokerRegistrar {

    private static final Logger logger = LoggerFactory.getLogger(DefaultBrokerProvider.class);

    public static final String CONFIGURATION_KEY = "mqConfiguration";
    public static final String METRICS_KEY = "mqMetrics";

    private static final Pattern SCHEME = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.\\-]*)://.*$", Pattern.DOTALL);

    private final Map<String, BrokerCreator> brokerCreators = new ConcurrentHashMap<>();

    private final MqConfiguration configuration;
    private final MqMetrics metrics;

    public DefaultBrokerProvider() {
        this(null, null);
    }

    public DefaultBrokerProvider(MqConfiguration configuration) {
        this(configuration, null);
    }

    public DefaultBrokerProvider(MqConfiguration configuration, MqMetrics metrics) {
        this.configuration = configuration;
        this.metrics = metrics;
        logger.info("DefaultBrokerProvider initialized - brokers should be registered by their respective modules");
    }

    @Override
    public Broker newBroker(String uri) throws MqException {
        return newBroker(uri, new HashMap<>());
    }

    @Override
    public Broker newBroker(String uri, Map<String, Object> configuration) throws MqException {
        String scheme = parseScheme(uri);

        BrokerCreator creator = brokerCreators.get(scheme);
        if (creator == null) {
            throw new UnsupportedSchemeException(scheme, "Unsupported broker scheme: " + scheme +
                ". Available schemes: " + brokerCreators.keySet() +
                ". Please ensure the backend module is registered.");
        }

        Map<String, Object> effectiveConfiguration = configuration != null ? new HashMap<>(configuration) : new HashMap<>();
        if (this.configuration != null) {
            effectiveConfiguration.putIfAbsent(CONFIGURATION_KEY, this.configuration);
        }
        if (metrics != null) {
            effectiveConfiguration.putIfAbsent(METRICS_KEY, metrics);
        }

        try {
            logger.info("Creating broker for scheme: {}", scheme);
            Broker broker = creator.create(uri, effectiveConfiguration);
            logger.info("Successfully created {} broker", broker.getBrokerType());
            return broker;
        } catch (MqException e) {
            logger.error("Failed to create broker for scheme: {}", scheme, e);
            throw e;
        } catch (Exception e) {
            logger.error("Failed to create broker for scheme: {}", scheme, e);
            throw new MqException(MqErrorCodes.BROKER_CREATE_FAILED, "Failed to create broker: " + e.getMessage(), e);
        }
    }

    /**
     * Extracts the lower-cased scheme of a broker URI.
     *
     * @throws UnsupportedSchemeException if the URI has no {@code scheme://} prefix
     */
    static String parseScheme(String uri) throws UnsupportedSchemeException {
        if (uri == null) {
            throw new UnsupportedSchemeException(null, "Broker URI cannot be null");
        }
        Matcher matcher = SCHEME.matcher(uri.trim());
        if (!matcher.matches()) {
            throw new UnsupportedSchemeException(null, "Malformed broker URI: " + uri);
        }
        return matcher.group(1).toLowerCase();
    }

    @Override
    public Set<String> getSupportedSchemes() {
        return Set.copyOf(brokerCreators.keySet());
    }

    @Override
    public boolean isSchemeSupported(String scheme) {
        return scheme != null && brokerCreators.containsKey(scheme.toLowerCase());
    }

    @Override
    public void registerBroker(String scheme, BrokerCreator creator) {
        if (scheme == null || scheme.trim().isEmpty()) {
            throw new IllegalArgumentException("Scheme cannot be null or empty");
        }
        if (creator == null) {
            throw new IllegalArgumentException("Broker creator cannot be null");
        }

        brokerCreators.put(scheme.trim().toLowerCase(), creator);
        logger.info("Registered broker creator for scheme: {}", scheme);
    }

    @Override
    public void unregisterBroker(String scheme) {
        if (scheme != null) {
            brokerCreators.remove(scheme.trim().toLowerCase());
            logger.info("Unregistered broker creator for scheme: {}", scheme);
        }
    }

    /**
     * Gets the configuration handed to a broker creator, or a freshly loaded one
     * when the caller passed none.
     */
    public static MqConfiguration configurationFrom(Map<String, Object> configuration) {
        Object value = configuration != null ? configuration.get(CONFIGURATION_KEY) : null;
        return value instanceof MqConfiguration ? (MqConfiguration) value : new MqConfiguration();
    }

    /**
     * Gets the metrics handed to a broker creator, or no-op metrics when the caller passed none.
     */
    public static MqMetrics metricsFrom(Map<String, Object> configuration) {
        Object value = configuration != null ? configuration.get(METRICS_KEY) : null;
        return value instanceof MqMetrics ? (MqMetrics) value : MqMetrics.noop();
    }

    public MqConfiguration getConfiguration() {
        return configuration;
    }

    public MqMetrics getMetrics() {
        return metrics;
    }
}
