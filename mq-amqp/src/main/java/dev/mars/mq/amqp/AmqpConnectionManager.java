package dev.mars.mq.amqp;

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

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import dev.mars.mq.api.error.AlreadyClosedException;
import dev.mars.mq.api.error.ConnectionLostException;
import dev.mars.mq.api.error.MqErrorCodes;
import dev.mars.mq.api.error.MqException;
import dev.mars.mq.api.error.ReconnectFailedException;
import dev.mars.mq.core.metrics.MqMetrics;
import dev.mars.mq.core.resilience.ExponentialBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the AMQP connection of a broker and re-establishes it when it is lost.
 *
 * <p>The client library's automatic recovery is disabled. When the connection
 * shuts down without the application asking for it, a single background thread
 * reconnects with exponential backoff. Callers needing a connection meanwhile
 * wait; once the backoff gives up they get {@link ReconnectFailedException}.
 * Recovery listeners run after each successful reconnect so queues can declare
 * their topology again.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class AmqpConnectionManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AmqpConnectionManager.class);
    private static final AtomicInteger MANAGER_IDS = new AtomicInteger();

    static final String CONNECTION_NAME = "mq-amqp";

    enum State {
        NEW,
        CONNECTED,
        RECONNECTING,
        FAILED,
        CLOSED
    }

    /**
     * Callback run with the new connection after a reconnect.
     */
    @FunctionalInterface
    public interface RecoveryListener {
        void onRecovery(Connection connection) throws IOException;
    }

    private final ConnectionFactory factory;
    private final ExponentialBackoff backoff;
    private final MqMetrics metrics;
    private final List<RecoveryListener> recoveryListeners = new CopyOnWriteArrayList<>();
    private final ExecutorService reconnectExecutor;

    private final Object lock = new Object();
    private Connection connection;
    private State state = State.NEW;
    private int reconnects;

    public AmqpConnectionManager(String uri, AmqpConfiguration config, MqMetrics metrics) throws MqException {
        this(newFactory(uri), config, metrics);
    }

    AmqpConnectionManager(ConnectionFactory factory, AmqpConfiguration config, MqMetrics metrics) {
        this.factory = factory;
        this.factory.setAutomaticRecoveryEnabled(false);
        this.factory.setTopologyRecoveryEnabled(false);
        this.backoff = new ExponentialBackoff(config.getBackoff());
        this.metrics = metrics != null ? metrics : MqMetrics.noop();

        int managerId = MANAGER_IDS.incrementAndGet();
        this.reconnectExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "mq-amqp-reconnect-" + managerId);
            t.setDaemon(true);
            return t;
        });
    }

    private static ConnectionFactory newFactory(String uri) throws MqException {
        ConnectionFactory factory = new ConnectionFactory();
        try {
            factory.setUri(uri);
        } catch (Exception e) {
            throw new MqException(MqErrorCodes.BROKER_CREATE_FAILED, "Invalid AMQP URI: " + uri, e);
        }
        return factory;
    }

    /**
     * Opens the initial connection. A single attempt is made.
     *
     * @throws ConnectionLostException if the broker cannot be reached
     */
    public void connect() throws MqException {
        Connection newConnection;
        try {
            newConnection = factory.newConnection(CONNECTION_NAME);
        } catch (IOException | TimeoutException e) {
            throw new ConnectionLostException("Cannot connect to AMQP broker at " + describeEndpoint(), e);
        }
        newConnection.addShutdownListener(cause -> onShutdown(newConnection, cause));
        synchronized (lock) {
            if (state != State.NEW) {
                closeQuietly(newConnection);
                throw new AlreadyClosedException("AMQP connection manager is already " + state.name().toLowerCase());
            }
            connection = newConnection;
            state = State.CONNECTED;
            lock.notifyAll();
        }
        logger.info("Connected to AMQP broker at {}", describeEndpoint());
    }

    /**
     * Gets the current connection, waiting while a reconnect is in progress.
     */
    public Connection getConnection() throws MqException {
        synchronized (lock) {
            while (state == State.RECONNECTING) {
                try {
                    lock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new MqException(MqErrorCodes.INTERRUPTED, "Interrupted while waiting for AMQP reconnection", e);
                }
            }
            switch (state) {
                case NEW:
                    throw new ConnectionLostException("AMQP connection has not been opened");
                case CLOSED:
                    throw new AlreadyClosedException("AMQP connection is closed");
                case FAILED:
                    throw new ReconnectFailedException("Could not reconnect to AMQP broker at " + describeEndpoint());
                default:
                    return connection;
            }
        }
    }

    /**
     * Opens a channel on the current connection, waiting across a reconnect if needed.
     */
    public Channel createChannel() throws MqException {
        while (true) {
            Connection current = getConnection();
            try {
                Channel channel = current.createChannel();
                if (channel == null) {
                    throw new ConnectionLostException("No channel available on AMQP connection");
                }
                return channel;
            } catch (IOException | ShutdownSignalException e) {
                if (current.isOpen()) {
                    throw new ConnectionLostException("Cannot open AMQP channel", e);
                }
                logger.warn("AMQP connection lost while opening a channel, waiting for reconnection");
                connectionLost(current);
            }
        }
    }

    public void addRecoveryListener(RecoveryListener listener) {
        recoveryListeners.add(listener);
    }

    public void removeRecoveryListener(RecoveryListener listener) {
        recoveryListeners.remove(listener);
    }

    private void onShutdown(Connection lost, ShutdownSignalException cause) {
        if (cause.isInitiatedByApplication()) {
            logger.debug("AMQP connection closed by application");
            return;
        }
        logger.warn("AMQP connection lost: {}", cause.getMessage());
        connectionLost(lost);
    }

    /**
     * Starts the reconnect loop unless it is already running for this connection.
     */
    void connectionLost(Connection lost) {
        synchronized (lock) {
            if (state != State.CONNECTED || connection != lost) {
                return;
            }
            state = State.RECONNECTING;
        }
        reconnectExecutor.execute(this::reconnectLoop);
    }

    private void reconnectLoop() {
        int attempt = 0;
        while (true) {
            attempt++;
            Duration delay = backoff.delayForAttempt(attempt);
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.debug("Reconnect loop interrupted");
                return;
            }
            if (isClosed()) {
                return;
            }

            Connection newConnection;
            try {
                newConnection = factory.newConnection(CONNECTION_NAME);
            } catch (IOException | TimeoutException e) {
                logger.warn("Reconnect attempt {} to {} failed: {}", attempt, describeEndpoint(), e.getMessage());
                if (!backoff.canRetry(attempt)) {
                    logger.error("Giving up reconnecting to AMQP broker at {} after {} attempts", describeEndpoint(), attempt);
                    synchronized (lock) {
                        if (state == State.RECONNECTING) {
                            state = State.FAILED;
                        }
                        lock.notifyAll();
                    }
                    return;
                }
                continue;
            }

            newConnection.addShutdownListener(cause -> onShutdown(newConnection, cause));
            synchronized (lock) {
                if (state == State.CLOSED) {
                    closeQuietly(newConnection);
                    return;
                }
                connection = newConnection;
                state = State.CONNECTED;
                reconnects++;
                lock.notifyAll();
            }
            metrics.recordReconnect(AmqpBroker.BROKER_TYPE);
            logger.info("Reconnected to AMQP broker at {} after {} attempts", describeEndpoint(), attempt);

            for (RecoveryListener listener : recoveryListeners) {
                try {
                    listener.onRecovery(newConnection);
                } catch (IOException | RuntimeException e) {
                    logger.warn("Recovery listener failed after reconnect", e);
                }
            }
            return;
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return state == State.CLOSED;
        }
    }

    State getState() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Gets the number of successful reconnects since the manager was created.
     */
    public int getReconnectCount() {
        synchronized (lock) {
            return reconnects;
        }
    }

    @Override
    public void close() throws MqException {
        Connection toClose;
        synchronized (lock) {
            if (state == State.CLOSED) {
                return;
            }
            state = State.CLOSED;
            toClose = connection;
            connection = null;
            lock.notifyAll();
        }
        reconnectExecutor.shutdownNow();
        recoveryListeners.clear();

        if (toClose != null && toClose.isOpen()) {
            try {
                toClose.close();
                logger.info("Closed AMQP connection to {}", describeEndpoint());
            } catch (IOException e) {
                throw new MqException(MqErrorCodes.INTERNAL_ERROR, "Failed to close AMQP connection", e);
            }
        }
    }

    private void closeQuietly(Connection stale) {
        try {
            stale.close();
        } catch (IOException | RuntimeException e) {
            logger.debug("Ignoring failure while closing connection opened after shutdown", e);
        }
    }

    private String describeEndpoint() {
        return factory.getHost() + ":" + factory.getPort() + factory.getVirtualHost();
    }
}
