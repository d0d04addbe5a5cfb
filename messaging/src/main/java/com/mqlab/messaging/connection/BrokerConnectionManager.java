package com.mqlab.messaging.connection;

import com.mqlab.messaging.config.MessagingProperties;
import com.mqlab.messaging.exception.BrokerUnavailableException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single logical connection to RabbitMQ.
 *
 * Lifecycle:
 * - {@link #start()} connects once and fails fast if the broker is unreachable
 * - an unexpected shutdown moves to RECOVERING and starts a fixed-interval reconnect loop
 * - on the first successful reconnect every {@link ConnectionStateListener} is told to rebuild its state
 * - {@link #close()} stops reconnecting, closes cached channels, then the connection
 *
 * Channels are created only through this class. Channel acquisition and reconnect attempts share one
 * lock, so a caller never gets a channel from a half-established connection.
 */
@Slf4j
public class BrokerConnectionManager implements ConnectionListener {

    private final CachingConnectionFactory connectionFactory;
    private final MessagingProperties properties;
    private final ScheduledExecutorService reconnectExecutor;
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.NEW);
    private final ReentrantLock connectLock = new ReentrantLock();

    private ScheduledFuture<?> reconnectTask;

    public BrokerConnectionManager(CachingConnectionFactory connectionFactory, MessagingProperties properties) {
        this(connectionFactory, properties, Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "broker-reconnect");
            thread.setDaemon(true);
            return thread;
        }));
    }

    BrokerConnectionManager(CachingConnectionFactory connectionFactory, MessagingProperties properties,
                            ScheduledExecutorService reconnectExecutor) {
        this.connectionFactory = connectionFactory;
        this.properties = properties;
        this.reconnectExecutor = reconnectExecutor;
    }

    /**
     * Build the connection factory from configuration.
     * The underlying client's own recovery stays off; reconnects are driven by this class
     * and by the listener containers.
     */
    public static CachingConnectionFactory createConnectionFactory(MessagingProperties properties) {
        CachingConnectionFactory factory = new CachingConnectionFactory(properties.getHost(), properties.getPort());
        factory.setUsername(properties.getUsername());
        factory.setPassword(properties.getPassword());
        factory.setVirtualHost(properties.getVirtualHost());
        factory.setConnectionTimeout((int) properties.getConnectionTimeout().toMillis());
        factory.setRequestedHeartBeat((int) properties.getRequestedHeartbeat().toSeconds());
        factory.setChannelCacheSize(properties.getChannelCacheSize());
        factory.setPublisherReturns(true);
        factory.setPublisherConfirmType(properties.isPublisherConfirms()
                ? CachingConnectionFactory.ConfirmType.SIMPLE
                : CachingConnectionFactory.ConfirmType.NONE);
        return factory;
    }

    /**
     * Open the connection. Throws {@link BrokerUnavailableException} when the first attempt fails.
     */
    public void start() {
        if (!state.compareAndSet(ConnectionState.NEW, ConnectionState.CONNECTING)) {
            throw new IllegalStateException("Connection manager already started, state=" + state.get());
        }
        connectionFactory.addConnectionListener(this);

        connectLock.lock();
        try {
            connectionFactory.createConnection();
        } catch (AmqpException e) {
            state.set(ConnectionState.FAILED);
            log.error("BROKER_UNAVAILABLE: host={}, port={}, vhost={}",
                    properties.getHost(), properties.getPort(), properties.getVirtualHost(), e);
            throw new BrokerUnavailableException(
                    "RabbitMQ broker unreachable at " + properties.getHost() + ":" + properties.getPort(), e);
        } finally {
            connectLock.unlock();
        }

        state.set(ConnectionState.CONNECTED);
        log.info("RabbitMQ connection established: host={}, port={}, vhost={}",
                properties.getHost(), properties.getPort(), properties.getVirtualHost());
    }

    /**
     * Open a new channel on the current connection. The caller owns the channel and must close it.
     * Do not cache it across a connection loss.
     */
    public Channel acquireChannel() {
        requireOpen();
        connectLock.lock();
        try {
            return connectionFactory.createConnection().createChannel(false);
        } finally {
            connectLock.unlock();
        }
    }

    /**
     * Make sure a live connection exists, reconnecting if the previous one is gone.
     */
    public void ensureConnected() {
        requireOpen();
        connectLock.lock();
        try {
            connectionFactory.createConnection();
        } finally {
            connectLock.unlock();
        }
        if (state.get() == ConnectionState.RECOVERING) {
            markRecovered();
        }
    }

    public void addListener(ConnectionStateListener listener) {
        listeners.add(listener);
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isConnected() {
        return state.get() == ConnectionState.CONNECTED;
    }

    public String getHost() {
        return properties.getHost();
    }

    public int getPort() {
        return properties.getPort();
    }

    @Override
    public void onCreate(Connection connection) {
        // A listener container may reconnect before our own loop does
        if (state.get() == ConnectionState.RECOVERING) {
            reconnectExecutor.execute(this::markRecovered);
        }
    }

    @Override
    public void onShutDown(ShutdownSignalException signal) {
        if (signal.isInitiatedByApplication()) {
            return;
        }
        connectionLost(signal);
    }

    void connectionLost(Throwable cause) {
        if (!state.compareAndSet(ConnectionState.CONNECTED, ConnectionState.RECOVERING)) {
            return;
        }
        log.warn("CONNECTION_LOST: host={}, port={}, cause={}",
                properties.getHost(), properties.getPort(), cause.getMessage());

        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onConnectionLost(cause);
            } catch (RuntimeException e) {
                log.error("Connection listener failed on connection loss: {}", listener, e);
            }
        }

        if (properties.isAutomaticRecovery()) {
            scheduleReconnect();
        } else {
            log.warn("Automatic recovery disabled; connection stays down until the next explicit use");
        }
    }

    private synchronized void scheduleReconnect() {
        if (reconnectTask != null && !reconnectTask.isDone()) {
            return;
        }
        long interval = properties.getNetworkRecoveryInterval().toMillis();
        reconnectTask = reconnectExecutor.scheduleWithFixedDelay(
                this::attemptReconnect, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Reconnecting every {} ms", interval);
    }

    void attemptReconnect() {
        if (state.get() != ConnectionState.RECOVERING) {
            cancelReconnect();
            return;
        }
        connectLock.lock();
        try {
            connectionFactory.createConnection();
        } catch (AmqpException e) {
            log.warn("Reconnect attempt failed: host={}, port={}, cause={}",
                    properties.getHost(), properties.getPort(), e.getMessage());
            return;
        } finally {
            connectLock.unlock();
        }
        markRecovered();
    }

    private void markRecovered() {
        if (!state.compareAndSet(ConnectionState.RECOVERING, ConnectionState.CONNECTED)) {
            return;
        }
        cancelReconnect();
        log.info("CONNECTION_RECOVERED: host={}, port={}", properties.getHost(), properties.getPort());

        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onConnectionRecovered();
            } catch (RuntimeException e) {
                log.error("Connection listener failed after recovery: {}", listener, e);
            }
        }
    }

    private synchronized void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    private void requireOpen() {
        if (state.get() == ConnectionState.CLOSED) {
            throw new IllegalStateException("Broker connection manager is closed");
        }
    }

    /**
     * Stop reconnecting and release the connection. Safe to call more than once.
     */
    public void close() {
        if (state.getAndSet(ConnectionState.CLOSED) == ConnectionState.CLOSED) {
            return;
        }
        cancelReconnect();
        reconnectExecutor.shutdownNow();
        connectionFactory.removeConnectionListener(this);
        connectionFactory.destroy();
        log.info("RabbitMQ connection closed");
    }
}
