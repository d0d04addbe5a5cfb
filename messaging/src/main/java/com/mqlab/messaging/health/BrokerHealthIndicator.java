package com.mqlab.messaging.health;

import com.mqlab.messaging.connection.BrokerConnectionManager;
import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;

import java.util.UUID;

/**
 * Reports the broker UP when a probe queue can be declared and deleted on a fresh channel.
 * Any failure turns into DOWN with the error attached.
 */
@Slf4j
public class BrokerHealthIndicator extends AbstractHealthIndicator {

    static final String PROBE_QUEUE_PREFIX = "health_check_";

    private final BrokerConnectionManager connectionManager;

    public BrokerHealthIndicator(BrokerConnectionManager connectionManager) {
        super("RabbitMQ health check failed");
        this.connectionManager = connectionManager;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) throws Exception {
        String probeQueue = PROBE_QUEUE_PREFIX + UUID.randomUUID();

        try (Channel channel = connectionManager.acquireChannel()) {
            channel.queueDeclare(probeQueue, false, true, true, null);
            channel.queueDelete(probeQueue);
        }

        log.debug("Broker health probe succeeded: queue={}", probeQueue);
        builder.up()
                .withDetail("host", connectionManager.getHost())
                .withDetail("port", connectionManager.getPort())
                .withDetail("state", connectionManager.getState().name());
    }
}
