package com.mqlab.messaging.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mqlab.messaging.connection.BrokerConnectionManager;
import com.mqlab.messaging.consumer.MessageConsumer;
import com.mqlab.messaging.consumer.RabbitSubscriptionContainerFactory;
import com.mqlab.messaging.consumer.SubscriptionContainerFactory;
import com.mqlab.messaging.health.BrokerHealthIndicator;
import com.mqlab.messaging.publisher.MessagePublisher;
import com.mqlab.messaging.registry.ConsumerRegistry;
import com.mqlab.messaging.retry.RetryCoordinator;
import com.mqlab.messaging.topology.TopologyProvisioner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * RabbitMQ messaging configuration.
 *
 * Every component is an explicit bean built from {@link MessagingProperties}:
 * - connection factory and {@link BrokerConnectionManager} (connects on startup, fails fast)
 * - {@link RabbitAdmin} + {@link TopologyProvisioner} for queue, dead-letter and delay declarations
 * - {@link RabbitTemplate} + {@link MessagePublisher}
 * - {@link RetryCoordinator}, {@link MessageConsumer} and {@link ConsumerRegistry}
 * - {@link BrokerHealthIndicator} for the actuator health endpoint
 *
 * Shutdown order follows bean dependencies: the registry cancels subscriptions first,
 * the connection manager closes the connection last.
 */
@AutoConfiguration(before = {RabbitAutoConfiguration.class, JacksonAutoConfiguration.class})
@EnableConfigurationProperties(MessagingProperties.class)
@Slf4j
public class RabbitMQConfig {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Instant, LocalDateTime, ...
        mapper.registerModule(new JavaTimeModule());

        // ISO-8601 strings, not timestamps
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        return mapper;
    }

    @Bean
    public CachingConnectionFactory rabbitConnectionFactory(MessagingProperties properties) {
        return BrokerConnectionManager.createConnectionFactory(properties);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public BrokerConnectionManager brokerConnectionManager(CachingConnectionFactory rabbitConnectionFactory,
                                                           MessagingProperties properties) {
        return new BrokerConnectionManager(rabbitConnectionFactory, properties);
    }

    @Bean
    public RabbitAdmin rabbitAdmin(CachingConnectionFactory rabbitConnectionFactory,
                                   BrokerConnectionManager brokerConnectionManager) {
        return new RabbitAdmin(rabbitConnectionFactory);
    }

    /**
     * Mandatory publishing: a message that no queue accepts is returned and logged
     * instead of being dropped silently.
     */
    @Bean
    public RabbitTemplate rabbitTemplate(CachingConnectionFactory rabbitConnectionFactory,
                                         BrokerConnectionManager brokerConnectionManager) {
        RabbitTemplate template = new RabbitTemplate(rabbitConnectionFactory);
        template.setMandatory(true);
        template.setReturnsCallback(returned ->
                log.error("MESSAGE_RETURNED: exchange='{}', routingKey={}, replyCode={}, replyText={}, messageId={}",
                        returned.getExchange(), returned.getRoutingKey(), returned.getReplyCode(),
                        returned.getReplyText(), returned.getMessage().getMessageProperties().getMessageId()));
        return template;
    }

    @Bean
    public TopologyProvisioner topologyProvisioner(RabbitAdmin rabbitAdmin,
                                                   BrokerConnectionManager brokerConnectionManager,
                                                   MessagingProperties properties) {
        TopologyProvisioner provisioner = new TopologyProvisioner(rabbitAdmin, properties);
        brokerConnectionManager.addListener(provisioner);
        return provisioner;
    }

    @Bean
    public MessagePublisher messagePublisher(RabbitTemplate rabbitTemplate,
                                             TopologyProvisioner topologyProvisioner,
                                             BrokerConnectionManager brokerConnectionManager,
                                             ObjectMapper objectMapper,
                                             MessagingProperties properties) {
        return new MessagePublisher(rabbitTemplate, topologyProvisioner, brokerConnectionManager,
                objectMapper, properties);
    }

    @Bean
    public RetryCoordinator retryCoordinator(MessagePublisher messagePublisher, MessagingProperties properties) {
        return new RetryCoordinator(messagePublisher, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionContainerFactory subscriptionContainerFactory(CachingConnectionFactory rabbitConnectionFactory,
                                                                     MessagingProperties properties) {
        return new RabbitSubscriptionContainerFactory(rabbitConnectionFactory, properties);
    }

    @Bean(destroyMethod = "close")
    public MessageConsumer messageConsumer(TopologyProvisioner topologyProvisioner,
                                           RetryCoordinator retryCoordinator,
                                           SubscriptionContainerFactory subscriptionContainerFactory,
                                           ObjectMapper objectMapper,
                                           MessagingProperties properties) {
        return new MessageConsumer(topologyProvisioner, retryCoordinator, subscriptionContainerFactory,
                objectMapper, properties);
    }

    @Bean(destroyMethod = "unregisterAll")
    public ConsumerRegistry consumerRegistry(MessageConsumer messageConsumer,
                                             BrokerConnectionManager brokerConnectionManager) {
        ConsumerRegistry registry = new ConsumerRegistry(messageConsumer);
        brokerConnectionManager.addListener(registry);
        return registry;
    }

    @Bean
    public BrokerHealthIndicator brokerHealthIndicator(BrokerConnectionManager brokerConnectionManager) {
        return new BrokerHealthIndicator(brokerConnectionManager);
    }
}
