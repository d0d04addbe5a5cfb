package com.mqlab.messaging.consumer;

/**
 * Application callback for one decoded message.
 *
 * Return {@code true} when the message is done. Returning {@code false} or throwing counts as a
 * failure and the message is retried or dead-lettered. Delivery is at-least-once, so the same
 * message may arrive more than once.
 */
@FunctionalInterface
public interface MessageHandler<T> {

    boolean handle(T message) throws Exception;
}
