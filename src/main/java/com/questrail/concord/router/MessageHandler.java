package com.questrail.concord.router;

import com.questrail.concord.message.CoordinationMessage;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Receives decoded messages of one kind on one channel.
 */
@FunctionalInterface
public interface MessageHandler
{
    void handle(CoordinationMessage message);

    /**
     * Adapts a handler written against a concrete message type.
     *
     * @throws IllegalArgumentException at dispatch time if a message of another
     *         type is delivered; that means the handler was registered under the
     *         wrong kind
     */
    static <M extends CoordinationMessage> MessageHandler of(Class<M> type, Consumer<? super M> consumer) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(consumer, "consumer");
        return message -> {
            if (!type.isInstance(message)) {
                throw new IllegalArgumentException(
                        "Handler for " + type.getSimpleName() + " received " + message.getClass().getSimpleName());
            }
            consumer.accept(type.cast(message));
        };
    }
}
