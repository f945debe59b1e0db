package com.example.widgetstate.shared.store;

import com.example.widgetstate.shared.model.EventMessage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Fire-and-forget fan-out of {@link EventMessage}s on named channels.
 * <p>
 * Only subscribers listening at publish time receive a message; there is no replay.
 * Delivery is at-least-once per connected subscriber and ordered only within one subscriber.
 */
public interface EventBus {

    Mono<Void> publish(String channel, EventMessage message);

    /**
     * Opens a stream of messages on the channel. The stream stays open until the subscriber
     * cancels it or {@link #unsubscribe(String)} is called for the channel.
     */
    Flux<EventMessage> subscribe(String channel);

    /**
     * Best-effort: completes the streams this process opened on the channel.
     */
    Mono<Void> unsubscribe(String channel);
}
