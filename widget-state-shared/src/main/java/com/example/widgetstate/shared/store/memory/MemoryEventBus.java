package com.example.widgetstate.shared.store.memory;

import com.example.widgetstate.shared.model.EventMessage;
import com.example.widgetstate.shared.store.EventBus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;

/**
 * Single-process event bus. Each subscriber owns a bounded queue; when the queue is full the
 * newest message is dropped for that subscriber and the publisher carries on.
 */
@Slf4j
public class MemoryEventBus implements EventBus {

    private final Object lock = new Object();
    private final Map<String, List<ChannelSubscriber>> channels = new HashMap<>();
    private final int queueCapacity;

    public MemoryEventBus(int queueCapacity) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("Subscriber queue capacity must be positive, got " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
    }

    @Override
    public Mono<Void> publish(String channel, EventMessage message) {
        return Mono.fromRunnable(() -> {
            List<ChannelSubscriber> targets;
            synchronized (lock) {
                List<ChannelSubscriber> subscribers = channels.get(channel);
                if (subscribers == null || subscribers.isEmpty()) {
                    return;
                }
                targets = new ArrayList<>(subscribers);
            }
            for (ChannelSubscriber subscriber : targets) {
                subscriber.offer(channel, message);
            }
        });
    }

    @Override
    public Flux<EventMessage> subscribe(String channel) {
        return Flux.defer(() -> {
            ChannelSubscriber subscriber = new ChannelSubscriber(
                    Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(queueCapacity)));
            synchronized (lock) {
                channels.computeIfAbsent(channel, k -> new ArrayList<>()).add(subscriber);
            }
            log.debug("New subscriber on channel: {}", channel);
            return subscriber.sink.asFlux()
                    .doFinally(signal -> remove(channel, subscriber));
        });
    }

    @Override
    public Mono<Void> unsubscribe(String channel) {
        return Mono.fromRunnable(() -> {
            List<ChannelSubscriber> removed;
            synchronized (lock) {
                removed = channels.remove(channel);
            }
            if (removed != null) {
                removed.forEach(ChannelSubscriber::complete);
                log.debug("Closed {} subscriber(s) on channel: {}", removed.size(), channel);
            }
        });
    }

    public int subscriberCount(String channel) {
        synchronized (lock) {
            List<ChannelSubscriber> subscribers = channels.get(channel);
            return subscribers == null ? 0 : subscribers.size();
        }
    }

    private void remove(String channel, ChannelSubscriber subscriber) {
        synchronized (lock) {
            List<ChannelSubscriber> subscribers = channels.get(channel);
            if (subscribers != null) {
                subscribers.remove(subscriber);
                if (subscribers.isEmpty()) {
                    channels.remove(channel);
                }
            }
        }
    }

    /**
     * Emissions into one sink are serialized on the subscriber itself, so concurrent publishers
     * never trip the sink's non-serialized failure.
     */
    private static final class ChannelSubscriber {
        private final Sinks.Many<EventMessage> sink;

        private ChannelSubscriber(Sinks.Many<EventMessage> sink) {
            this.sink = sink;
        }

        private synchronized void offer(String channel, EventMessage message) {
            Sinks.EmitResult result = sink.tryEmitNext(message);
            if (result.isFailure() && result != Sinks.EmitResult.FAIL_TERMINATED
                    && result != Sinks.EmitResult.FAIL_CANCELLED) {
                log.debug("Dropped message {} on channel {}: {}", message.getMessageId(), channel, result);
            }
        }

        private synchronized void complete() {
            sink.tryEmitComplete();
        }
    }
}
