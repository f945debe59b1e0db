package com.example.widgetstate.shared.store.redis;

import com.example.widgetstate.shared.exception.StateBackendException;
import com.example.widgetstate.shared.model.EventMessage;
import com.example.widgetstate.shared.store.EventBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Event bus on Redis pub/sub. Each {@link #subscribe(String)} stream registers its own listener
 * with the shared {@link RedisMessageListenerContainer} and removes it when the stream ends.
 */
@Slf4j
public class RedisEventBus extends AbstractRedisStore implements EventBus {

    private final RedisMessageListenerContainer listenerContainer;
    private final EventMessageCodec codec;
    private final Map<String, Set<FluxSink<EventMessage>>> openStreams = new HashMap<>();

    public RedisEventBus(StringRedisTemplate redisTemplate, RedisKeys keys, Scheduler ioScheduler,
                         RedisMessageListenerContainer listenerContainer, EventMessageCodec codec) {
        super(redisTemplate, keys, ioScheduler);
        this.listenerContainer = listenerContainer;
        this.codec = codec;
    }

    @Override
    public Mono<Void> publish(String channel, EventMessage message) {
        return call("event.publish", () -> {
            redisTemplate.convertAndSend(keys.channel(channel), codec.encode(message));
            return Boolean.TRUE;
        }).then();
    }

    @Override
    public Flux<EventMessage> subscribe(String channel) {
        return Flux.create(sink -> {
            ChannelTopic topic = new ChannelTopic(keys.channel(channel));
            MessageListener listener = (message, pattern) ->
                    codec.decode(message.getBody()).ifPresent(sink::next);
            try {
                listenerContainer.addMessageListener(listener, topic);
            } catch (DataAccessException e) {
                sink.error(new StateBackendException("Failed to subscribe to channel " + channel, e));
                return;
            }
            track(channel, sink);
            sink.onDispose(() -> {
                untrack(channel, sink);
                listenerContainer.removeMessageListener(listener, topic);
                log.debug("Removed listener for channel: {}", topic.getTopic());
            });
            log.debug("Subscribed to channel: {}", topic.getTopic());
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    @Override
    public Mono<Void> unsubscribe(String channel) {
        return Mono.fromRunnable(() -> {
            List<FluxSink<EventMessage>> sinks;
            synchronized (openStreams) {
                Set<FluxSink<EventMessage>> open = openStreams.remove(channel);
                sinks = open == null ? List.of() : new ArrayList<>(open);
            }
            sinks.forEach(FluxSink::complete);
        });
    }

    private void track(String channel, FluxSink<EventMessage> sink) {
        synchronized (openStreams) {
            openStreams.computeIfAbsent(channel, k -> ConcurrentHashMap.newKeySet()).add(sink);
        }
    }

    private void untrack(String channel, FluxSink<EventMessage> sink) {
        synchronized (openStreams) {
            Set<FluxSink<EventMessage>> open = openStreams.get(channel);
            if (open != null) {
                open.remove(sink);
                if (open.isEmpty()) {
                    openStreams.remove(channel);
                }
            }
        }
    }
}
