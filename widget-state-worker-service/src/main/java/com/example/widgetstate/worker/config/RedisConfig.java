package com.example.widgetstate.worker.config;

import com.example.widgetstate.shared.store.StateBackendFactory;
import com.example.widgetstate.shared.store.redis.RedisStateBackendFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Executor;

/**
 * Redis plumbing for the shared state backend. Only active with {@code widgetstate.state-backend=redis}.
 */
@Configuration
@ConditionalOnProperty(prefix = "widgetstate", name = "state-backend", havingValue = "redis")
public class RedisConfig {

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory,
                                                                       @Qualifier("redisTaskExecutor") Executor redisTaskExecutor) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.setTaskExecutor(redisTaskExecutor);
        return container;
    }

    // Listener callbacks run here, off the Lettuce event loop
    @Bean
    public Executor redisTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("redis-listener-");
        executor.initialize();
        return executor;
    }

    /**
     * Blocking {@link StringRedisTemplate} calls of the Redis stores are shifted onto this scheduler.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler redisIoScheduler() {
        return Schedulers.newBoundedElastic(Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "redis-io");
    }

    @Bean
    public StateBackendFactory redisStateBackendFactory(StringRedisTemplate stringRedisTemplate,
                                                        RedisMessageListenerContainer redisMessageListenerContainer,
                                                        @Qualifier("redisIoScheduler") Scheduler redisIoScheduler) {
        return new RedisStateBackendFactory(stringRedisTemplate, redisMessageListenerContainer, redisIoScheduler);
    }
}
