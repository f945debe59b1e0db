package com.example.widgetstate.worker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@Configuration
public class TaskConfig {

    /**
     * Runs synchronous widget callbacks so that a slow handler never holds up an event loop or
     * the Redis listener threads.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler callbackScheduler() {
        return Schedulers.newBoundedElastic(Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "widget-callback");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
