package com.example.widgetstate.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Worker process hosting the widget state layer.
 *
 * Any number of these run side by side. With the Redis backend they share widget, connection
 * and session state and route widget events to each other over Redis pub/sub; with the memory
 * backend a worker keeps everything to itself.
 */
@SpringBootApplication
@EnableScheduling
public class WidgetStateWorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WidgetStateWorkerApplication.class, args);
    }
}
