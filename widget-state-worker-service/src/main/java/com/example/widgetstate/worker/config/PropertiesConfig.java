package com.example.widgetstate.worker.config;

import com.example.widgetstate.shared.config.WidgetStateProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PropertiesConfig {

    @Value("${POD_NAME:}")
    private String podName;

    /**
     * The pod name is the default worker id; {@code widgetstate.worker-id} overrides it when set.
     */
    @Bean
    @ConfigurationProperties(prefix = "widgetstate")
    public WidgetStateProperties widgetStateProperties() {
        WidgetStateProperties properties = new WidgetStateProperties();
        if (!podName.isBlank()) {
            properties.setWorkerId(podName);
        }
        return properties;
    }
}
