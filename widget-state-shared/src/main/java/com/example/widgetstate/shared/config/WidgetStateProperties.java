package com.example.widgetstate.shared.config;

import com.example.widgetstate.shared.model.StateBackend;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Externalized settings for the widget state layer, bound from the {@code widgetstate} prefix.
 * Configuration is read once when the state manager builds its stores and is not consulted again.
 */
@Data
@Validated
public class WidgetStateProperties {

    /**
     * Explicit deploy mode switch. Selecting the Redis backend implies deploy mode as well.
     */
    private boolean deployMode = false;

    @NotNull
    private StateBackend stateBackend = StateBackend.MEMORY;

    /**
     * Stable identifier for this worker. Generated once per manager when blank.
     */
    private String workerId;

    private final Redis redis = new Redis();
    private final Ttl ttl = new Ttl();
    private final EventBus eventBus = new EventBus();
    private final Bridge bridge = new Bridge();
    private final Heartbeat heartbeat = new Heartbeat();
    private final Session session = new Session();
    private final Auth auth = new Auth();

    public boolean isDeployModeEffective() {
        return deployMode || stateBackend == StateBackend.REDIS;
    }

    @Data
    public static class Redis {
        @NotBlank
        private String url = "redis://localhost:6379/0";
        @NotBlank
        private String prefix = "widgetstate";
    }

    @Data
    public static class Ttl {
        @NotNull
        private Duration widget = Duration.ofHours(24);
        @NotNull
        private Duration connection = Duration.ofMinutes(5);
        /** Zero means sessions created without an explicit TTL never expire. */
        @NotNull
        private Duration session = Duration.ofHours(24);
    }

    @Data
    public static class EventBus {
        @Positive
        private int subscriberQueueCapacity = 1000;
    }

    @Data
    public static class Bridge {
        @NotNull
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Heartbeat {
        @NotNull
        private Duration interval = Duration.ofSeconds(30);
    }

    @Data
    public static class Session {
        @NotNull
        private Map<String, Set<String>> rolePermissions = defaultRolePermissions();
        @NotNull
        private PermissionPolicy permissionPolicy = PermissionPolicy.UNION;
        @NotNull
        private Set<String> superuserRoles = Set.of("admin");

        private static Map<String, Set<String>> defaultRolePermissions() {
            Map<String, Set<String>> defaults = new LinkedHashMap<>();
            defaults.put("admin", Set.of("read", "write", "admin"));
            defaults.put("editor", Set.of("read", "write"));
            defaults.put("viewer", Set.of("read"));
            return defaults;
        }
    }

    @Data
    public static class Auth {
        /** HMAC secret for signed tokens. A random secret is generated when blank. */
        private String tokenSecret = "";
        @NotNull
        private Duration widgetTokenTtl = Duration.ofMinutes(5);
    }
}
