package com.example.widgetstate.shared.store.redis;

import com.example.widgetstate.shared.model.WidgetRecord;
import com.example.widgetstate.shared.store.WidgetStore;
import com.example.widgetstate.shared.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Widgets as Redis hashes under {@code {prefix}:widget:{id}}, expiring after the widget TTL, and
 * indexed in the {@code {prefix}:widgets:active} set.
 */
@Slf4j
public class RedisWidgetStore extends AbstractRedisStore implements WidgetStore {

    static final String FIELD_HTML = "html";
    static final String FIELD_TOKEN = "token";
    static final String FIELD_CREATED_AT = "created_at";
    static final String FIELD_OWNER = "owner_worker_id";
    static final String FIELD_METADATA = "metadata";

    private final Duration widgetTtl;
    private final Clock clock;

    public RedisWidgetStore(StringRedisTemplate redisTemplate, RedisKeys keys, Scheduler ioScheduler,
                            Duration widgetTtl, Clock clock) {
        super(redisTemplate, keys, ioScheduler);
        this.widgetTtl = widgetTtl;
        this.clock = clock;
    }

    @Override
    public Mono<WidgetRecord> register(String widgetId, String html, String token,
                                       String ownerWorkerId, Map<String, Object> metadata) {
        return call("widget.register", () -> {
            Instant now = clock.instant();
            Map<String, Object> metadataCopy = JsonUtils.copyOf(metadata);
            Map<String, String> fields = new LinkedHashMap<>();
            fields.put(FIELD_HTML, html);
            fields.put(FIELD_CREATED_AT, epochMillis(now));
            if (token != null) {
                fields.put(FIELD_TOKEN, token);
            }
            if (ownerWorkerId != null) {
                fields.put(FIELD_OWNER, ownerWorkerId);
            }
            if (!metadataCopy.isEmpty()) {
                fields.put(FIELD_METADATA, JsonUtils.toJson(metadataCopy));
            }

            String key = keys.widget(widgetId);
            transaction(ops -> {
                ops.delete(key);
                ops.opsForHash().putAll(key, fields);
                ops.expire(key, widgetTtl);
                ops.opsForSet().add(keys.activeWidgets(), widgetId);
            });
            log.debug("Registered widget: {} (owner {})", widgetId, ownerWorkerId);
            return WidgetRecord.builder()
                    .widgetId(widgetId)
                    .html(html)
                    .token(token)
                    .createdAt(now)
                    .ownerWorkerId(ownerWorkerId)
                    .metadata(metadataCopy)
                    .build();
        });
    }

    @Override
    public Mono<WidgetRecord> get(String widgetId) {
        return call("widget.get", () -> {
            Map<Object, Object> fields = redisTemplate.opsForHash().entries(keys.widget(widgetId));
            if (fields.isEmpty()) {
                return null;
            }
            Object html = fields.get(FIELD_HTML);
            return WidgetRecord.builder()
                    .widgetId(widgetId)
                    .html(html != null ? html.toString() : "")
                    .token((String) fields.get(FIELD_TOKEN))
                    .createdAt(parseInstant(fields.get(FIELD_CREATED_AT)))
                    .ownerWorkerId((String) fields.get(FIELD_OWNER))
                    .metadata(JsonUtils.parseMap((String) fields.get(FIELD_METADATA)))
                    .build();
        });
    }

    @Override
    public Mono<String> getHtml(String widgetId) {
        return hashField("widget.getHtml", widgetId, FIELD_HTML);
    }

    @Override
    public Mono<String> getToken(String widgetId) {
        return hashField("widget.getToken", widgetId, FIELD_TOKEN);
    }

    @Override
    public Mono<Boolean> exists(String widgetId) {
        return call("widget.exists", () -> {
            boolean present = Boolean.TRUE.equals(redisTemplate.hasKey(keys.widget(widgetId)));
            if (!present) {
                Long removed = redisTemplate.opsForSet().remove(keys.activeWidgets(), widgetId);
                if (removed != null && removed > 0) {
                    log.debug("Dropped expired widget {} from the active set", widgetId);
                }
            }
            return present;
        });
    }

    @Override
    public Mono<Boolean> updateHtml(String widgetId, String html) {
        return updateField("widget.updateHtml", widgetId, FIELD_HTML, html);
    }

    @Override
    public Mono<Boolean> updateToken(String widgetId, String token) {
        return updateField("widget.updateToken", widgetId, FIELD_TOKEN, token);
    }

    @Override
    public Mono<Boolean> delete(String widgetId) {
        return call("widget.delete", () -> {
            List<Object> results = transaction(ops -> {
                ops.delete(keys.widget(widgetId));
                ops.opsForSet().remove(keys.activeWidgets(), widgetId);
            });
            return results != null && !results.isEmpty() && isAffirmative(results.get(0));
        });
    }

    @Override
    public Flux<String> listActive() {
        return call("widget.listActive", this::liveMembers).flatMapIterable(ids -> ids);
    }

    @Override
    public Mono<Long> count() {
        return call("widget.count", () -> (long) liveMembers().size());
    }

    private Mono<String> hashField(String operation, String widgetId, String field) {
        return call(operation, () -> {
            Object value = redisTemplate.opsForHash().get(keys.widget(widgetId), field);
            return value != null ? value.toString() : null;
        });
    }

    /**
     * PEXPIRE doubles as the existence check, so a widget that expired in the meantime is
     * reported missing instead of being recreated as a partial hash.
     */
    private Mono<Boolean> updateField(String operation, String widgetId, String field, String value) {
        return call(operation, () -> {
            String key = keys.widget(widgetId);
            if (!Boolean.TRUE.equals(redisTemplate.expire(key, widgetTtl))) {
                return false;
            }
            redisTemplate.opsForHash().put(key, field, value);
            return true;
        });
    }

    /**
     * Members of the active set whose payload still exists. Members whose hash has expired are
     * removed from the set on the way.
     */
    private List<String> liveMembers() {
        Set<String> members = redisTemplate.opsForSet().members(keys.activeWidgets());
        if (members == null || members.isEmpty()) {
            return List.of();
        }
        List<String> ids = new ArrayList<>(members);
        List<String> live = new ArrayList<>(ids.size());
        List<String> stale = new ArrayList<>();
        for (String id : ids) {
            if (Boolean.TRUE.equals(redisTemplate.hasKey(keys.widget(id)))) {
                live.add(id);
            } else {
                stale.add(id);
            }
        }
        if (!stale.isEmpty()) {
            redisTemplate.opsForSet().remove(keys.activeWidgets(), stale.toArray());
            log.debug("Dropped {} expired widget(s) from the active set", stale.size());
        }
        return live;
    }
}
