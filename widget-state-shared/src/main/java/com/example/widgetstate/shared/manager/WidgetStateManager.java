package com.example.widgetstate.shared.manager;

import com.example.widgetstate.shared.bridge.BlockingStateBridge;
import com.example.widgetstate.shared.callback.AsyncWidgetCallback;
import com.example.widgetstate.shared.callback.CallbackRegistration;
import com.example.widgetstate.shared.callback.CallbackRegistry;
import com.example.widgetstate.shared.callback.CallbackResult;
import com.example.widgetstate.shared.callback.WidgetCallback;
import com.example.widgetstate.shared.config.WidgetStateProperties;
import com.example.widgetstate.shared.model.ConnectionInfo;
import com.example.widgetstate.shared.model.DispatchOutcome;
import com.example.widgetstate.shared.model.EventMessage;
import com.example.widgetstate.shared.model.StateBackend;
import com.example.widgetstate.shared.model.UserSession;
import com.example.widgetstate.shared.model.WidgetEvent;
import com.example.widgetstate.shared.model.WidgetRecord;
import com.example.widgetstate.shared.store.ConnectionRouter;
import com.example.widgetstate.shared.store.EventBus;
import com.example.widgetstate.shared.store.EventChannels;
import com.example.widgetstate.shared.store.SessionStore;
import com.example.widgetstate.shared.store.StateBackendFactory;
import com.example.widgetstate.shared.store.StateStores;
import com.example.widgetstate.shared.store.WidgetStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single entry point of the state layer for the connection and HTTP layers of a worker.
 * <p>
 * Backend stores are built lazily on first use. Callers never branch on the deployment mode:
 * in deploy mode events travel over the event bus between workers, in local mode they go straight
 * into the widget's local stream. Each live connection held by this worker is a Reactor sink
 * whose {@link Flux} the duplex handler forwards to the browser.
 */
@Slf4j
public class WidgetStateManager {

    private static final List<String> DEFAULT_SESSION_ROLES = List.of("viewer");

    private final WidgetStateProperties properties;
    private final StateBackendFactory backendFactory;
    @Getter
    private final CallbackRegistry callbackRegistry;
    private final Clock clock;
    @Getter
    private final String workerId;
    private final boolean deployMode;
    private final BlockingStateBridge bridge;
    private final BlockingWidgetState blockingView;

    private final Object initLock = new Object();
    private volatile StateStores stores;
    private volatile Disposable workerChannelSubscription;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final Map<String, LocalConnection> localConnections = new ConcurrentHashMap<>();

    public WidgetStateManager(WidgetStateProperties properties, StateBackendFactory backendFactory,
                              CallbackRegistry callbackRegistry, Clock clock) {
        this.properties = properties;
        this.backendFactory = backendFactory;
        this.callbackRegistry = callbackRegistry;
        this.clock = clock;
        this.workerId = resolveWorkerId(properties.getWorkerId());
        this.deployMode = properties.isDeployModeEffective();
        this.bridge = new BlockingStateBridge(properties.getBridge().getTimeout());
        this.blockingView = new BlockingWidgetState(this, bridge);
        if (backendFactory.backend() != properties.getStateBackend()) {
            log.warn("Configured state backend {} differs from the supplied {} factory; using {}",
                    properties.getStateBackend(), backendFactory.backend(), backendFactory.backend());
        }
        log.info("Widget state manager created for worker {} (deployMode={}, backend={})",
                workerId, deployMode, backendFactory.backend());
    }

    public boolean isDeployMode() {
        return deployMode;
    }

    public StateBackend getBackend() {
        return backendFactory.backend();
    }

    public boolean isInitialized() {
        return stores != null;
    }

    public boolean isBackendAvailable() {
        return backendFactory.isAvailable();
    }

    public BlockingWidgetState blocking() {
        return blockingView;
    }

    /**
     * Builds the stores if needed and, in deploy mode, starts listening on this worker's routing
     * channel. Idempotent.
     */
    public void start() {
        stores();
        if (deployMode && started.compareAndSet(false, true)) {
            workerChannelSubscription = eventBus().subscribe(EventChannels.worker(workerId))
                    .concatMap(this::handleRoutedMessage)
                    .subscribe(
                            outcome -> { },
                            error -> log.error("Routing channel of worker {} failed", workerId, error));
            log.info("Worker {} listening on channel {}", workerId, EventChannels.worker(workerId));
        }
    }

    // --- widgets ---

    public Mono<WidgetRecord> registerWidget(String widgetId, String html, String token, Map<String, Object> metadata) {
        return Mono.defer(() -> widgets().register(widgetId, html, token, workerId, metadata));
    }

    public Mono<WidgetRecord> getWidget(String widgetId) {
        return Mono.defer(() -> widgets().get(widgetId));
    }

    public Mono<String> getWidgetHtml(String widgetId) {
        return Mono.defer(() -> widgets().getHtml(widgetId));
    }

    public Mono<String> getWidgetToken(String widgetId) {
        return Mono.defer(() -> widgets().getToken(widgetId));
    }

    public Mono<Boolean> updateWidgetHtml(String widgetId, String html) {
        return Mono.defer(() -> widgets().updateHtml(widgetId, html));
    }

    public Mono<Boolean> updateWidgetToken(String widgetId, String token) {
        return Mono.defer(() -> widgets().updateToken(widgetId, token));
    }

    public Mono<Boolean> widgetExists(String widgetId) {
        return Mono.defer(() -> widgets().exists(widgetId));
    }

    /**
     * Deletes the widget record, drops its local handlers and closes its local connection, if any.
     */
    public Mono<Boolean> removeWidget(String widgetId) {
        return Mono.defer(() -> {
            callbackRegistry.unregisterWidget(widgetId);
            Mono<Boolean> closeConnection = localConnections.containsKey(widgetId)
                    ? unregisterConnection(widgetId)
                    : Mono.just(false);
            return closeConnection.then(widgets().delete(widgetId));
        });
    }

    public Flux<String> listWidgets() {
        return Flux.defer(() -> widgets().listActive());
    }

    public Mono<Long> widgetCount() {
        return Mono.defer(() -> widgets().count());
    }

    // --- connections ---

    /**
     * Records that this worker now holds the live connection of the widget and opens its local
     * event stream. A previous local stream for the same widget is completed. In deploy mode the
     * worker also listens on the widget's channel and tells a previous owner on another worker
     * that its connection was superseded.
     *
     * @return the stream of events to forward to the browser; it completes when the connection
     * is unregistered or superseded
     */
    public Mono<Flux<WidgetEvent>> registerConnection(String widgetId, String userId, String sessionId) {
        return Mono.defer(() -> {
            start();
            ConnectionRouter router = connections();
            return router.getOwner(widgetId)
                    .defaultIfEmpty("")
                    .flatMap(previousOwner -> router.registerConnection(widgetId, workerId, userId, sessionId)
                            .flatMap(info -> notifySuperseded(widgetId, previousOwner).thenReturn(info)))
                    .map(info -> openLocalStream(widgetId, userId, sessionId));
        });
    }

    /**
     * Closes the local stream and removes the router entry when this worker still owns it.
     *
     * @return {@code true} if a local connection or a router entry owned by this worker was removed
     */
    public Mono<Boolean> unregisterConnection(String widgetId) {
        return Mono.defer(() -> {
            boolean closedLocally = closeLocalConnection(widgetId, "unregistered");
            ConnectionRouter router = connections();
            return router.getOwner(widgetId)
                    .filter(workerId::equals)
                    .flatMap(owner -> router.unregisterConnection(widgetId))
                    .defaultIfEmpty(false)
                    .map(removed -> removed || closedLocally);
        });
    }

    public Mono<ConnectionInfo> getConnectionInfo(String widgetId) {
        return Mono.defer(() -> connections().getConnectionInfo(widgetId));
    }

    public Mono<String> getConnectionOwner(String widgetId) {
        return Mono.defer(() -> connections().getOwner(widgetId));
    }

    public Flux<String> listWorkerConnections(String workerId) {
        return Flux.defer(() -> connections().listWorkerConnections(workerId));
    }

    public boolean hasLocalConnection(String widgetId) {
        return localConnections.containsKey(widgetId);
    }

    public Set<String> localConnectionIds() {
        return Set.copyOf(localConnections.keySet());
    }

    /**
     * Heartbeat pass over the local connections. A connection whose router entry now names another
     * worker is closed here; one whose entry expired is registered again.
     */
    public Mono<Void> refreshHeartbeats() {
        return Flux.fromIterable(new ArrayList<>(localConnections.entrySet()))
                .concatMap(entry -> refreshHeartbeat(entry.getKey(), entry.getValue()))
                .then();
    }

    // --- callbacks ---

    public CallbackRegistration registerCallback(String widgetId, String eventType, WidgetCallback callback) {
        return callbackRegistry.register(widgetId, eventType, callback);
    }

    public CallbackRegistration registerAsyncCallback(String widgetId, String eventType, AsyncWidgetCallback callback) {
        return callbackRegistry.registerAsync(widgetId, eventType, callback);
    }

    public Optional<CallbackRegistration> getCallback(String widgetId, String eventType) {
        return callbackRegistry.get(widgetId, eventType);
    }

    public Mono<CallbackResult> invokeCallback(String widgetId, String eventType, Map<String, Object> data) {
        return callbackRegistry.invoke(widgetId, eventType, data);
    }

    // --- events ---

    /**
     * Routes an inbound client event. A local handler runs here; otherwise, in deploy mode, the
     * event is forwarded to the worker that holds the widget's connection or, failing that, the
     * worker that registered the widget.
     */
    public Mono<DispatchOutcome> dispatchEvent(String widgetId, String eventType, Map<String, Object> data) {
        return Mono.defer(() -> {
            if (callbackRegistry.hasCallback(widgetId, eventType)) {
                return callbackRegistry.invoke(widgetId, eventType, data)
                        .map(result -> result.isHandled() ? DispatchOutcome.HANDLED_LOCALLY : DispatchOutcome.NOT_HANDLED);
            }
            if (!deployMode) {
                log.debug("No handler for {}:{} on worker {}", widgetId, eventType, workerId);
                return Mono.just(DispatchOutcome.NOT_HANDLED);
            }
            return remoteOwner(widgetId)
                    .flatMap(owner -> eventBus()
                            .publish(EventChannels.worker(owner),
                                    EventMessage.create(eventType, widgetId, data, workerId, owner, clock.instant()))
                            .doOnSuccess(v -> log.debug("Routed {}:{} to worker {}", widgetId, eventType, owner))
                            .thenReturn(DispatchOutcome.ROUTED))
                    .defaultIfEmpty(DispatchOutcome.NOT_HANDLED);
        });
    }

    /**
     * Pushes an event to the widget's browser. In deploy mode the event is published on the
     * widget channel so that whichever worker holds the connection delivers it.
     */
    public Mono<Void> broadcastEvent(String widgetId, String eventType, Map<String, Object> data) {
        return Mono.defer(() -> {
            if (deployMode) {
                return eventBus().publish(EventChannels.widget(widgetId),
                        EventMessage.create(eventType, widgetId, data, workerId, null, clock.instant()));
            }
            emitLocal(widgetId, WidgetEvent.of(eventType, data != null ? data : Map.of()));
            return Mono.empty();
        });
    }

    /**
     * @return {@code true} if the event was queued on a local stream or published for another worker
     */
    public Mono<Boolean> sendToWidget(String widgetId, WidgetEvent event) {
        return Mono.defer(() -> {
            if (emitLocal(widgetId, event)) {
                return Mono.just(true);
            }
            if (deployMode) {
                Map<String, Object> data = event.getData() != null ? event.getData() : Map.of();
                String type = event.getType() != null ? event.getType() : "message";
                return eventBus().publish(EventChannels.widget(widgetId),
                                EventMessage.create(type, widgetId, data, workerId, null, clock.instant()))
                        .thenReturn(true);
            }
            return Mono.just(false);
        });
    }

    // --- sessions ---

    /**
     * Creates a session under a fresh random id, with the configured default TTL. Users without
     * roles get {@code viewer}.
     */
    public Mono<UserSession> createSession(String userId, Set<String> roles, Map<String, Object> metadata) {
        return createSession(userId, roles, null, metadata);
    }

    public Mono<UserSession> createSession(String userId, Set<String> roles, Duration ttl, Map<String, Object> metadata) {
        Set<String> effectiveRoles = roles == null || roles.isEmpty() ? Set.copyOf(DEFAULT_SESSION_ROLES) : roles;
        return Mono.defer(() -> sessions().createSession(UUID.randomUUID().toString(), userId, effectiveRoles, ttl, metadata));
    }

    public Mono<UserSession> getSession(String sessionId) {
        return Mono.defer(() -> sessions().getSession(sessionId));
    }

    public Mono<Boolean> validateSession(String sessionId) {
        return Mono.defer(() -> sessions().validateSession(sessionId));
    }

    public Mono<Boolean> deleteSession(String sessionId) {
        return Mono.defer(() -> sessions().deleteSession(sessionId));
    }

    public Mono<Boolean> refreshSession(String sessionId, Duration extendTtl) {
        return Mono.defer(() -> sessions().refreshSession(sessionId, extendTtl));
    }

    public Flux<UserSession> listUserSessions(String userId) {
        return Flux.defer(() -> sessions().listUserSessions(userId));
    }

    public Mono<Boolean> checkPermission(String sessionId, String resourceType, String resourceId, String permission) {
        return Mono.defer(() -> sessions().checkPermission(sessionId, resourceType, resourceId, permission));
    }

    public Mono<Void> setRolePermissions(String role, Set<String> permissions) {
        return Mono.defer(() -> sessions().setRolePermissions(role, permissions));
    }

    // --- lifecycle ---

    public ManagerStats getStats() {
        Set<String> connectionIds = localConnectionIds();
        return ManagerStats.builder()
                .workerId(workerId)
                .deployMode(deployMode)
                .backend(backendFactory.backend())
                .initialized(isInitialized())
                .localConnectionCount(connectionIds.size())
                .localConnectionIds(connectionIds)
                .callbacks(callbackRegistry.getStats())
                .build();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Local cleanup on process exit: closes this worker's streams, removes the router entries it
     * still owns and stops listening on its channels. Widget and session records stay in the
     * backend. Safe to call more than once.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down widget state for worker {} ({} local connections)", workerId, localConnections.size());
        Disposable routing = workerChannelSubscription;
        if (routing != null) {
            routing.dispose();
        }
        try {
            if (stores != null && !localConnections.isEmpty()) {
                bridge.block("shutdown", Flux.fromIterable(new ArrayList<>(localConnections.keySet()))
                        .concatMap(widgetId -> unregisterConnection(widgetId)
                                .onErrorResume(e -> {
                                    log.warn("Failed to unregister connection for widget: {} during shutdown", widgetId, e);
                                    return Mono.just(false);
                                }))
                        .then());
            }
        } catch (RuntimeException e) {
            log.warn("Widget state shutdown did not complete cleanly: {}", e.getMessage(), e);
            new ArrayList<>(localConnections.keySet()).forEach(id -> closeLocalConnection(id, "shutdown"));
        } finally {
            bridge.dispose();
        }
        log.info("Widget state shutdown complete for worker {}", workerId);
    }

    // --- internals ---

    StateStores stores() {
        StateStores current = stores;
        if (current == null) {
            synchronized (initLock) {
                current = stores;
                if (current == null) {
                    current = backendFactory.create(properties, clock);
                    stores = current;
                    log.info("Initialized {} state stores for worker {}", backendFactory.backend(), workerId);
                }
            }
        }
        return current;
    }

    private WidgetStore widgets() {
        return stores().getWidgets();
    }

    private EventBus eventBus() {
        return stores().getEventBus();
    }

    private ConnectionRouter connections() {
        return stores().getConnections();
    }

    private SessionStore sessions() {
        return stores().getSessions();
    }

    private Flux<WidgetEvent> openLocalStream(String widgetId, String userId, String sessionId) {
        Sinks.Many<WidgetEvent> sink = Sinks.many().multicast().onBackpressureBuffer();
        LocalConnection connection = new LocalConnection(sink, userId, sessionId);
        LocalConnection previous = localConnections.put(widgetId, connection);
        if (previous != null) {
            previous.close();
            log.info("Replaced local connection for widget: {}", widgetId);
        }
        if (deployMode) {
            connection.channelSubscription = eventBus().subscribe(EventChannels.widget(widgetId))
                    .filter(message -> message.isAddressedTo(workerId))
                    .subscribe(
                            message -> connection.emit(WidgetEvent.from(message)),
                            error -> log.error("Channel subscription for widget: {} failed", widgetId, error));
        }
        log.debug("Opened local connection for widget: {} (user {})", widgetId, userId);
        return sink.asFlux()
                .doFinally(signal -> {
                    if (localConnections.remove(widgetId, connection)) {
                        connection.close();
                        log.debug("Local stream for widget: {} ended with {}", widgetId, signal);
                        if (!bridge.isDisposed()) {
                            bridge.fireAndForget("unregisterConnection", connections().getOwner(widgetId)
                                    .filter(workerId::equals)
                                    .flatMap(owner -> connections().unregisterConnection(widgetId)));
                        }
                    }
                });
    }

    private boolean closeLocalConnection(String widgetId, String reason) {
        LocalConnection connection = localConnections.remove(widgetId);
        if (connection == null) {
            return false;
        }
        connection.close();
        log.info("Closed local connection for widget: {} ({})", widgetId, reason);
        return true;
    }

    private boolean emitLocal(String widgetId, WidgetEvent event) {
        LocalConnection connection = localConnections.get(widgetId);
        return connection != null && connection.emit(event);
    }

    private Mono<Void> notifySuperseded(String widgetId, String previousOwner) {
        if (!deployMode || previousOwner.isEmpty() || previousOwner.equals(workerId)) {
            return Mono.empty();
        }
        EventMessage notice = EventMessage.create(EventChannels.CONNECTION_SUPERSEDED, widgetId,
                Map.of("new_worker_id", workerId), workerId, previousOwner, clock.instant());
        return eventBus().publish(EventChannels.worker(previousOwner), notice)
                .onErrorResume(e -> {
                    log.warn("Could not notify worker {} that widget: {} moved", previousOwner, widgetId, e);
                    return Mono.empty();
                });
    }

    private Mono<String> remoteOwner(String widgetId) {
        Mono<String> recordOwner = widgets().get(widgetId)
                .flatMap(record -> Mono.justOrEmpty(record.getOwnerWorkerId()))
                .filter(owner -> !owner.equals(workerId));
        return connections().getOwner(widgetId)
                .filter(owner -> !owner.equals(workerId))
                .switchIfEmpty(recordOwner);
    }

    private Mono<Void> handleRoutedMessage(EventMessage message) {
        if (!message.isAddressedTo(workerId)) {
            return Mono.empty();
        }
        if (EventChannels.CONNECTION_SUPERSEDED.equals(message.getEventType())) {
            closeLocalConnection(message.getWidgetId(), "superseded by " + message.getSourceWorkerId());
            return Mono.empty();
        }
        return callbackRegistry.invoke(message.getWidgetId(), message.getEventType(), message.getData())
                .doOnNext(result -> {
                    if (!result.isHandled()) {
                        log.warn("Routed event {}:{} from worker {} was not handled here",
                                message.getWidgetId(), message.getEventType(), message.getSourceWorkerId());
                    }
                })
                .then();
    }

    private Mono<Void> refreshHeartbeat(String widgetId, LocalConnection connection) {
        ConnectionRouter router = connections();
        return router.getOwner(widgetId)
                .defaultIfEmpty("")
                .flatMap(owner -> {
                    if (!owner.isEmpty() && !owner.equals(workerId)) {
                        closeLocalConnection(widgetId, "now owned by " + owner);
                        return Mono.<Void>empty();
                    }
                    return router.refreshHeartbeat(widgetId)
                            .flatMap(alive -> alive
                                    ? Mono.<Void>empty()
                                    : router.registerConnection(widgetId, workerId, connection.userId, connection.sessionId)
                                            .doOnNext(info -> log.info("Re-registered expired connection for widget: {}", widgetId))
                                            .then());
                })
                .onErrorResume(e -> {
                    log.warn("Heartbeat refresh failed for widget: {}", widgetId, e);
                    return Mono.empty();
                });
    }

    private static String resolveWorkerId(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return "worker-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    private static final class LocalConnection {
        private final Sinks.Many<WidgetEvent> sink;
        private final String userId;
        private final String sessionId;
        private volatile Disposable channelSubscription;

        private LocalConnection(Sinks.Many<WidgetEvent> sink, String userId, String sessionId) {
            this.sink = sink;
            this.userId = userId;
            this.sessionId = sessionId;
        }

        private synchronized boolean emit(WidgetEvent event) {
            Sinks.EmitResult result = sink.tryEmitNext(event);
            if (result.isFailure()) {
                log.debug("Dropped event {} on local stream: {}", event.getType(), result);
            }
            return result.isSuccess();
        }

        private void close() {
            Disposable subscription = channelSubscription;
            if (subscription != null) {
                subscription.dispose();
            }
            synchronized (this) {
                sink.tryEmitComplete();
            }
        }
    }
}
