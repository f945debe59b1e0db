package com.example.widgetstate.shared.store;

import com.example.widgetstate.shared.model.ConnectionInfo;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Tracks which worker owns the live connection of each widget.
 * <p>
 * The last registration for a widget wins. The router only records the takeover; closing the
 * superseded connection is up to the caller.
 */
public interface ConnectionRouter {

    Mono<ConnectionInfo> registerConnection(String widgetId, String workerId, String userId, String sessionId);

    Mono<ConnectionInfo> getConnectionInfo(String widgetId);

    Mono<String> getOwner(String widgetId);

    /**
     * @return {@code false} when the connection has already expired and must be registered again
     */
    Mono<Boolean> refreshHeartbeat(String widgetId);

    Mono<Boolean> unregisterConnection(String widgetId);

    Flux<String> listWorkerConnections(String workerId);
}
