package com.example.widgetstate.shared.store.memory;

import com.example.widgetstate.shared.config.WidgetStateProperties;
import com.example.widgetstate.shared.model.StateBackend;
import com.example.widgetstate.shared.store.PermissionResolver;
import com.example.widgetstate.shared.store.StateBackendFactory;
import com.example.widgetstate.shared.store.StateStores;

import java.time.Clock;

public class MemoryStateBackendFactory implements StateBackendFactory {

    @Override
    public StateBackend backend() {
        return StateBackend.MEMORY;
    }

    @Override
    public StateStores create(WidgetStateProperties properties, Clock clock) {
        WidgetStateProperties.Session session = properties.getSession();
        return new StateStores(
                new MemoryWidgetStore(clock),
                new MemoryEventBus(properties.getEventBus().getSubscriberQueueCapacity()),
                new MemoryConnectionRouter(clock),
                new MemorySessionStore(clock, properties.getTtl().getSession(), session.getRolePermissions(),
                        new PermissionResolver(session.getPermissionPolicy(), session.getSuperuserRoles())));
    }
}
