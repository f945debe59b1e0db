package com.example.widgetstate.shared.manager;

import com.example.widgetstate.shared.callback.CallbackRegistryStats;
import com.example.widgetstate.shared.model.StateBackend;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Set;

@Getter
@Builder
@ToString
public class ManagerStats {
    private final String workerId;
    private final boolean deployMode;
    private final StateBackend backend;
    private final boolean initialized;
    private final int localConnectionCount;
    private final Set<String> localConnectionIds;
    private final CallbackRegistryStats callbacks;
}
