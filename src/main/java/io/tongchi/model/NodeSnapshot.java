package io.tongchi.model;

import java.time.Instant;
import java.util.List;

public record NodeSnapshot(
        String path,
        NodeStatus status,
        List<ChildDescriptor> children,
        Instant loadedAt,
        String lastError,
        boolean stale,
        boolean loadInFlight
) {
    public static NodeSnapshot unknown(String path) {
        return new NodeSnapshot(path, NodeStatus.NOT_LOADED, null, null, null, false, false);
    }

    public boolean trusted() {
        return status == NodeStatus.LOADED && !stale;
    }
}
