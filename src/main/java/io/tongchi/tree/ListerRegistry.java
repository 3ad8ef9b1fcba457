package io.tongchi.tree;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class ListerRegistry {
    private final Map<String, Lister> listers = new ConcurrentHashMap<>();

    public void bind(String prefix, Lister lister) {
        if (prefix == null) {
            throw new IllegalArgumentException("lister prefix cannot be null");
        }
        if (lister == null) {
            throw new IllegalArgumentException("lister cannot be null: " + prefix);
        }
        listers.put(prefix, lister);
    }

    public boolean unbind(String prefix) {
        return prefix != null && listers.remove(prefix) != null;
    }

    public Optional<Lister> resolve(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String best = null;
        for (String prefix : listers.keySet()) {
            if (path.startsWith(prefix) && (best == null || prefix.length() > best.length())) {
                best = prefix;
            }
        }
        return best == null ? Optional.empty() : Optional.ofNullable(listers.get(best));
    }

    public Set<String> prefixes() {
        return new TreeSet<>(listers.keySet());
    }
}
