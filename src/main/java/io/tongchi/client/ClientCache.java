package io.tongchi.client;

import io.tongchi.error.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ClientCache<C> {
    private static final Logger log = LoggerFactory.getLogger(ClientCache.class);

    private final String name;
    private ClientFactory<C> factory;
    private C client;
    private long generation;
    private long creations;

    public ClientCache(String name, ClientFactory<C> factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("client cache name cannot be empty");
        }
        if (factory == null) {
            throw new IllegalArgumentException("client factory cannot be null: " + name);
        }
        this.name = name;
        this.factory = factory;
    }

    public String name() {
        return name;
    }

    public synchronized C get() throws TransportException {
        if (client != null) {
            return client;
        }
        try {
            C created = factory.create();
            if (created == null) {
                throw new TransportException("client factory returned null: " + name);
            }
            client = created;
            creations++;
            log.debug("Created client {} (generation {})", name, generation);
            return client;
        } catch (TransportException e) {
            throw e;
        } catch (Exception e) {
            throw new TransportException("failed to create client " + name + ": " + e.getMessage(), e);
        }
    }

    public synchronized void reset() {
        if (client instanceof AutoCloseable) {
            try {
                ((AutoCloseable) client).close();
            } catch (Exception e) {
                log.warn("Closing client {} failed: {}", name, e.getMessage());
            }
        }
        client = null;
        generation++;
    }

    public synchronized void reinject(ClientFactory<C> replacement) {
        if (replacement == null) {
            throw new IllegalArgumentException("client factory cannot be null: " + name);
        }
        reset();
        this.factory = replacement;
    }

    public synchronized boolean isCreated() {
        return client != null;
    }

    public synchronized long generation() {
        return generation;
    }

    public synchronized long creations() {
        return creations;
    }
}
