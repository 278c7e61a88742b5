package io.github.drompincen.chatrelay.runtime.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bookkeeping of live connections by id. Has its own lock and never calls into a connection
 * while holding it.
 */
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ManagedConnection> connections = new LinkedHashMap<>();

    public void register(ManagedConnection connection) {
        lock.lock();
        try {
            connections.put(connection.getId(), connection);
        } finally {
            lock.unlock();
        }
        log.debug("Registered connection {}", connection.getId());
    }

    public void unregister(String id) {
        ManagedConnection removed;
        lock.lock();
        try {
            removed = connections.remove(id);
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            log.debug("Unregistered connection {}", id);
        }
    }

    public Optional<ManagedConnection> find(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(connections.get(id));
        } finally {
            lock.unlock();
        }
    }

    public List<ManagedConnection> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(connections.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return connections.size();
        } finally {
            lock.unlock();
        }
    }

    public void closeAll() {
        List<ManagedConnection> all;
        lock.lock();
        try {
            all = new ArrayList<>(connections.values());
            connections.clear();
        } finally {
            lock.unlock();
        }
        if (!all.isEmpty()) {
            log.info("Closing {} connection(s)", all.size());
        }
        for (ManagedConnection connection : all) {
            connection.close(CloseCodes.GOING_AWAY, "server shutdown");
        }
    }
}
