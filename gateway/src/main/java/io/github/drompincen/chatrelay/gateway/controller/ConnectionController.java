package io.github.drompincen.chatrelay.gateway.controller;

import io.github.drompincen.chatrelay.runtime.connection.ConnectionRegistry;
import io.github.drompincen.chatrelay.runtime.connection.ManagedConnection;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/connections")
public class ConnectionController {

    private final ConnectionRegistry registry;

    public ConnectionController(ConnectionRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public ConnectionsView list() {
        List<ConnectionView> connections = registry.snapshot().stream()
                .map(ConnectionController::view)
                .toList();
        return new ConnectionsView(connections.size(), connections);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ConnectionView> get(@PathVariable String id) {
        return registry.find(id)
                .map(c -> ResponseEntity.ok(view(c)))
                .orElse(ResponseEntity.notFound().build());
    }

    private static ConnectionView view(ManagedConnection c) {
        return new ConnectionView(c.getId(), c.getState().name(), c.getQueueDepth(),
                c.getRetryQueue().size(), c.getCircuitBreaker().getState().name(), c.getLastPongReceived());
    }

    public record ConnectionsView(int count, List<ConnectionView> connections) {
    }

    public record ConnectionView(String id, String state, int queueDepth, int retryQueueDepth,
                                 String circuit, Instant lastPongReceived) {
    }
}
