package io.github.drompincen.chatrelay.runtime.connection;

@FunctionalInterface
public interface ConnectionStateListener {

    ConnectionStateListener NONE = (connection, from, to) -> { };

    void onStateChange(ManagedConnection connection, ConnectionState from, ConnectionState to);
}
