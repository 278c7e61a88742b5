package io.github.drompincen.chatrelay.runtime.connection;

/**
 * A transport that already exists when its {@link ManagedConnection} is created, such as a
 * session accepted by the server. The listener is attached instead of being passed to a dial.
 */
public interface AcceptedConnection extends Connection {

    String id();

    void attach(TransportListener listener);
}
