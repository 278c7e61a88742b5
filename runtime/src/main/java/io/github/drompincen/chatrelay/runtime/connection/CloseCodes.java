package io.github.drompincen.chatrelay.runtime.connection;

public final class CloseCodes {

    public static final int NORMAL = 1000;
    public static final int GOING_AWAY = 1001;
    /** Peer stopped answering pings. */
    public static final int PONG_TIMEOUT = 4000;
    public static final int WRITE_FAILED = 4001;
    public static final int IDLE_TIMEOUT = 4002;

    private CloseCodes() {
    }
}
