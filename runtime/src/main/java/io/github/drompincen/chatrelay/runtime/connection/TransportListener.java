package io.github.drompincen.chatrelay.runtime.connection;

public interface TransportListener {

    void onText(String payload);

    void onPong();

    void onClose(int code, String reason);

    void onError(Throwable error);
}
