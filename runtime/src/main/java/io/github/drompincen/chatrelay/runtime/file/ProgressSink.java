package io.github.drompincen.chatrelay.runtime.file;

@FunctionalInterface
public interface ProgressSink {

    ProgressSink NONE = (message, current, total) -> { };

    void progress(String message, int current, int total);
}
