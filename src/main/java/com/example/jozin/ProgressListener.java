package com.example.jozin;

@FunctionalInterface
public interface ProgressListener {
    /**
     * Receives progress events. Called from worker threads when a scan runs with more than one thread.
     */
    void onEvent(ProgressEvent event);

    /**
     * Listener that ignores every event.
     */
    ProgressListener NONE = event -> {
    };
}
