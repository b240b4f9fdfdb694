package io.poolermanager.lifecycle;

import java.util.function.Consumer;

/**
 * Installs process-level signal handlers.
 */
public interface SignalRegistrar {

    /**
     * Route {@code signal} (e.g. {@code INT}, {@code TERM}) to {@code handler}, which receives
     * the signal name.
     */
    void register(String signal, Consumer<String> handler);
}
