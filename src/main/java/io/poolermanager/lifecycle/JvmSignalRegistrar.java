package io.poolermanager.lifecycle;

import lombok.extern.slf4j.Slf4j;
import sun.misc.Signal;

import java.util.function.Consumer;

/**
 * Installs handlers through {@code sun.misc.Signal}. Unlike a shutdown hook, a handler does
 * not make the JVM exit, so the run command keeps waiting for the pooler to stop.
 */
@Slf4j
public class JvmSignalRegistrar implements SignalRegistrar {

    @Override
    public void register(String signal, Consumer<String> handler) {
        Signal.handle(new Signal(signal), received -> handler.accept(received.getName()));
        log.debug("Registered handler for SIG{}", signal);
    }
}
