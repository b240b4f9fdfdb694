package io.poolermanager.reconciler;

import java.io.IOException;

/**
 * Makes the running pooler re-read its configuration file.
 */
@FunctionalInterface
public interface PoolerReloader {

    void reload() throws IOException;
}
