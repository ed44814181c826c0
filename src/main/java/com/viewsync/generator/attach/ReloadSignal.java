package com.viewsync.generator.attach;

/**
 * Fires after the host has compiled and reloaded generated code. May fire any number of times.
 */
public interface ReloadSignal {

    void subscribe(Runnable listener);
}
