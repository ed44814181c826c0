package com.viewsync.generator.attach.host;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.viewsync.generator.attach.ReloadSignal;

/**
 * Reload signal fired by the caller, for hosts without a reload event and for tests.
 */
public class ManualReloadSignal implements ReloadSignal {

    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    @Override
    public void subscribe(Runnable listener) {
        listeners.add(listener);
    }

    public void fire() {
        for (Runnable listener : listeners) {
            listener.run();
        }
    }

    public int getListenerCount() {
        return listeners.size();
    }
}
