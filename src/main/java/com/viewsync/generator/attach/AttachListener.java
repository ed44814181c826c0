package com.viewsync.generator.attach;

/**
 * Notified when a queued request is applied during a reload.
 */
public interface AttachListener {

    void onAttached(AttachRequest request);
}
