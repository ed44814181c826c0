package com.viewsync.generator.attach;

public enum AttachState {
    /**
     * Resolved now. The behaviour is attached, or the type needs no attaching.
     */
    APPLIED,
    /**
     * Not resolvable yet, retried on the next reload.
     */
    QUEUED
}
