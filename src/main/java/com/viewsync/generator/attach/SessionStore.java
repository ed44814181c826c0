package com.viewsync.generator.attach;

/**
 * String values that survive the reload boundary but not a restart of the process.
 */
public interface SessionStore {

    /**
     * @return stored value, or an empty string
     */
    String get(String key);

    void put(String key, String value);
}
