package com.viewsync.generator.attach.host;

import java.util.HashMap;
import java.util.Map;

import com.viewsync.generator.attach.SessionStore;

public class InMemorySessionStore implements SessionStore {

    private final Map<String, String> values = new HashMap<>();

    @Override
    public String get(String key) {
        return values.getOrDefault(key, "");
    }

    @Override
    public void put(String key, String value) {
        values.put(key, value == null ? "" : value);
    }
}
