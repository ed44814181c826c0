package com.viewsync.generator.attach;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Deduplicated attach requests kept in a {@link SessionStore} as newline separated
 * {@code rootIdentity|typeName|artifactPath} lines, sorted ordinally.
 */
public class PendingAttachQueue {

    public static final String DEFAULT_SESSION_KEY = "viewsync.pendingAttach";

    private final SessionStore sessionStore;
    private final String sessionKey;

    public PendingAttachQueue(SessionStore sessionStore) {
        this(sessionStore, DEFAULT_SESSION_KEY);
    }

    public PendingAttachQueue(SessionStore sessionStore, String sessionKey) {
        this.sessionStore = sessionStore;
        this.sessionKey = sessionKey;
    }

    /**
     * @return false if the request was already queued
     */
    public boolean add(AttachRequest request) {
        TreeSet<String> lines = readLines();
        boolean added = lines.add(request.encode());
        if (added) {
            write(lines);
        }
        return added;
    }

    /**
     * Empties the queue and returns what it held, in queue order.
     */
    public List<String> drain() {
        List<String> lines = new ArrayList<>(readLines());
        sessionStore.put(sessionKey, "");
        return lines;
    }

    /**
     * Queued requests in queue order. Malformed lines are left out.
     */
    public List<AttachRequest> pending() {
        List<AttachRequest> requests = new ArrayList<>();
        for (String line : readLines()) {
            AttachRequest.parse(line).ifPresent(requests::add);
        }
        return requests;
    }

    public boolean isEmpty() {
        return readLines().isEmpty();
    }

    private TreeSet<String> readLines() {
        String payload = sessionStore.get(sessionKey);
        if (payload == null || payload.isEmpty()) {
            return new TreeSet<>();
        }
        return Arrays.stream(payload.split("\n"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private void write(TreeSet<String> lines) {
        sessionStore.put(sessionKey, String.join("\n", lines));
    }
}
