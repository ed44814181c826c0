package com.viewsync.generator.attach;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Latest {@link AssignmentStats} per root identity.
 */
public class AssignmentStatsStore {

    private final Map<String, AssignmentStats> statsByRoot = new HashMap<>();

    public void record(String rootIdentity, AssignmentStats stats) {
        statsByRoot.put(rootIdentity, stats);
    }

    public Optional<AssignmentStats> find(String rootIdentity) {
        return Optional.ofNullable(statsByRoot.get(rootIdentity));
    }
}
