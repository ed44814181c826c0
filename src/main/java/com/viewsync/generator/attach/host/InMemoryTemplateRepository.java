package com.viewsync.generator.attach.host;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.viewsync.generator.attach.TemplateRepository;
import com.viewsync.generator.model.ObjectNode;

/**
 * Keeps template roots in memory. Opening a root returns the stored instance itself, so
 * attach and assignment mutate the caller's tree.
 *
 * Roots that were never registered get the identity {@code template:<name>} on first use,
 * suffixed with a counter when that name is taken.
 */
public class InMemoryTemplateRepository implements TemplateRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemoryTemplateRepository.class);

    private final Map<String, ObjectNode> roots = new HashMap<>();
    private final Map<ObjectNode, String> identities = new IdentityHashMap<>();
    private final Map<String, Integer> saveCounts = new HashMap<>();

    public String register(String identity, ObjectNode root) {
        if (roots.containsKey(identity) && roots.get(identity) != root) {
            throw new IllegalArgumentException("Identity already registered: " + identity);
        }
        roots.put(identity, root);
        identities.put(root, identity);
        return identity;
    }

    @Override
    public String identityOf(ObjectNode root) {
        String identity = identities.get(root);
        if (identity != null) {
            return identity;
        }
        String candidate = "template:" + root.getName();
        int counter = 1;
        while (roots.containsKey(candidate)) {
            candidate = "template:" + root.getName() + "#" + counter++;
        }
        return register(candidate, root);
    }

    @Override
    public Optional<ObjectNode> open(String identity) {
        return Optional.ofNullable(roots.get(identity));
    }

    @Override
    public void save(String identity, ObjectNode root) {
        roots.put(identity, root);
        identities.put(root, identity);
        saveCounts.merge(identity, 1, Integer::sum);
        log.debug("Saved {}", identity);
    }

    public int getSaveCount(String identity) {
        return saveCounts.getOrDefault(identity, 0);
    }
}
