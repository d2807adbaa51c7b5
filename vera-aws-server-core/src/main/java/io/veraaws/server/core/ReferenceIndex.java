package io.veraaws.server.core;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Secondary index from a referenced id to the ids of resources referencing it.
 *
 * <p>Not thread-safe; guarded by the owning store's lock.
 */
final class ReferenceIndex {
    private final Map<String, Set<String>> referrers = new HashMap<>();

    void add(String referrerId, Collection<String> targetIds) {
        for (String target : targetIds) {
            referrers.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(referrerId);
        }
    }

    void remove(String referrerId, Collection<String> targetIds) {
        for (String target : targetIds) {
            Set<String> set = referrers.get(target);
            if (set == null) continue;
            set.remove(referrerId);
            if (set.isEmpty()) referrers.remove(target);
        }
    }

    Set<String> referrersOf(String targetId) {
        Set<String> set = referrers.get(targetId);
        return set == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(set));
    }

    int size() {
        return referrers.size();
    }
}
