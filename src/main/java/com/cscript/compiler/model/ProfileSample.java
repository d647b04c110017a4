package com.cscript.compiler.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import lombok.Value;

/**
 * Per-function hit counts gathered from one instrumented run.
 */
@Value
public class ProfileSample {

    Map<String, Long> hitCounts;

    private ProfileSample(Map<String, Long> hitCounts) {
        this.hitCounts = Collections.unmodifiableMap(new TreeMap<>(hitCounts));
    }

    public static ProfileSample of(Map<String, Long> hitCounts) {
        return new ProfileSample(hitCounts);
    }

    public static ProfileSample empty() {
        return new ProfileSample(Map.of());
    }

    public long countOf(String function) {
        return hitCounts.getOrDefault(function, 0L);
    }

    public boolean isEmpty() {
        return hitCounts.isEmpty();
    }
}
