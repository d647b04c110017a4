package com.cscript.compiler.build.profile;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.cscript.compiler.model.ProfileSample;

/**
 * Picks the functions that get the hot attribute in the final build: those
 * with a positive count, highest count first, ties broken by name.
 */
public class HotFunctionSelector {

    public static final int DEFAULT_LIMIT = 16;

    private static final Comparator<Map.Entry<String, Long>> HOTTEST_FIRST =
            Map.Entry.<String, Long>comparingByValue().reversed()
                    .thenComparing(Map.Entry.comparingByKey());

    public List<String> select(ProfileSample sample, int limit) {
        return sample.getHitCounts().entrySet().stream()
                .filter(entry -> entry.getValue() > 0)
                .sorted(HOTTEST_FIRST)
                .limit(Math.max(0, limit))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
