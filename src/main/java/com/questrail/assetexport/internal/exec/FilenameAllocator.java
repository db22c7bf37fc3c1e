package com.questrail.assetexport.internal.exec;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Hands out base filenames that are unique within one batch.
 *
 * <p>The first use of a name returns it unchanged; later uses append
 * {@code " 1"}, {@code " 2"}, and so on. Not thread-safe; one instance per batch.</p>
 */
final class FilenameAllocator
{
    private final Map<String, Integer> repeats = new HashMap<>();

    String allocate(String baseName) {
        Objects.requireNonNull(baseName, "baseName");

        Integer seen = repeats.get(baseName);
        if (seen == null) {
            repeats.put(baseName, 0);
            return baseName;
        }
        int next = seen + 1;
        repeats.put(baseName, next);
        return baseName + " " + next;
    }

    /**
     * Final filename handed to the worker: {@code [prefix + "-"] + base + suffix}.
     */
    static String compose(String prefix, String baseName, String suffix) {
        StringBuilder sb = new StringBuilder();
        if (prefix != null && !prefix.isEmpty()) {
            sb.append(prefix).append('-');
        }
        return sb.append(baseName).append(suffix).toString();
    }
}
