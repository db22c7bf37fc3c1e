package com.questrail.assetexport.host;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory preferences.
 */
public final class FakePreferenceStore implements PreferenceStore {

    private final Map<String, String> values = new HashMap<>();

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public synchronized CompletableFuture<Void> set(String key, String value) {
        values.put(key, value);
        return CompletableFuture.completedFuture(null);
    }

    public synchronized void remove(String key) {
        values.remove(key);
    }
}
