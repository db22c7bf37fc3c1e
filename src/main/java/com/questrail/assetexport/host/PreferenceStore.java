package com.questrail.assetexport.host;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * String-keyed persistent user preferences.
 */
public interface PreferenceStore
{
    Optional<String> get(String key);

    CompletableFuture<Void> set(String key, String value);
}
