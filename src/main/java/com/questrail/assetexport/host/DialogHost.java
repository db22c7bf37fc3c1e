package com.questrail.assetexport.host;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * DialogHost
 * -----------------------------------------------------------------------------
 * Native folder chooser plus the switches that suspend keyboard/pointer input
 * policies while it is open.
 *
 * <p>Callers pair every {@link #suspendInputPolicies()} with exactly one
 * {@link #restoreInputPolicies()}, on every exit path.</p>
 */
public interface DialogHost
{
    /**
     * Opens a folder chooser initialised at {@code seedPath}.
     *
     * @return the chosen folder, or empty if the user cancelled
     */
    CompletableFuture<Optional<String>> chooseFolder(String seedPath);

    CompletableFuture<Void> suspendInputPolicies();

    CompletableFuture<Void> restoreInputPolicies();
}
