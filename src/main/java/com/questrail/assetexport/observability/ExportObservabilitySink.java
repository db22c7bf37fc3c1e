package com.questrail.assetexport.observability;

/**
 * Receives structured events from the export core.
 * Implementations can provide logging, metrics, or UI notification.
 *
 * <p>Callbacks may arrive on transport or scheduler threads and must not block.</p>
 */
public interface ExportObservabilitySink {
    /**
     * Called when worker availability or the busy flag changes.
     */
    void onServiceStatus(ServiceStatusEvent event);

    /**
     * Called on every phase transition of an export request.
     */
    void onRequestPhase(RequestPhaseTransitionEvent event);

    /**
     * Called when an export task records an asset outcome.
     */
    void onAssetStatus(AssetStatusEvent event);

    /**
     * Called when an error occurs that is not propagated to a caller, or that
     * should be recorded for diagnostics in addition to being propagated.
     */
    void onError(ExportErrorEvent event);
}
