package com.questrail.assetexport.observability;

/**
 * No-op implementation of ExportObservabilitySink.
 */
public final class NullObservabilitySink implements ExportObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onServiceStatus(ServiceStatusEvent event) {}

    @Override
    public void onRequestPhase(RequestPhaseTransitionEvent event) {}

    @Override
    public void onAssetStatus(AssetStatusEvent event) {}

    @Override
    public void onError(ExportErrorEvent event) {}
}
