package com.questrail.assetexport.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ExportObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jExportObservabilitySink implements ExportObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jExportObservabilitySink.class);

    @Override
    public void onServiceStatus(ServiceStatusEvent event) {
        log.info("Export service: available={} busy={}", event.available(), event.busy());
    }

    @Override
    public void onRequestPhase(RequestPhaseTransitionEvent event) {
        if (event.isTerminal()) {
            log.info("Export request {} (document {}): {} -> {}",
                event.requestId(), event.documentId(), event.from(), event.to());
        } else {
            log.debug("Export request {} (document {}): {} -> {}",
                event.requestId(), event.documentId(), event.from(), event.to());
        }
    }

    @Override
    public void onAssetStatus(AssetStatusEvent event) {
        log.debug("Asset {} of layer {} in document {}: {} {}",
            event.assetIndex(),
            event.layerId().isPresent() ? event.layerId().getAsLong() : "(document)",
            event.documentId(),
            event.status(),
            event.filePath());
    }

    @Override
    public void onError(ExportErrorEvent event) {
        if (event.severity() == ExportErrorEvent.Severity.WARNING) {
            log.warn("Export: {}", event.message(), event.cause());
        } else {
            log.error("Export: {}", event.message(), event.cause());
        }
    }
}
