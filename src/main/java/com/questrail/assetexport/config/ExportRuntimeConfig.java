package com.questrail.assetexport.config;

import com.questrail.assetexport.connection.HandshakePolicy;

import java.util.Objects;

/**
 * Aggregated configuration for the export runtime.
 *
 * @param handshake               worker handshake timing and retry
 * @param debugMode               enables the quick reattach check before the regular handshake
 * @param workerHost              interface the worker listens on
 * @param workerSettingsKey       preference holding the worker's JSON settings blob
 * @param artboardPrefixKey       preference holding the artboard-prefix toggle
 * @param metadataNamespace       extension-data namespace for persisted export metadata
 * @param metadataKey             key within {@code metadataNamespace}
 * @param historyName             name of history states created by asset edits
 * @param defaultDocumentFilename base filename for documents that have no name
 */
public record ExportRuntimeConfig(
    HandshakePolicy handshake,
    boolean debugMode,
    String workerHost,
    String workerSettingsKey,
    String artboardPrefixKey,
    String metadataNamespace,
    String metadataKey,
    String historyName,
    String defaultDocumentFilename
) {
    public ExportRuntimeConfig {
        Objects.requireNonNull(handshake, "handshake");
        Objects.requireNonNull(workerHost, "workerHost");
        Objects.requireNonNull(workerSettingsKey, "workerSettingsKey");
        Objects.requireNonNull(artboardPrefixKey, "artboardPrefixKey");
        Objects.requireNonNull(metadataNamespace, "metadataNamespace");
        Objects.requireNonNull(metadataKey, "metadataKey");
        Objects.requireNonNull(historyName, "historyName");
        Objects.requireNonNull(defaultDocumentFilename, "defaultDocumentFilename");
    }

    public static ExportRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private HandshakePolicy handshake = HandshakePolicy.defaults();
        private boolean debugMode = false;
        private String workerHost = "127.0.0.1";
        private String workerSettingsKey = "exportWorkerSettings";
        private String artboardPrefixKey = "exportUseArtboardPrefix";
        private String metadataNamespace = "com.questrail.assetexport";
        private String metadataKey = "exportsMetadata";
        private String historyName = "Modify Export Assets";
        private String defaultDocumentFilename = "Untitled";

        public Builder withHandshake(HandshakePolicy handshake) {
            this.handshake = handshake;
            return this;
        }

        public Builder withDebugMode(boolean debugMode) {
            this.debugMode = debugMode;
            return this;
        }

        public Builder withWorkerHost(String workerHost) {
            this.workerHost = workerHost;
            return this;
        }

        public Builder withWorkerSettingsKey(String key) {
            this.workerSettingsKey = key;
            return this;
        }

        public Builder withArtboardPrefixKey(String key) {
            this.artboardPrefixKey = key;
            return this;
        }

        public Builder withMetadataNamespace(String namespace) {
            this.metadataNamespace = namespace;
            return this;
        }

        public Builder withMetadataKey(String key) {
            this.metadataKey = key;
            return this;
        }

        public Builder withHistoryName(String name) {
            this.historyName = name;
            return this;
        }

        public Builder withDefaultDocumentFilename(String filename) {
            this.defaultDocumentFilename = filename;
            return this;
        }

        public ExportRuntimeConfig build() {
            return new ExportRuntimeConfig(handshake, debugMode, workerHost, workerSettingsKey,
                artboardPrefixKey, metadataNamespace, metadataKey, historyName, defaultDocumentFilename);
        }
    }
}
