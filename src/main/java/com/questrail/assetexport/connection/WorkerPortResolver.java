package com.questrail.assetexport.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.assetexport.api.WorkerConnectionException;
import com.questrail.assetexport.host.PreferenceStore;

import java.util.Objects;
import java.util.Optional;

/**
 * Reads the worker's listening port from the settings blob the worker
 * publishes in the preferences.
 *
 * <p>The blob is a JSON object; the port lives in {@code websocketServerPort}
 * and may be written either as a number or as a numeric string.</p>
 */
public final class WorkerPortResolver
{
    static final String PORT_FIELD = "websocketServerPort";

    private final PreferenceStore preferences;
    private final String settingsKey;
    private final ObjectMapper mapper;

    public WorkerPortResolver(PreferenceStore preferences, String settingsKey) {
        this(preferences, settingsKey, new ObjectMapper());
    }

    public WorkerPortResolver(PreferenceStore preferences, String settingsKey, ObjectMapper mapper) {
        this.preferences = Objects.requireNonNull(preferences, "preferences");
        this.settingsKey = Objects.requireNonNull(settingsKey, "settingsKey");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * @return the port currently published by the worker
     * @throws WorkerConnectionException if no settings are stored or they carry no usable port
     */
    public int resolve() {
        Optional<String> raw = preferences.get(settingsKey);
        if (raw.isEmpty() || raw.get().isBlank()) {
            throw new WorkerConnectionException("No worker settings stored under '" + settingsKey + "'");
        }

        JsonNode settings;
        try {
            settings = mapper.readTree(raw.get());
        } catch (JsonProcessingException e) {
            throw new WorkerConnectionException("Worker settings under '" + settingsKey + "' are not valid JSON", e);
        }

        JsonNode port = settings == null ? null : settings.get(PORT_FIELD);
        if (port == null || port.isNull()) {
            throw new WorkerConnectionException("Worker settings carry no " + PORT_FIELD);
        }

        int value;
        if (port.isIntegralNumber() && port.canConvertToInt()) {
            value = port.intValue();
        } else if (port.isTextual()) {
            try {
                value = Integer.parseInt(port.asText().trim());
            } catch (NumberFormatException e) {
                throw new WorkerConnectionException("Worker port '" + port.asText() + "' is not a number", e);
            }
        } else {
            throw new WorkerConnectionException("Worker port has unexpected type: " + port.getNodeType());
        }

        if (value < 1 || value > 65535) {
            throw new WorkerConnectionException("Worker port out of range: " + value);
        }
        return value;
    }
}
