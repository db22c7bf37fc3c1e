package com.questrail.assetexport.connection;

import com.questrail.assetexport.api.WorkerConnectionException;
import com.questrail.assetexport.host.FakePreferenceStore;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPortResolverTest {

    private static final String KEY = "workerSettings";

    private final FakePreferenceStore preferences = new FakePreferenceStore();
    private final WorkerPortResolver resolver = new WorkerPortResolver(preferences, KEY);

    @Test
    void readsNumericPort() {
        preferences.set(KEY, "{\"websocketServerPort\": 52000, \"other\": true}");

        assertEquals(52000, resolver.resolve());
    }

    @Test
    void readsPortWrittenAsString() {
        preferences.set(KEY, "{\"websocketServerPort\": \" 8081 \"}");

        assertEquals(8081, resolver.resolve());
    }

    @Test
    void picksUpRepublishedPort() {
        preferences.set(KEY, "{\"websocketServerPort\": 1000}");
        assertEquals(1000, resolver.resolve());

        preferences.set(KEY, "{\"websocketServerPort\": 2000}");
        assertEquals(2000, resolver.resolve());
    }

    @Test
    void missingSettingsFail() {
        assertThrows(WorkerConnectionException.class, resolver::resolve);

        preferences.set(KEY, "  ");
        assertThrows(WorkerConnectionException.class, resolver::resolve);
    }

    @Test
    void malformedSettingsFail() {
        preferences.set(KEY, "{not json");

        assertThrows(WorkerConnectionException.class, resolver::resolve);
    }

    @Test
    void missingOrInvalidPortFails() {
        preferences.set(KEY, "{}");
        assertThrows(WorkerConnectionException.class, resolver::resolve);

        preferences.set(KEY, "{\"websocketServerPort\": \"eighty\"}");
        assertThrows(WorkerConnectionException.class, resolver::resolve);

        preferences.set(KEY, "{\"websocketServerPort\": [1]}");
        assertThrows(WorkerConnectionException.class, resolver::resolve);
    }

    @Test
    void outOfRangePortFails() {
        preferences.set(KEY, "{\"websocketServerPort\": 0}");
        assertThrows(WorkerConnectionException.class, resolver::resolve);

        preferences.set(KEY, "{\"websocketServerPort\": 70000}");
        assertThrows(WorkerConnectionException.class, resolver::resolve);
    }
}
