package com.questrail.assetexport.host;

/**
 * Mutable test layer.
 */
public final class FakeLayer implements LayerView {

    private final long id;
    private final String name;
    private final boolean exportable;
    private final boolean artboard;
    private volatile boolean exportEnabled;

    public FakeLayer(long id, String name, boolean exportable, boolean artboard, boolean exportEnabled) {
        this.id = id;
        this.name = name;
        this.exportable = exportable;
        this.artboard = artboard;
        this.exportEnabled = exportEnabled;
    }

    public static FakeLayer layer(long id, String name) {
        return new FakeLayer(id, name, true, false, false);
    }

    public static FakeLayer enabled(long id, String name) {
        return new FakeLayer(id, name, true, false, true);
    }

    public static FakeLayer artboard(long id, String name) {
        return new FakeLayer(id, name, true, true, false);
    }

    public static FakeLayer unexportable(long id, String name) {
        return new FakeLayer(id, name, false, false, false);
    }

    @Override public long id() { return id; }
    @Override public String name() { return name; }
    @Override public boolean exportEnabled() { return exportEnabled; }
    @Override public boolean isExportable() { return exportable; }
    @Override public boolean isArtboard() { return artboard; }

    public void setExportEnabled(boolean enabled) {
        this.exportEnabled = enabled;
    }
}
