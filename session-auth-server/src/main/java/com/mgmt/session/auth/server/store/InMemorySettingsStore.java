package com.mgmt.session.auth.server.store;

import java.util.Objects;

/**
 * Keeps settings for the lifetime of the store. Callers only ever see copies.
 */
public class InMemorySettingsStore implements SettingsStore {

    private Settings settings;

    public InMemorySettingsStore() {
        this(new Settings());
    }

    public InMemorySettingsStore(Settings settings) {
        this.settings = Objects.requireNonNull(settings, "settings").copy();
    }

    @Override
    public synchronized Settings read() {
        return settings.copy();
    }

    @Override
    public synchronized void write(Settings settings) {
        this.settings = Objects.requireNonNull(settings, "settings").copy();
    }
}
