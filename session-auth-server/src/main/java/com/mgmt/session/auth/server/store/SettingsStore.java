package com.mgmt.session.auth.server.store;

/**
 * Read/write access to the persistent {@link Settings} record.
 * Implement this over a database, a file, etc.
 */
public interface SettingsStore {

    Settings read();

    void write(Settings settings);
}
