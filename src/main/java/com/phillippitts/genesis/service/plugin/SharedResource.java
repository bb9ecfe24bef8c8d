package com.phillippitts.genesis.service.plugin;

/**
 * Runtime services a plugin may ask for. Only declared resources are handed over.
 */
public enum SharedResource {
    /** Persistent key/value store. */
    STORAGE,
    /** Daily task scheduler. */
    SCHEDULER,
    /** Robot speech and motion output. */
    HARDWARE_LINK,
    /** Application configuration. */
    SETTINGS,
    /** Executor that runs dialogue work. */
    MAIN_LOOP
}
