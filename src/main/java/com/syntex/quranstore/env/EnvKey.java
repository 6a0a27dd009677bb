package com.syntex.quranstore.env;

/**
 * Environment variables (or .env entries) that override config.properties.
 */
public enum EnvKey {
    DB_URL("QURAN_DB_URL", "db.url"),
    API_BASE("QURAN_API_BASE", "api.base-url"),
    AUDIO_BASE("QURAN_AUDIO_BASE", "audio.base-url"),
    MAX_WORKERS("QURAN_MAX_WORKERS", "ingest.workers"),
    MAX_ATTEMPTS("QURAN_MAX_ATTEMPTS", "retry.max-attempts");

    private final String key;
    private final String property;

    EnvKey(String key, String property) {
        this.key = key;
        this.property = property;
    }

    public String key() {
        return key;
    }

    /** The config.properties entry this variable overrides. */
    public String property() {
        return property;
    }
}
