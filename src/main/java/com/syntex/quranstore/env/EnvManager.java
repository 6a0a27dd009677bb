package com.syntex.quranstore.env;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Reads .env and system environment variables.
 */
public class EnvManager {

    private static EnvManager instance;
    private final Dotenv dotenv;

    private EnvManager() {
        dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
    }

    public static synchronized EnvManager getInstance() {
        if (instance == null) {
            instance = new EnvManager();
        }
        return instance;
    }

    public String get(EnvKey key) {
        String value = dotenv.get(key.key());
        return value == null || value.isBlank() ? null : value.trim();
    }
}
