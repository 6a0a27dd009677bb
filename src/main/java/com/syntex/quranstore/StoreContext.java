package com.syntex.quranstore;

import java.time.Duration;

import com.syntex.quranstore.db.DatabaseManager;
import com.syntex.quranstore.fetch.QuranApiFetcher;
import com.syntex.quranstore.net.RetryClient;
import com.syntex.quranstore.net.RetrySettings;
import com.syntex.quranstore.net.UrlConnectionTransport;

/**
 * Builds the per-run collaborators from {@link Config}. Every command gets its
 * own retry client; nothing network-related is shared across runs.
 */
public class StoreContext {

    private final Config config;

    public StoreContext(Config config) {
        this.config = config;
    }

    public DatabaseManager databaseManager(String dbUrlOverride) {
        String url = dbUrlOverride != null ? dbUrlOverride : config.get("db.url", DatabaseManager.DEFAULT_URL);
        if (!url.startsWith("jdbc:")) {
            return DatabaseManager.forFile(url);
        }
        return new DatabaseManager(url);
    }

    public RetrySettings retrySettings() {
        RetrySettings defaults = RetrySettings.defaults();
        return new RetrySettings(
                config.getInt("retry.max-attempts", defaults.maxAttempts()),
                config.getLong("retry.base-delay-ms", defaults.baseDelayMillis()),
                config.getLong("retry.max-delay-ms", defaults.maxDelayMillis()),
                config.getDouble("retry.jitter", defaults.jitter()));
    }

    public RetryClient retryClient(Integer maxAttemptsOverride) {
        RetrySettings settings = retrySettings();
        if (maxAttemptsOverride != null) {
            settings = settings.withMaxAttempts(maxAttemptsOverride);
        }
        String userAgent = config.get("http.user-agent", "QuranStore/1.0");
        return new RetryClient(new UrlConnectionTransport(userAgent), settings);
    }

    public QuranApiFetcher fetcher(RetryClient client) {
        return new QuranApiFetcher(client,
                config.get("api.base-url", "https://api.quran.com/api/v4"),
                config.get("audio.base-url", "https://verses.quran.foundation/"),
                config.getInt("api.reciter", 7),
                Duration.ofMillis(config.getLong("http.timeout-ms", 60_000)));
    }

    public Config getConfig() {
        return config;
    }
}
