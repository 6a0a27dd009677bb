package com.syntex.quranstore;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import com.syntex.quranstore.env.EnvKey;
import com.syntex.quranstore.env.EnvManager;

/**
 * config.properties from the classpath, with environment overrides for the
 * keys listed in {@link EnvKey}.
 */
public class Config {

    private final Properties props = new Properties();
    private final EnvManager env;

    public Config() {
        this("config.properties", EnvManager.getInstance());
    }

    Config(String resource, EnvManager env) {
        this.env = env;
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (input != null) {
                props.load(input);
            } else {
                System.err.println("⚠ " + resource + " not found, using built-in defaults");
            }
        } catch (IOException e) {
            System.err.println("⚠ Error loading " + resource + ": " + e.getMessage());
        }
    }

    public String get(String key, String defaultValue) {
        if (env != null) {
            for (EnvKey envKey : EnvKey.values()) {
                if (envKey.property().equals(key) && env.get(envKey) != null) {
                    return env.get(envKey);
                }
            }
        }
        String value = props.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    public int getInt(String key, int defaultValue) {
        try {
            return Integer.parseInt(get(key, String.valueOf(defaultValue)));
        } catch (NumberFormatException e) {
            System.err.println("⚠ " + key + " is not a number, using " + defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        try {
            return Long.parseLong(get(key, String.valueOf(defaultValue)));
        } catch (NumberFormatException e) {
            System.err.println("⚠ " + key + " is not a number, using " + defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        try {
            return Double.parseDouble(get(key, String.valueOf(defaultValue)));
        } catch (NumberFormatException e) {
            System.err.println("⚠ " + key + " is not a number, using " + defaultValue);
            return defaultValue;
        }
    }
}
