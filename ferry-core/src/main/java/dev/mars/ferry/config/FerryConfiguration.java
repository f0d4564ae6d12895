/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.ferry.config;

import dev.mars.ferry.core.TransferPreferences;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for Ferry.
 * Handles loading and providing access to coordinator, storage and gateway parameters.
 *
 * <p>Values are layered: built-in defaults, then the first readable {@code ferry.properties}
 * file found on disk, then {@code ferry.properties} on the classpath, then {@code ferry.*}
 * system properties.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class FerryConfiguration {
    private static final Logger logger = Logger.getLogger(FerryConfiguration.class.getName());

    public static final String MAX_ACTIVE_REQUESTS = "ferry.coordinator.max.active";
    public static final String TRANSFER_PREFERENCES = "ferry.transfer.preferences";
    public static final String STORAGE_ROOT = "ferry.storage.root";
    public static final String STAGING_DIR = "ferry.storage.staging.dir";
    public static final String REPOSITORY_FILE = "ferry.repository.file";
    public static final String HTTP_MAX_REQUESTS = "ferry.http.max.requests";
    public static final String HTTP_MAX_RETRIES = "ferry.http.max.retries";
    public static final String HTTP_RETRY_DELAY_MS = "ferry.http.retry.delay.ms";
    public static final String HTTP_CONNECT_TIMEOUT_MS = "ferry.http.connect.timeout.ms";
    public static final String HTTP_MIN_FREE_BYTES = "ferry.http.min.free.bytes";
    public static final String METRICS_ENABLED = "ferry.monitoring.metrics.enabled";

    // Default configuration values
    private static final int DEFAULT_MAX_ACTIVE_REQUESTS = 5;
    private static final TransferPreferences DEFAULT_TRANSFER_PREFERENCES = TransferPreferences.ALLOW_CELLULAR_AND_BATTERY;
    private static final String DEFAULT_STORAGE_ROOT = Paths.get(System.getProperty("java.io.tmpdir"), "ferry").toString();
    private static final String DEFAULT_STAGING_DIR = "shared/transfers";
    private static final String DEFAULT_REPOSITORY_FILE = "ferry-transfers.json";
    private static final int DEFAULT_HTTP_MAX_REQUESTS = 5;
    private static final int DEFAULT_HTTP_MAX_RETRIES = 3;
    private static final long DEFAULT_HTTP_RETRY_DELAY_MS = 1000;
    private static final int DEFAULT_HTTP_CONNECT_TIMEOUT_MS = 30000;
    private static final long DEFAULT_HTTP_MIN_FREE_BYTES = 0;

    private final Properties properties;

    public FerryConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public FerryConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Coordinator Configuration
    public int getMaxActiveRequests() {
        int value = getIntProperty(MAX_ACTIVE_REQUESTS, DEFAULT_MAX_ACTIVE_REQUESTS);
        if (value < 1) {
            logger.warning("Invalid value for property " + MAX_ACTIVE_REQUESTS + ": " + value +
                    ". Using default: " + DEFAULT_MAX_ACTIVE_REQUESTS);
            return DEFAULT_MAX_ACTIVE_REQUESTS;
        }
        return value;
    }

    public TransferPreferences getTransferPreferences() {
        String value = properties.getProperty(TRANSFER_PREFERENCES);
        if (value != null) {
            try {
                return TransferPreferences.valueOf(value.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                logger.warning("Invalid transfer preferences for property " + TRANSFER_PREFERENCES + ": " + value +
                        ". Using default: " + DEFAULT_TRANSFER_PREFERENCES);
            }
        }
        return DEFAULT_TRANSFER_PREFERENCES;
    }

    // Storage Configuration
    public Path getStorageRoot() {
        return Paths.get(getStringProperty(STORAGE_ROOT, DEFAULT_STORAGE_ROOT));
    }

    /**
     * @return the staging directory relative to the storage root, without surrounding slashes
     */
    public String getStagingDirectory() {
        String value = getStringProperty(STAGING_DIR, DEFAULT_STAGING_DIR).trim();
        while (value.startsWith("/")) {
            value = value.substring(1);
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value.isEmpty() ? DEFAULT_STAGING_DIR : value;
    }

    public Path getRepositoryFile() {
        Path file = Paths.get(getStringProperty(REPOSITORY_FILE, DEFAULT_REPOSITORY_FILE));
        return file.isAbsolute() ? file : getStorageRoot().resolve(file);
    }

    // HTTP Gateway Configuration
    public int getHttpMaxRequests() {
        return getIntProperty(HTTP_MAX_REQUESTS, DEFAULT_HTTP_MAX_REQUESTS);
    }

    public int getHttpMaxRetries() {
        return getIntProperty(HTTP_MAX_RETRIES, DEFAULT_HTTP_MAX_RETRIES);
    }

    public long getHttpRetryDelayMs() {
        return getLongProperty(HTTP_RETRY_DELAY_MS, DEFAULT_HTTP_RETRY_DELAY_MS);
    }

    public int getHttpConnectTimeoutMs() {
        return getIntProperty(HTTP_CONNECT_TIMEOUT_MS, DEFAULT_HTTP_CONNECT_TIMEOUT_MS);
    }

    public long getHttpMinFreeBytes() {
        return getLongProperty(HTTP_MIN_FREE_BYTES, DEFAULT_HTTP_MIN_FREE_BYTES);
    }

    // Monitoring Configuration
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    // Utility methods for type conversion
    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                        ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid long value for property " + key + ": " + value +
                        ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(MAX_ACTIVE_REQUESTS, String.valueOf(DEFAULT_MAX_ACTIVE_REQUESTS));
        properties.setProperty(TRANSFER_PREFERENCES, DEFAULT_TRANSFER_PREFERENCES.name());
        properties.setProperty(STORAGE_ROOT, DEFAULT_STORAGE_ROOT);
        properties.setProperty(STAGING_DIR, DEFAULT_STAGING_DIR);
        properties.setProperty(REPOSITORY_FILE, DEFAULT_REPOSITORY_FILE);
        properties.setProperty(HTTP_MAX_REQUESTS, String.valueOf(DEFAULT_HTTP_MAX_REQUESTS));
        properties.setProperty(HTTP_MAX_RETRIES, String.valueOf(DEFAULT_HTTP_MAX_RETRIES));
        properties.setProperty(HTTP_RETRY_DELAY_MS, String.valueOf(DEFAULT_HTTP_RETRY_DELAY_MS));
        properties.setProperty(HTTP_CONNECT_TIMEOUT_MS, String.valueOf(DEFAULT_HTTP_CONNECT_TIMEOUT_MS));
        properties.setProperty(HTTP_MIN_FREE_BYTES, String.valueOf(DEFAULT_HTTP_MIN_FREE_BYTES));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "ferry.properties",
                "config/ferry.properties",
                System.getProperty("user.home") + "/.ferry/ferry.properties",
                "/etc/ferry/ferry.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("ferry.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("ferry."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "FerryConfiguration{" +
                "maxActiveRequests=" + getMaxActiveRequests() +
                ", transferPreferences=" + getTransferPreferences() +
                ", storageRoot=" + getStorageRoot() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
