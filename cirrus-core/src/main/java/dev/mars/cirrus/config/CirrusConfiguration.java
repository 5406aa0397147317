package dev.mars.cirrus.config;

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


import dev.mars.cirrus.crypto.ThumbnailNoncePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Configuration management for the Cirrus transfer engine.
 *
 * <p>Values are resolved in layers, highest priority first:</p>
 * <ol>
 *   <li>Environment variable (e.g. {@code CIRRUS_NEGOTIATION_TIMEOUT_MS})</li>
 *   <li>System property (e.g. {@code -Dcirrus.negotiation.timeout-ms=5000})</li>
 *   <li>Classpath file {@code cirrus.properties}</li>
 *   <li>Built-in default</li>
 * </ol>
 *
 * <p>The {@link #CirrusConfiguration(Properties)} constructor skips the environment,
 * system property and file layers so tests get a deterministic configuration.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 2.0
 */
public class CirrusConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(CirrusConfiguration.class);
    private static final String CONFIG_FILE = "cirrus.properties";

    public static final String NEGOTIATION_TIMEOUT_MS = "cirrus.negotiation.timeout-ms";
    public static final String STALE_THRESHOLD_MS = "cirrus.negotiation.stale-threshold-ms";
    public static final String UPLOAD_TIMEOUT_MS = "cirrus.upload.timeout-ms";
    public static final String THUMBNAIL_UPLOAD_TIMEOUT_MS = "cirrus.upload.thumbnail-timeout-ms";
    public static final String UPLOAD_MAX_ATTEMPTS = "cirrus.upload.max-attempts";
    public static final String UPLOAD_RETRY_DELAY_MS = "cirrus.upload.retry-delay-ms";
    public static final String THUMBNAIL_MAX_SOURCE_BYTES = "cirrus.thumbnail.max-source-bytes";
    public static final String THUMBNAIL_MAX_DIMENSION = "cirrus.thumbnail.max-dimension";
    public static final String THUMBNAIL_NONCE = "cirrus.thumbnail.nonce";
    public static final String SPEED_SAMPLES = "cirrus.progress.speed-samples";
    public static final String ETA_FALLBACK_SECONDS = "cirrus.progress.eta-fallback-seconds";
    public static final String EVENTBUS_PREFIX = "cirrus.eventbus.prefix";
    public static final String HTTP_PORT = "cirrus.http.port";
    public static final String MAINTENANCE_INTERVAL_MS = "cirrus.maintenance.interval-ms";
    public static final String VERSION = "cirrus.version";

    // Default configuration values
    private static final long DEFAULT_NEGOTIATION_TIMEOUT_MS = 30_000;
    private static final long DEFAULT_STALE_THRESHOLD_MS = 35_000;
    private static final long DEFAULT_UPLOAD_TIMEOUT_MS = 300_000;
    private static final long DEFAULT_THUMBNAIL_UPLOAD_TIMEOUT_MS = 60_000;
    private static final int DEFAULT_UPLOAD_MAX_ATTEMPTS = 3;
    private static final long DEFAULT_UPLOAD_RETRY_DELAY_MS = 1000;
    private static final long DEFAULT_THUMBNAIL_MAX_SOURCE_BYTES = 5L * 1024 * 1024; // 5MiB
    private static final int DEFAULT_THUMBNAIL_MAX_DIMENSION = 300;
    private static final int DEFAULT_SPEED_SAMPLES = 5;
    private static final long DEFAULT_ETA_FALLBACK_SECONDS = 3600;
    private static final String DEFAULT_EVENTBUS_PREFIX = "cirrus";
    private static final int DEFAULT_HTTP_PORT = 8085;
    private static final long DEFAULT_MAINTENANCE_INTERVAL_MS = 15_000;
    private static final String DEFAULT_VERSION = "1.0.0";

    private final Properties properties;
    private final boolean layered;

    /**
     * Loads configuration from defaults, {@code cirrus.properties}, system properties and
     * environment variables.
     */
    public CirrusConfiguration() {
        this.properties = new Properties();
        this.layered = true;
        loadConfigurationFromFile();
    }

    /**
     * Creates a configuration backed only by the given properties and the defaults.
     */
    public CirrusConfiguration(Properties properties) {
        this.properties = new Properties();
        this.layered = false;
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Negotiation

    public Duration getNegotiationTimeout() {
        return Duration.ofMillis(getLong(NEGOTIATION_TIMEOUT_MS, DEFAULT_NEGOTIATION_TIMEOUT_MS));
    }

    /**
     * Age after which an outstanding request is presumed lost.
     */
    public Duration getStaleThreshold() {
        return Duration.ofMillis(getLong(STALE_THRESHOLD_MS, DEFAULT_STALE_THRESHOLD_MS));
    }

    // Upload

    public Duration getUploadTimeout() {
        return Duration.ofMillis(getLong(UPLOAD_TIMEOUT_MS, DEFAULT_UPLOAD_TIMEOUT_MS));
    }

    public Duration getThumbnailUploadTimeout() {
        return Duration.ofMillis(getLong(THUMBNAIL_UPLOAD_TIMEOUT_MS, DEFAULT_THUMBNAIL_UPLOAD_TIMEOUT_MS));
    }

    public int getUploadMaxAttempts() {
        return getInt(UPLOAD_MAX_ATTEMPTS, DEFAULT_UPLOAD_MAX_ATTEMPTS);
    }

    public long getUploadRetryDelayMs() {
        return getLong(UPLOAD_RETRY_DELAY_MS, DEFAULT_UPLOAD_RETRY_DELAY_MS);
    }

    // Thumbnails

    public long getThumbnailMaxSourceBytes() {
        return getLong(THUMBNAIL_MAX_SOURCE_BYTES, DEFAULT_THUMBNAIL_MAX_SOURCE_BYTES);
    }

    public int getThumbnailMaxDimension() {
        return getInt(THUMBNAIL_MAX_DIMENSION, DEFAULT_THUMBNAIL_MAX_DIMENSION);
    }

    public ThumbnailNoncePolicy getThumbnailNoncePolicy() {
        String value = getString(THUMBNAIL_NONCE, ThumbnailNoncePolicy.LEGACY_ZERO.propertyValue());
        try {
            return ThumbnailNoncePolicy.fromPropertyValue(value);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid thumbnail nonce policy for {}: '{}', using default {}",
                    THUMBNAIL_NONCE, value, ThumbnailNoncePolicy.LEGACY_ZERO.propertyValue());
            return ThumbnailNoncePolicy.LEGACY_ZERO;
        }
    }

    // Progress

    public int getSpeedSamples() {
        return getInt(SPEED_SAMPLES, DEFAULT_SPEED_SAMPLES);
    }

    public long getEtaFallbackSeconds() {
        return getLong(ETA_FALLBACK_SECONDS, DEFAULT_ETA_FALLBACK_SECONDS);
    }

    // Service

    public String getEventBusPrefix() {
        return getString(EVENTBUS_PREFIX, DEFAULT_EVENTBUS_PREFIX);
    }

    public int getHttpPort() {
        return getInt(HTTP_PORT, DEFAULT_HTTP_PORT);
    }

    public long getMaintenanceIntervalMs() {
        return getLong(MAINTENANCE_INTERVAL_MS, DEFAULT_MAINTENANCE_INTERVAL_MS);
    }

    public String getVersion() {
        return getString(VERSION, DEFAULT_VERSION);
    }

    // Core property accessors

    public String getString(String key, String defaultValue) {
        if (layered) {
            String envKey = key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
            String envValue = System.getenv(envKey);
            if (envValue != null && !envValue.isEmpty()) {
                return envValue;
            }

            String sysProp = System.getProperty(key);
            if (sysProp != null && !sysProp.isEmpty()) {
                return sysProp;
            }
        }
        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Validates that values are sensible. Called during startup to fail fast on misconfiguration.
     *
     * @throws IllegalStateException if a value is out of range
     */
    public void validate() {
        requirePositive(NEGOTIATION_TIMEOUT_MS, getNegotiationTimeout().toMillis());
        requirePositive(STALE_THRESHOLD_MS, getStaleThreshold().toMillis());
        requirePositive(UPLOAD_TIMEOUT_MS, getUploadTimeout().toMillis());
        requirePositive(THUMBNAIL_UPLOAD_TIMEOUT_MS, getThumbnailUploadTimeout().toMillis());
        requirePositive(UPLOAD_MAX_ATTEMPTS, getUploadMaxAttempts());
        requirePositive(SPEED_SAMPLES, getSpeedSamples());
        requirePositive(THUMBNAIL_MAX_DIMENSION, getThumbnailMaxDimension());
        requirePositive(MAINTENANCE_INTERVAL_MS, getMaintenanceIntervalMs());

        if (getUploadRetryDelayMs() < 0) {
            throw new IllegalStateException(
                    UPLOAD_RETRY_DELAY_MS + " cannot be negative, got: " + getUploadRetryDelayMs());
        }

        int port = getHttpPort();
        if (port < 0 || port > 65535) {
            throw new IllegalStateException("HTTP port must be between 0 and 65535, got: " + port);
        }

        String prefix = getEventBusPrefix();
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalStateException(EVENTBUS_PREFIX + " cannot be blank");
        }

        logger.info("Cirrus configuration validated successfully");
    }

    /**
     * Writes the effective configuration to the log.
     */
    public void logConfiguration() {
        logger.info("=== Cirrus Configuration ===");
        logger.info("  Negotiation Timeout:  {}ms", getNegotiationTimeout().toMillis());
        logger.info("  Stale Threshold:      {}ms", getStaleThreshold().toMillis());
        logger.info("  Upload Timeout:       {}ms", getUploadTimeout().toMillis());
        logger.info("  Upload Attempts:      {}", getUploadMaxAttempts());
        logger.info("  Retry Delay:          {}ms", getUploadRetryDelayMs());
        logger.info("  Thumbnail Nonce:      {}", getThumbnailNoncePolicy().propertyValue());
        logger.info("  Event Bus Prefix:     {}", getEventBusPrefix());
        logger.info("  HTTP Port:            {}", getHttpPort());
        logger.info("  Maintenance Interval: {}ms", getMaintenanceIntervalMs());
        logger.info("============================");
    }

    private void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalStateException(key + " must be positive, got: " + value);
        }
    }

    private void loadConfigurationFromFile() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults and environment variables", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.debug("Stack trace", e);
        }
    }

    @Override
    public String toString() {
        return "CirrusConfiguration{" +
                "negotiationTimeout=" + getNegotiationTimeout() +
                ", staleThreshold=" + getStaleThreshold() +
                ", uploadMaxAttempts=" + getUploadMaxAttempts() +
                ", eventBusPrefix='" + getEventBusPrefix() + '\'' +
                '}';
    }
}
