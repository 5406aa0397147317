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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CirrusConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(CirrusConfiguration.UPLOAD_MAX_ATTEMPTS);
    }

    private static CirrusConfiguration with(String key, String value) {
        Properties properties = new Properties();
        properties.setProperty(key, value);
        return new CirrusConfiguration(properties);
    }

    // ========== Defaults ==========

    @Test
    void testDefaults() {
        CirrusConfiguration config = new CirrusConfiguration(new Properties());

        assertEquals(Duration.ofSeconds(30), config.getNegotiationTimeout());
        assertEquals(Duration.ofSeconds(35), config.getStaleThreshold());
        assertEquals(Duration.ofMinutes(5), config.getUploadTimeout());
        assertEquals(Duration.ofMinutes(1), config.getThumbnailUploadTimeout());
        assertEquals(3, config.getUploadMaxAttempts());
        assertEquals(1000, config.getUploadRetryDelayMs());
        assertEquals(5 * 1024 * 1024, config.getThumbnailMaxSourceBytes());
        assertEquals(300, config.getThumbnailMaxDimension());
        assertEquals(ThumbnailNoncePolicy.LEGACY_ZERO, config.getThumbnailNoncePolicy());
        assertEquals(5, config.getSpeedSamples());
        assertEquals(3600, config.getEtaFallbackSeconds());
        assertEquals("cirrus", config.getEventBusPrefix());
        assertEquals(8085, config.getHttpPort());
    }

    @Test
    void testBundledFileMatchesDefaults() {
        CirrusConfiguration config = new CirrusConfiguration();

        assertEquals(Duration.ofSeconds(30), config.getNegotiationTimeout());
        assertEquals(3, config.getUploadMaxAttempts());
        assertEquals(ThumbnailNoncePolicy.LEGACY_ZERO, config.getThumbnailNoncePolicy());
        assertDoesNotThrow(config::validate);
    }

    // ========== Overrides ==========

    @Test
    void testExplicitProperties() {
        CirrusConfiguration config = with(CirrusConfiguration.THUMBNAIL_NONCE, "reserved");
        assertEquals(ThumbnailNoncePolicy.RESERVED, config.getThumbnailNoncePolicy());

        config = with(CirrusConfiguration.NEGOTIATION_TIMEOUT_MS, "1500");
        assertEquals(Duration.ofMillis(1500), config.getNegotiationTimeout());
    }

    @Test
    void testSystemPropertyOverridesFile() {
        System.setProperty(CirrusConfiguration.UPLOAD_MAX_ATTEMPTS, "7");

        assertEquals(7, new CirrusConfiguration().getUploadMaxAttempts());
    }

    @Test
    void testExplicitPropertiesIgnoreSystemProperties() {
        System.setProperty(CirrusConfiguration.UPLOAD_MAX_ATTEMPTS, "7");

        assertEquals(3, new CirrusConfiguration(new Properties()).getUploadMaxAttempts());
    }

    @Test
    void testInvalidValuesFallBackToDefaults() {
        assertEquals(3, with(CirrusConfiguration.UPLOAD_MAX_ATTEMPTS, "three").getUploadMaxAttempts());
        assertEquals(ThumbnailNoncePolicy.LEGACY_ZERO,
                with(CirrusConfiguration.THUMBNAIL_NONCE, "random").getThumbnailNoncePolicy());
    }

    // ========== Validation ==========

    @Test
    void testValidationRejectsNonPositiveTimeout() {
        CirrusConfiguration config = with(CirrusConfiguration.NEGOTIATION_TIMEOUT_MS, "0");

        IllegalStateException e = assertThrows(IllegalStateException.class, config::validate);
        assertTrue(e.getMessage().contains(CirrusConfiguration.NEGOTIATION_TIMEOUT_MS));
    }

    @Test
    void testValidationRejectsNegativeRetryDelay() {
        assertThrows(IllegalStateException.class,
                with(CirrusConfiguration.UPLOAD_RETRY_DELAY_MS, "-1")::validate);
    }

    @Test
    void testValidationRejectsBadPort() {
        assertThrows(IllegalStateException.class, with(CirrusConfiguration.HTTP_PORT, "70000")::validate);
    }

    @Test
    void testValidationRejectsBlankPrefix() {
        assertThrows(IllegalStateException.class, with(CirrusConfiguration.EVENTBUS_PREFIX, " ")::validate);
    }
}
