package com.adforge.core.config;

import com.adforge.core.error.ConfigException;
import com.adforge.core.error.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigGuardTest {

    @Test
    @DisplayName("present settings pass and are returned trimmed")
    void presentSettings() {
        var env = new MockEnvironment().withProperty("KIE_API_KEY", "  key-123 ");
        var guard = new ConfigGuard(env);

        assertEquals("key-123", guard.require("KIE_API_KEY", "KIE"));
        assertDoesNotThrow(() -> guard.requireEnv(List.of("KIE_API_KEY"), "KIE"));
    }

    @Test
    @DisplayName("blank and missing settings are all named in one error")
    void missingSettings() {
        var env = new MockEnvironment().withProperty("KIE_API_KEY", "   ");
        var guard = new ConfigGuard(env);

        var error = assertThrows(ConfigException.class,
                () -> guard.requireEnv(List.of("KIE_API_KEY", "TRANSCRIPTION_MODEL"), "ad-transcripts"));

        assertEquals("ad-transcripts: KIE_API_KEY, TRANSCRIPTION_MODEL must be set", error.getMessage());
        assertEquals(ErrorKind.CONFIG, error.kind());
    }

    @Test
    @DisplayName("an empty requirement list passes")
    void nothingRequired() {
        assertDoesNotThrow(() -> new ConfigGuard(new MockEnvironment()).requireEnv(List.of(), "x"));
    }
}
