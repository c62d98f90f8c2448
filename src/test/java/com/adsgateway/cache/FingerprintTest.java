package com.adsgateway.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintTest {

    @Test
    @DisplayName("Should ignore the order of named parameters")
    void shouldIgnoreParameterOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("level", "campaign");
        first.put("time_range", Map.of("since", "2024-01-01", "until", "2024-01-31"));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("time_range", Map.of("until", "2024-01-31", "since", "2024-01-01"));
        second.put("level", "campaign");

        assertEquals(
                Fingerprint.of("insights", "act_1", first, "cred"),
                Fingerprint.of("insights", "act_1", second, "cred"));
    }

    @Test
    @DisplayName("Should keep list order significant")
    void shouldRespectListOrder() {
        assertNotEquals(
                Fingerprint.of("insights", "act_1", Map.of("fields", List.of("spend", "clicks")), "cred"),
                Fingerprint.of("insights", "act_1", Map.of("fields", List.of("clicks", "spend")), "cred"));
    }

    @Test
    @DisplayName("Should separate credentials, objects and endpoints")
    void shouldIncludeEveryComponent() {
        String base = Fingerprint.of("insights", "act_1", Map.of(), "cred");

        assertNotEquals(base, Fingerprint.of("insights", "act_1", Map.of(), "other"));
        assertNotEquals(base, Fingerprint.of("insights", "act_2", Map.of(), "cred"));
        assertNotEquals(base, Fingerprint.of("campaigns", "act_1", Map.of(), "cred"));
        assertNotEquals(base, Fingerprint.of("insights", "act_1", Map.of(), true, "cred"));
        assertEquals(base, Fingerprint.of("insights", "act_1", Map.of(), false, "cred"));
        assertEquals(64, base.length());
    }

    @Test
    @DisplayName("Should hash to lowercase hex SHA-256")
    void shouldHashWithSha256() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                Fingerprint.sha256(""));
    }
}
