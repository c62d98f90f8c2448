package com.adsgateway.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Encoding rules for Graph API query parameters and ids.
 */
public final class GraphParams {

    /**
     * List parameters the API expects as comma-separated values; other lists and maps go as JSON
     */
    private static final Set<String> COMMA_JOINED = Set.of(
            "fields", "breakdowns", "action_breakdowns", "action_attribution_windows");

    private static final Set<String> DATE_PRESETS = Set.of(
            "today", "yesterday", "last_7d", "last_14d", "last_30d", "last_90d",
            "this_month", "last_month", "maximum", "lifetime");

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern DAYS_AGO = Pattern.compile("^(\\d+) days ago$");

    private GraphParams() {
    }

    public static Map<String, String> encode(Map<String, ?> parameters, ObjectMapper objectMapper) {
        Map<String, String> encoded = new LinkedHashMap<>();
        parameters.forEach((name, value) -> {
            if (value == null) {
                return;
            }
            if (value instanceof Collection && COMMA_JOINED.contains(name)) {
                encoded.put(name, ((Collection<?>) value).stream()
                        .map(String::valueOf)
                        .collect(Collectors.joining(",")));
            } else if (value instanceof Collection || value instanceof Map) {
                encoded.put(name, toJson(value, objectMapper));
            } else {
                encoded.put(name, String.valueOf(value));
            }
        });
        return encoded;
    }

    /**
     * Ad account ids go over the wire as {@code act_<digits>}; bare digits get the prefix.
     */
    public static String normalizeAccountId(String accountId) {
        String trimmed = accountId.trim();
        if (trimmed.startsWith("act_")) {
            return trimmed;
        }
        if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
            return "act_" + trimmed;
        }
        return trimmed;
    }

    /**
     * Time parameters for insights: a preset wins; otherwise {@code since} and {@code until}
     * become a {@code time_range}. Accepted forms are ISO dates, {@code "N days ago"} for
     * {@code since} and {@code "today"} (or nothing) for {@code until}.
     *
     * @throws IllegalArgumentException when neither a known preset nor a valid range is given
     */
    public static Map<String, Object> timeRange(String preset, String since, String until, LocalDate today) {
        if (preset != null) {
            if (!DATE_PRESETS.contains(preset)) {
                throw new IllegalArgumentException("Unknown date preset: " + preset);
            }
            return Map.of("date_preset", preset);
        }

        String sinceDate = null;
        if (since != null) {
            var daysAgo = DAYS_AGO.matcher(since.trim());
            if (daysAgo.matches()) {
                sinceDate = today.minusDays(Long.parseLong(daysAgo.group(1))).toString();
            } else if (ISO_DATE.matcher(since).matches()) {
                sinceDate = since;
            }
        }

        String untilDate = null;
        if (until == null || "today".equals(until)) {
            untilDate = today.toString();
        } else if (ISO_DATE.matcher(until).matches()) {
            untilDate = until;
        }

        if (sinceDate == null || untilDate == null) {
            throw new IllegalArgumentException(
                    "time_range requires a date preset or valid 'since' and 'until' dates (YYYY-MM-DD)");
        }
        if (LocalDate.parse(sinceDate).isAfter(LocalDate.parse(untilDate))) {
            throw new IllegalArgumentException("'since' must not be after 'until'");
        }

        Map<String, Object> range = new LinkedHashMap<>();
        range.put("since", sinceDate);
        range.put("until", untilDate);
        return Map.of("time_range", range);
    }

    private static String toJson(Object value, ObjectMapper objectMapper) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Parameter is not serializable: " + value, e);
        }
    }
}
