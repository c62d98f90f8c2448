package com.adsgateway.normalize;

import com.adsgateway.core.EntityKind;
import com.adsgateway.core.ErrorKind;
import com.adsgateway.core.GatewayException;
import com.adsgateway.core.MalformedResponseException;
import com.adsgateway.remote.GraphParams;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Currency;
import java.util.List;

/**
 * Turns raw Graph API payloads into canonical entities.
 *
 * - String-encoded numbers are parsed; money becomes minor units
 * - Missing required fields fail the whole payload instead of defaulting to zero
 * - Derived metrics (CTR, CPC, CPM, ROAS) are computed here, zero on a zero denominator
 *
 * Pure function of its input: normalizing the same payload twice gives equal results.
 */
@Slf4j
public class ResponseNormalizer {

    /**
     * Purchase action types in order of preference. The remote service reports
     * overlapping variants of the same purchase, so only the first present one counts.
     */
    private static final List<String> PURCHASE_ACTIONS = List.of(
            "omni_purchase", "purchase", "offsite_conversion.fb_pixel_purchase");

    private static final DateTimeFormatter GRAPH_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");

    public List<NormalizedEntity> normalize(JsonNode raw, EntityKind kind) {
        if (raw == null || !raw.isObject()) {
            throw new MalformedResponseException("Expected a JSON object for " + kind);
        }

        List<NormalizedEntity> entities = new ArrayList<>();
        if (raw.has("data")) {
            JsonNode data = raw.get("data");
            if (!data.isArray()) {
                throw new MalformedResponseException("'data' is not an array for " + kind);
            }
            for (JsonNode element : data) {
                entities.add(normalizeOne(element, kind));
            }
        } else {
            entities.add(normalizeOne(raw, kind));
        }

        log.trace("Normalized {} {} entities", entities.size(), kind);
        return entities;
    }

    /**
     * Acknowledgement of a write: {@code {"id": ...}} for a create,
     * {@code {"success": true}} for an update of {@code targetId}.
     */
    public WriteResult normalizeWrite(JsonNode raw, String targetId) {
        if (raw == null || !raw.isObject()) {
            throw new MalformedResponseException("Expected a JSON object for a write result");
        }
        if (raw.hasNonNull("id")) {
            return WriteResult.builder()
                    .id(requiredText(raw, "id", "write result"))
                    .created(true)
                    .build();
        }
        JsonNode success = raw.get("success");
        if (success == null || !success.isBoolean()) {
            throw new MalformedResponseException("write result has neither 'id' nor a boolean 'success'");
        }
        if (!success.asBoolean()) {
            throw new GatewayException(ErrorKind.PERMANENT_FAILURE,
                    "Remote service reported the update of " + targetId + " as unsuccessful");
        }
        return WriteResult.builder()
                .id(targetId)
                .created(false)
                .build();
    }

    private NormalizedEntity normalizeOne(JsonNode node, EntityKind kind) {
        if (!node.isObject()) {
            throw new MalformedResponseException("Expected a JSON object element for " + kind);
        }
        switch (kind) {
            case ACCOUNT:
                return account(node);
            case CAMPAIGN:
                return campaign(node);
            case AD_SET:
                return adSet(node);
            case AD:
                return ad(node);
            case INSIGHT:
                return insight(node);
            default:
                throw new IllegalArgumentException("Unsupported entity kind: " + kind);
        }
    }

    private Account account(JsonNode node) {
        Long status = optionalLong(node, "account_status");
        return Account.builder()
                .id(GraphParams.normalizeAccountId(requiredText(node, "id", "account")))
                .name(requiredText(node, "name", "account"))
                .currency(requiredText(node, "currency", "account"))
                .status(status == null ? null : status.intValue())
                .amountSpentMinor(optionalLong(node, "amount_spent"))
                .balanceMinor(optionalLong(node, "balance"))
                .timezone(optionalText(node, "timezone_name"))
                .build();
    }

    private Campaign campaign(JsonNode node) {
        return Campaign.builder()
                .id(requiredText(node, "id", "campaign"))
                .name(requiredText(node, "name", "campaign"))
                .accountId(GraphParams.normalizeAccountId(requiredText(node, "account_id", "campaign")))
                .status(optionalText(node, "status"))
                .effectiveStatus(optionalText(node, "effective_status"))
                .objective(optionalText(node, "objective"))
                .dailyBudgetMinor(optionalLong(node, "daily_budget"))
                .lifetimeBudgetMinor(optionalLong(node, "lifetime_budget"))
                .createdTime(optionalTimestamp(node, "created_time"))
                .build();
    }

    private AdSet adSet(JsonNode node) {
        String accountId = optionalText(node, "account_id");
        return AdSet.builder()
                .id(requiredText(node, "id", "ad set"))
                .name(requiredText(node, "name", "ad set"))
                .campaignId(requiredText(node, "campaign_id", "ad set"))
                .accountId(accountId == null ? null : GraphParams.normalizeAccountId(accountId))
                .status(optionalText(node, "status"))
                .effectiveStatus(optionalText(node, "effective_status"))
                .optimizationGoal(optionalText(node, "optimization_goal"))
                .dailyBudgetMinor(optionalLong(node, "daily_budget"))
                .lifetimeBudgetMinor(optionalLong(node, "lifetime_budget"))
                .build();
    }

    private Ad ad(JsonNode node) {
        return Ad.builder()
                .id(requiredText(node, "id", "ad"))
                .name(requiredText(node, "name", "ad"))
                .adSetId(requiredText(node, "adset_id", "ad"))
                .campaignId(optionalText(node, "campaign_id"))
                .status(optionalText(node, "status"))
                .effectiveStatus(optionalText(node, "effective_status"))
                .build();
    }

    private InsightRow insight(JsonNode node) {
        String spendText = requiredText(node, "spend", "insight");
        // Spend is a major-unit decimal; its minor-unit scale depends on the currency
        String currency = requiredText(node, "account_currency", "insight");
        int digits = fractionDigits(currency);

        long spend = majorToMinor(spendText, digits, "spend");
        long impressions = requiredLong(node, "impressions", "insight");
        long clicks = requiredLong(node, "clicks", "insight");
        long conversions = firstPurchase(node.path("actions"), false, digits);
        long conversionValue = firstPurchase(node.path("action_values"), true, digits);

        InsightRow.InsightRowBuilder row = InsightRow.builder()
                .dateStart(requiredDate(node, "date_start"))
                .dateStop(requiredDate(node, "date_stop"))
                .currency(currency)
                .currencyDigits(digits)
                .spendMinor(spend)
                .impressions(impressions)
                .clicks(clicks)
                .reach(optionalLong(node, "reach"))
                .conversions(conversions)
                .conversionValueMinor(conversionValue)
                .ctr(Metrics.ctr(clicks, impressions))
                .cpc(Metrics.cpc(spend, clicks, digits))
                .cpm(Metrics.cpm(spend, impressions, digits))
                .roas(Metrics.roas(conversionValue, spend));

        // Most specific id present wins: campaign-level rows also carry account_id
        if (node.hasNonNull("ad_id")) {
            row.subjectId(node.get("ad_id").asText()).level(EntityKind.AD);
        } else if (node.hasNonNull("adset_id")) {
            row.subjectId(node.get("adset_id").asText()).level(EntityKind.AD_SET);
        } else if (node.hasNonNull("campaign_id")) {
            row.subjectId(node.get("campaign_id").asText()).level(EntityKind.CAMPAIGN);
        } else if (node.hasNonNull("account_id")) {
            row.subjectId(GraphParams.normalizeAccountId(node.get("account_id").asText()))
                    .level(EntityKind.ACCOUNT);
        } else {
            throw new MalformedResponseException("insight row has no subject id (ad_id, adset_id, campaign_id or account_id)");
        }
        return row.build();
    }

    /**
     * The remote service omits action arrays when nothing happened, so absence is a real zero.
     */
    private long firstPurchase(JsonNode actions, boolean monetary, int digits) {
        if (actions.isMissingNode() || actions.isNull()) {
            return 0;
        }
        if (!actions.isArray()) {
            throw new MalformedResponseException("actions field is not an array");
        }
        for (String type : PURCHASE_ACTIONS) {
            for (JsonNode action : actions) {
                if (type.equals(action.path("action_type").asText())) {
                    String value = requiredText(action, "value", "action");
                    return monetary ? majorToMinor(value, digits, type) : wholeCount(value, type);
                }
            }
        }
        return 0;
    }

    private static int fractionDigits(String currency) {
        try {
            int digits = Currency.getInstance(currency).getDefaultFractionDigits();
            if (digits < 0) {
                throw new MalformedResponseException("Currency " + currency + " has no minor unit");
            }
            return digits;
        } catch (IllegalArgumentException e) {
            throw new MalformedResponseException("Unknown currency code: " + currency, e);
        }
    }

    private static long majorToMinor(String value, int digits, String field) {
        try {
            return parseDecimal(value, field).movePointRight(digits)
                    .setScale(0, RoundingMode.HALF_UP)
                    .longValueExact();
        } catch (ArithmeticException e) {
            throw new MalformedResponseException("Amount out of range for '" + field + "': " + value, e);
        }
    }

    private static long wholeCount(String value, String field) {
        try {
            return parseDecimal(value, field).setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (ArithmeticException e) {
            throw new MalformedResponseException("Count out of range for '" + field + "': " + value, e);
        }
    }

    private static BigDecimal parseDecimal(String value, String field) {
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedResponseException("Field '" + field + "' is not a number: " + value, e);
        }
    }

    private static String requiredText(JsonNode node, String field, String entity) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isEmpty()) {
            throw new MalformedResponseException(entity + " missing required field '" + field + "'");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static long requiredLong(JsonNode node, String field, String entity) {
        return parseLong(requiredText(node, field, entity), field);
    }

    private static Long optionalLong(JsonNode node, String field) {
        String text = optionalText(node, field);
        return text == null ? null : parseLong(text, field);
    }

    private static long parseLong(String text, String field) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new MalformedResponseException("Field '" + field + "' is not an integer: " + text, e);
        }
    }

    private static LocalDate requiredDate(JsonNode node, String field) {
        String text = requiredText(node, field, "insight");
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new MalformedResponseException("Field '" + field + "' is not a date: " + text, e);
        }
    }

    private static OffsetDateTime optionalTimestamp(JsonNode node, String field) {
        String text = optionalText(node, field);
        if (text == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text, GRAPH_TIMESTAMP);
        } catch (DateTimeParseException e) {
            throw new MalformedResponseException("Field '" + field + "' is not a timestamp: " + text, e);
        }
    }
}
