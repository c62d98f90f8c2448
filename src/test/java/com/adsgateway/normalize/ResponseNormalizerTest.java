package com.adsgateway.normalize;

import com.adsgateway.core.EntityKind;
import com.adsgateway.core.ErrorKind;
import com.adsgateway.core.GatewayException;
import com.adsgateway.core.MalformedResponseException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResponseNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResponseNormalizer normalizer = new ResponseNormalizer();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text.replace('\'', '"'));
    }

    @Test
    @DisplayName("Should convert string metrics and derive ratios for insight rows")
    void shouldNormalizeInsightRow() throws Exception {
        JsonNode raw = json("{'data':[{'campaign_id':'c1','account_id':'123','account_currency':'USD','date_start':'2024-01-01',"
                + "'date_stop':'2024-01-31','spend':'125.50','impressions':'10000','clicks':'250',"
                + "'actions':[{'action_type':'link_click','value':'250'},{'action_type':'purchase','value':'10'},"
                + "{'action_type':'omni_purchase','value':'12'}],"
                + "'action_values':[{'action_type':'omni_purchase','value':'502.00'}]}]}");

        List<NormalizedEntity> entities = normalizer.normalize(raw, EntityKind.INSIGHT);

        assertEquals(1, entities.size());
        InsightRow row = (InsightRow) entities.get(0);
        assertEquals("c1", row.getSubjectId());
        assertEquals(EntityKind.CAMPAIGN, row.getLevel());
        assertEquals(LocalDate.of(2024, 1, 1), row.getDateStart());
        assertEquals(12550, row.getSpendMinor());
        assertEquals(10000, row.getImpressions());
        assertEquals(250, row.getClicks());
        assertEquals(12, row.getConversions());
        assertEquals(50200, row.getConversionValueMinor());
        assertEquals(2.5, row.getCtr(), 1e-9);
        assertEquals(0.502, row.getCpc(), 1e-9);
        assertEquals(12.55, row.getCpm(), 1e-9);
        assertEquals(4.0, row.getRoas(), 1e-9);
    }

    @Test
    @DisplayName("Should report zero ratios instead of dividing by zero")
    void shouldHandleZeroDenominators() throws Exception {
        JsonNode raw = json("{'data':[{'ad_id':'a1','account_currency':'EUR','date_start':'2024-01-01','date_stop':'2024-01-01',"
                + "'spend':'0','impressions':'0','clicks':'0'}]}");

        InsightRow row = (InsightRow) normalizer.normalize(raw, EntityKind.INSIGHT).get(0);

        assertEquals(EntityKind.AD, row.getLevel());
        assertEquals(0.0, row.getRoas());
        assertEquals(0.0, row.getCtr());
        assertEquals(0.0, row.getCpc());
        assertEquals(0.0, row.getCpm());
        assertEquals(0, row.getConversions());
    }

    @Test
    @DisplayName("Should use the currency's fraction digits for spend")
    void shouldRespectCurrencyDigits() throws Exception {
        JsonNode raw = json("{'account_id':'1','account_currency':'JPY','date_start':'2024-01-01',"
                + "'date_stop':'2024-01-01','spend':'1500','impressions':'10','clicks':'1'}");

        InsightRow row = (InsightRow) normalizer.normalize(raw, EntityKind.INSIGHT).get(0);

        assertEquals("act_1", row.getSubjectId());
        assertEquals(0, row.getCurrencyDigits());
        assertEquals(1500, row.getSpendMinor());
    }

    @Test
    @DisplayName("Should refuse to guess the currency scale of spend")
    void shouldRejectSpendWithoutCurrency() throws Exception {
        JsonNode raw = json("{'account_id':'1','date_start':'2024-01-01','date_stop':'2024-01-01',"
                + "'spend':'1000','impressions':'10','clicks':'1'}");

        MalformedResponseException e = assertThrows(MalformedResponseException.class,
                () -> normalizer.normalize(raw, EntityKind.INSIGHT));
        assertTrue(e.getMessage().contains("account_currency"));
    }

    @Test
    @DisplayName("Should report oversized action counts as malformed")
    void shouldRejectOversizedActionCount() throws Exception {
        JsonNode raw = json("{'campaign_id':'c1','account_currency':'USD','date_start':'2024-01-01',"
                + "'date_stop':'2024-01-01','spend':'1','impressions':'10','clicks':'1',"
                + "'actions':[{'action_type':'purchase','value':'99999999999999999999999'}]}");

        assertThrows(MalformedResponseException.class, () -> normalizer.normalize(raw, EntityKind.INSIGHT));
    }

    @Test
    @DisplayName("Should fail the payload when a required metric is missing")
    void shouldRejectMissingRequiredField() throws Exception {
        JsonNode raw = json("{'data':[{'campaign_id':'c1','date_start':'2024-01-01','date_stop':'2024-01-31',"
                + "'impressions':'10','clicks':'1'}]}");

        MalformedResponseException e = assertThrows(MalformedResponseException.class,
                () -> normalizer.normalize(raw, EntityKind.INSIGHT));
        assertTrue(e.getMessage().contains("spend"));
    }

    @Test
    @DisplayName("Should fail on non-numeric metrics and rows without a subject")
    void shouldRejectBadValues() throws Exception {
        JsonNode badNumber = json("{'campaign_id':'c1','account_currency':'USD','date_start':'2024-01-01','date_stop':'2024-01-31',"
                + "'spend':'abc','impressions':'10','clicks':'1'}");
        JsonNode noSubject = json("{'account_currency':'USD','date_start':'2024-01-01','date_stop':'2024-01-31',"
                + "'spend':'1','impressions':'10','clicks':'1'}");

        assertThrows(MalformedResponseException.class, () -> normalizer.normalize(badNumber, EntityKind.INSIGHT));
        assertThrows(MalformedResponseException.class, () -> normalizer.normalize(noSubject, EntityKind.INSIGHT));
        assertThrows(MalformedResponseException.class,
                () -> normalizer.normalize(json("{'data':{}}"), EntityKind.CAMPAIGN));
        assertThrows(MalformedResponseException.class,
                () -> normalizer.normalize(json("[1,2]"), EntityKind.CAMPAIGN));
    }

    @Test
    @DisplayName("Should return an empty list for empty data")
    void shouldHandleEmptyData() throws Exception {
        assertTrue(normalizer.normalize(json("{'data':[]}"), EntityKind.INSIGHT).isEmpty());
    }

    @Test
    @DisplayName("Should normalize campaigns with budgets in minor units")
    void shouldNormalizeCampaign() throws Exception {
        JsonNode raw = json("{'data':[{'id':'c1','name':'Spring sale','account_id':'42','status':'ACTIVE',"
                + "'objective':'OUTCOME_SALES','daily_budget':'5000','created_time':'2024-01-05T10:15:30+0000'}]}");

        Campaign campaign = (Campaign) normalizer.normalize(raw, EntityKind.CAMPAIGN).get(0);

        assertEquals("c1", campaign.getId());
        assertEquals("act_42", campaign.getAccountId());
        assertEquals(5000L, campaign.getDailyBudgetMinor());
        assertNull(campaign.getLifetimeBudgetMinor());
        assertEquals(OffsetDateTime.of(2024, 1, 5, 10, 15, 30, 0, ZoneOffset.UTC), campaign.getCreatedTime());
        assertEquals(EntityKind.CAMPAIGN, campaign.getKind());
    }

    @Test
    @DisplayName("Should normalize a single account object")
    void shouldNormalizeAccount() throws Exception {
        JsonNode raw = json("{'id':'act_7','name':'Shop','currency':'EUR','account_status':1,"
                + "'amount_spent':'123456','timezone_name':'Europe/Berlin'}");

        Account account = (Account) normalizer.normalize(raw, EntityKind.ACCOUNT).get(0);

        assertEquals("act_7", account.getId());
        assertEquals(1, account.getStatus());
        assertEquals(123456L, account.getAmountSpentMinor());
        assertNull(account.getBalanceMinor());
    }

    @Test
    @DisplayName("Should acknowledge creates with the new id and updates with the target id")
    void shouldNormalizeWriteResults() throws Exception {
        WriteResult created = normalizer.normalizeWrite(json("{'id':'120200001'}"), "act_1");
        WriteResult updated = normalizer.normalizeWrite(json("{'success':true}"), "120200001");

        assertEquals("120200001", created.getId());
        assertTrue(created.isCreated());
        assertEquals("120200001", updated.getId());
        assertFalse(updated.isCreated());
        assertEquals(EntityKind.WRITE_RESULT, updated.getKind());
    }

    @Test
    @DisplayName("Should fail writes the remote service did not confirm")
    void shouldRejectUnconfirmedWrites() throws Exception {
        GatewayException refused = assertThrows(GatewayException.class,
                () -> normalizer.normalizeWrite(json("{'success':false}"), "c1"));
        assertEquals(ErrorKind.PERMANENT_FAILURE, refused.getKind());

        assertThrows(MalformedResponseException.class,
                () -> normalizer.normalizeWrite(json("{'result':'ok'}"), "c1"));
    }

    @Test
    @DisplayName("Should produce equal results for the same payload")
    void shouldBeIdempotent() throws Exception {
        JsonNode raw = json("{'data':[{'id':'ad1','name':'Ad','adset_id':'s1','status':'PAUSED'},"
                + "{'id':'ad2','name':'Ad 2','adset_id':'s1'}]}");

        assertEquals(normalizer.normalize(raw, EntityKind.AD), normalizer.normalize(raw, EntityKind.AD));
        assertEquals(normalizer.normalize(raw, EntityKind.AD), normalizer.normalize(raw.deepCopy(), EntityKind.AD));
    }
}
