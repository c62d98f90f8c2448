package com.adsgateway.normalize;

import com.adsgateway.core.EntityKind;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Performance of one subject over one date range.
 */
@Value
@Builder
public class InsightRow implements NormalizedEntity {

    /**
     * Account, campaign, ad set or ad the row describes
     */
    String subjectId;
    EntityKind level;

    LocalDate dateStart;
    LocalDate dateStop;

    String currency;
    int currencyDigits;

    long spendMinor;
    long impressions;
    long clicks;

    /**
     * Unique people reached; null when not requested
     */
    Long reach;

    long conversions;
    long conversionValueMinor;

    double ctr;
    double cpc;
    double cpm;
    double roas;

    @Override
    public String getId() {
        return subjectId + ":" + dateStart + ":" + dateStop;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.INSIGHT;
    }
}
