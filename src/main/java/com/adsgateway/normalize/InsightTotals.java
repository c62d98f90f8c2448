package com.adsgateway.normalize;

import lombok.Value;

import java.util.List;

/**
 * Account-level roll-up of insight rows for the analysis layer.
 * Ratios are recomputed from the summed counts, not averaged across rows.
 */
@Value
public class InsightTotals {

    int rows;
    long spendMinor;
    long impressions;
    long clicks;
    long conversions;
    long conversionValueMinor;
    int currencyDigits;

    public static InsightTotals of(List<InsightRow> rows) {
        long spend = 0;
        long impressions = 0;
        long clicks = 0;
        long conversions = 0;
        long conversionValue = 0;
        Integer digits = null;

        for (InsightRow row : rows) {
            if (digits != null && digits != row.getCurrencyDigits()) {
                throw new IllegalArgumentException("Cannot total insight rows in different currencies");
            }
            digits = row.getCurrencyDigits();
            spend += row.getSpendMinor();
            impressions += row.getImpressions();
            clicks += row.getClicks();
            conversions += row.getConversions();
            conversionValue += row.getConversionValueMinor();
        }

        return new InsightTotals(rows.size(), spend, impressions, clicks, conversions, conversionValue,
                digits == null ? 2 : digits);
    }

    public double getCtr() {
        return Metrics.ctr(clicks, impressions);
    }

    public double getCpc() {
        return Metrics.cpc(spendMinor, clicks, currencyDigits);
    }

    public double getCpm() {
        return Metrics.cpm(spendMinor, impressions, currencyDigits);
    }

    public double getRoas() {
        return Metrics.roas(conversionValueMinor, spendMinor);
    }
}
