package com.adsgateway.normalize;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Derived-metric arithmetic shared by rows and totals.
 * Every ratio is zero when its denominator is zero.
 */
public final class Metrics {

    private Metrics() {
    }

    /**
     * Clicks per impression, as a percentage
     */
    public static double ctr(long clicks, long impressions) {
        return impressions == 0 ? 0.0 : clicks * 100.0 / impressions;
    }

    /**
     * Cost per click in major units
     */
    public static double cpc(long spendMinor, long clicks, int fractionDigits) {
        return clicks == 0 ? 0.0 : toMajor(spendMinor, fractionDigits) / clicks;
    }

    /**
     * Cost per thousand impressions in major units
     */
    public static double cpm(long spendMinor, long impressions, int fractionDigits) {
        return impressions == 0 ? 0.0 : toMajor(spendMinor, fractionDigits) * 1000.0 / impressions;
    }

    /**
     * Return on ad spend: conversion value over spend
     */
    public static double roas(long conversionValueMinor, long spendMinor) {
        return spendMinor == 0 ? 0.0 : (double) conversionValueMinor / spendMinor;
    }

    /**
     * Rounding for display only; stored values keep full precision.
     */
    public static BigDecimal round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP);
    }

    static double toMajor(long minor, int fractionDigits) {
        return BigDecimal.valueOf(minor).movePointLeft(fractionDigits).doubleValue();
    }
}
