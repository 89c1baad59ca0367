package com.snuffles.pricewatch.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Number normalization shared by the adapters.
 */
public final class Quotes {

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
    private static final int CALCULATION_SCALE = 8;

    private Quotes() {
    }

    public static BigDecimal scale2(BigDecimal value) {
        return value == null ? null : value.setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Fund net asset values are published with four decimals.
     */
    public static BigDecimal scale4(BigDecimal value) {
        return value == null ? null : value.setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Converts an integer amount in cents to currency units.
     */
    public static BigDecimal fromCents(BigDecimal cents) {
        return cents == null ? null : cents.movePointLeft(2);
    }

    /**
     * {@code change / previousClose * 100}, or zero when there is no previous close.
     */
    public static BigDecimal percentOf(BigDecimal change, BigDecimal previousClose) {
        if (change == null || previousClose == null || previousClose.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return change.multiply(ONE_HUNDRED).divide(previousClose, CALCULATION_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal ratioToPercent(BigDecimal ratio) {
        return ratio == null ? null : ratio.multiply(ONE_HUNDRED);
    }

    public static BigDecimal parseDecimal(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(trimmed);
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    public static BigDecimal parseDecimalOr(String text, BigDecimal fallback) {
        BigDecimal parsed = parseDecimal(text);
        return parsed != null ? parsed : fallback;
    }

    public static BigDecimal asBigDecimal(JsonNode node, String field) {
        JsonNode n = node.get(field);
        if (n == null || n.isNull()) {
            return null;
        }
        return parseDecimal(n.asText());
    }

    public static String textOrNull(JsonNode node, String field) {
        JsonNode n = node.get(field);
        return (n == null || n.isNull()) ? null : n.asText();
    }

    public static BigDecimal firstNonNull(BigDecimal primary, BigDecimal fallback) {
        return primary != null ? primary : fallback;
    }
}
