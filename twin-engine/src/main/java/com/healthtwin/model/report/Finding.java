package com.healthtwin.model.report;

import com.healthtwin.model.enums.FindingType;

/**
 * A statement produced by a scoring rule.
 */
public record Finding(FindingType type, String text) {

    public static Finding risk(String text) {
        return new Finding(FindingType.RISK_FACTOR, text);
    }

    public static Finding alert(String text) {
        return new Finding(FindingType.ALERT, text);
    }

    public static Finding recommendation(String text) {
        return new Finding(FindingType.RECOMMENDATION, text);
    }

    public static Finding strength(String text) {
        return new Finding(FindingType.STRENGTH, text);
    }
}
