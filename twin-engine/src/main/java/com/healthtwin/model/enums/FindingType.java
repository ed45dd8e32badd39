package com.healthtwin.model.enums;

/**
 * Kinds of statement a scoring rule can emit.
 * ALERT needs clinician attention, RECOMMENDATION is self-manageable.
 */
public enum FindingType {
    RISK_FACTOR,
    ALERT,
    RECOMMENDATION,
    STRENGTH
}
