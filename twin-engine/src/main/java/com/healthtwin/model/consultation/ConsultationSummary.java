package com.healthtwin.model.consultation;

import com.healthtwin.model.enums.ConsultationType;

import java.util.List;

/**
 * Quick read of a snapshot ahead of a consultation.
 */
public record ConsultationSummary(
    ConsultationType consultationFocus,
    List<String> riskFactors,
    List<String> strengths,
    List<String> immediateActions
) {}
