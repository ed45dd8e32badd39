package com.healthtwin.model.report;

import com.healthtwin.model.enums.Flag;

/**
 * A reported value with its unit, reference range text and flag.
 */
public record AnnotatedValue(
    Object value,
    String unit,
    String referenceRange,
    Flag flag
) {}
