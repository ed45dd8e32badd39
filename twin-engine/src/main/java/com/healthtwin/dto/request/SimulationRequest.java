package com.healthtwin.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.healthtwin.model.intervention.Intervention;
import com.healthtwin.model.parameter.ParameterSnapshot;

/**
 * Request DTO for projecting a baseline under an intervention.
 */
public record SimulationRequest(
    @JsonProperty("baseline_parameters")
    ParameterSnapshot baseline,
    Intervention intervention,
    @JsonProperty("duration_weeks")
    int durationWeeks
) {}
