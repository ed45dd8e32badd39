package com.healthtwin.service.narration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.healthtwin.model.intervention.Intervention;
import com.healthtwin.model.parameter.ParameterSnapshot;
import com.healthtwin.model.progression.WeekResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders the prompts sent to the narration client. Structured inputs are embedded as
 * pretty-printed JSON.
 */
@Component
public class NarrationPromptBuilder {

    private final ObjectWriter writer;

    public NarrationPromptBuilder(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    public String simulationPrompt(ParameterSnapshot baseline, ParameterSnapshot projected,
                                   Intervention intervention, int durationWeeks, List<String> improvements) {
        return """
            Analyze the following simulation results and provide comprehensive recommendations:

            Simulation Duration: %d weeks
            Intervention: %s

            Baseline Health: %s
            Projected Health: %s
            Improvements: %s

            Please provide:
            1. **Simulation Analysis**: Assessment of the intervention's effectiveness
            2. **Risk Assessment**: Any potential risks or side effects to monitor
            3. **Optimization Suggestions**: How to improve the intervention
            4. **Monitoring Plan**: What parameters to track and how often
            5. **Long-term Considerations**: Sustainability and maintenance strategies
            6. **Healthcare Provider Discussion Points**: What to discuss with medical professionals

            Focus on evidence-based insights and actionable next steps.
            """.formatted(durationWeeks, json(intervention), json(baseline), json(projected), joined(improvements));
    }

    public String progressionPrompt(ParameterSnapshot baseline, List<WeekResult> weeks, int durationWeeks) {
        ParameterSnapshot last = weeks.isEmpty() ? baseline : weeks.get(weeks.size() - 1).parameters();
        return """
            Analyze the following health progression over %d weeks based on weekly data:

            Baseline Health: %s
            Final Health: %s
            Weekly Progression: %s

            Please provide:
            1. **Progression Analysis**: How health parameters changed over time
            2. **Trend Identification**: Positive and negative trends
            3. **Effectiveness Assessment**: How well the intervention worked
            4. **Risk Assessment**: Any concerning patterns or values
            5. **Optimization Suggestions**: How to improve the intervention
            6. **Maintenance Recommendations**: How to sustain improvements

            Focus on evidence-based insights and actionable recommendations.
            """.formatted(durationWeeks, json(baseline), json(last), json(weeks));
    }

    String json(Object value) {
        try {
            return writer.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render prompt data", e);
        }
    }

    private static String joined(List<String> lines) {
        return lines == null || lines.isEmpty() ? "None" : String.join(", ", lines);
    }
}
