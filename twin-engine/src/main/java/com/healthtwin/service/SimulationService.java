package com.healthtwin.service;

import com.healthtwin.dto.request.SimulationRequest;
import com.healthtwin.dto.request.WeeklySimulationRequest;
import com.healthtwin.dto.response.SimulationResultDto;
import com.healthtwin.dto.response.WeekReportDto;
import com.healthtwin.dto.response.WeeklySimulationResultDto;
import com.healthtwin.exception.InvalidSimulationInputException;
import com.healthtwin.model.parameter.ParameterSnapshot;
import com.healthtwin.model.progression.WeekResult;
import com.healthtwin.model.progression.WeeklyRow;
import com.healthtwin.model.report.ScoredReport;
import com.healthtwin.service.narration.NarrationClient;
import com.healthtwin.service.narration.NarrationPromptBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Simulation Service
 *
 * Runs complete simulations on top of the engine:
 * - projection: project, report before and after, compare, recommend, narrate
 * - weekly: progress, report every week, compare baseline with the final week, recommend, narrate
 *
 * Narration is optional. A failing narration client never fails the simulation; its
 * message is replaced by a fallback text.
 */
@Slf4j
@Service
public class SimulationService {

    private final InterventionEffectService interventionEffectService;
    private final WeeklyProgressionService weeklyProgressionService;
    private final WeeklyRowParser weeklyRowParser;
    private final ReportBuilderService reportBuilderService;
    private final ComparisonService comparisonService;
    private final SimulationRecommendationService recommendationService;
    private final NarrationPromptBuilder promptBuilder;
    private final Optional<NarrationClient> narrationClient;
    private final boolean narrationEnabled;

    public SimulationService(
            InterventionEffectService interventionEffectService,
            WeeklyProgressionService weeklyProgressionService,
            WeeklyRowParser weeklyRowParser,
            ReportBuilderService reportBuilderService,
            ComparisonService comparisonService,
            SimulationRecommendationService recommendationService,
            NarrationPromptBuilder promptBuilder,
            Optional<NarrationClient> narrationClient,
            @Value("${twin.narration.enabled:true}") boolean narrationEnabled) {
        this.interventionEffectService = interventionEffectService;
        this.weeklyProgressionService = weeklyProgressionService;
        this.weeklyRowParser = weeklyRowParser;
        this.reportBuilderService = reportBuilderService;
        this.comparisonService = comparisonService;
        this.recommendationService = recommendationService;
        this.promptBuilder = promptBuilder;
        this.narrationClient = narrationClient;
        this.narrationEnabled = narrationEnabled;
    }

    public SimulationResultDto runSimulation(SimulationRequest request) {
        if (request == null) {
            throw new InvalidSimulationInputException("Simulation request is required");
        }
        ParameterSnapshot baseline = request.baseline();
        ParameterSnapshot projected = interventionEffectService.project(
            baseline, request.intervention(), request.durationWeeks());
        log.info("Running projection over {} weeks", request.durationWeeks());

        ScoredReport baselineReport = reportBuilderService.build(baseline);
        ScoredReport projectedReport = reportBuilderService.build(projected);
        List<String> improvements = comparisonService.compare(baseline, projected);
        List<String> recommendations = recommendationService.recommend(request.intervention());

        String narration = narrate("simulation recommendations", () -> promptBuilder.simulationPrompt(
            baseline, projected, request.intervention(), request.durationWeeks(), improvements));

        return new SimulationResultDto(projected, baselineReport, projectedReport,
            improvements, recommendations, narration, request.durationWeeks());
    }

    public WeeklySimulationResultDto runWeeklySimulation(WeeklySimulationRequest request) {
        if (request == null) {
            throw new InvalidSimulationInputException("Simulation request is required");
        }
        List<WeeklyRow> rows = request.weeklyRecords() != null
            ? weeklyRowParser.parse(request.weeklyRecords())
            : weeklyRowParser.parseCsv(request.weeklyCsv());

        ParameterSnapshot baseline = request.baseline();
        List<WeekResult> weeks = weeklyProgressionService.progress(baseline, rows, request.durationWeeks());
        log.info("Running weekly progression over {} weeks from {} rows", request.durationWeeks(), rows.size());

        List<WeekReportDto> progression = new ArrayList<>(weeks.size());
        for (WeekResult week : weeks) {
            progression.add(new WeekReportDto(week.week(), week.parameters(),
                reportBuilderService.build(week.parameters()), week.changesFromBaseline()));
        }

        ParameterSnapshot finalParameters = weeks.get(weeks.size() - 1).parameters();
        List<String> improvements = comparisonService.compare(baseline, finalParameters);
        List<String> recommendations = recommendationService.recommendForObservedData();

        String narration = narrate("progression analysis", () -> promptBuilder.progressionPrompt(
            baseline, weeks, request.durationWeeks()));

        return new WeeklySimulationResultDto(progression, reportBuilderService.build(baseline),
            progression.get(progression.size() - 1).labReport(), improvements, recommendations,
            narration, request.durationWeeks());
    }

    /**
     * Null when narration is disabled or no client is available.
     */
    String narrate(String subject, Supplier<String> prompt) {
        if (!narrationEnabled || narrationClient.isEmpty()) {
            log.debug("Narration skipped for {}", subject);
            return null;
        }
        try {
            return narrationClient.get().narrate(prompt.get());
        } catch (Exception e) {
            log.warn("Narration failed for {}", subject, e);
            return "Unable to generate AI " + subject + ": " + e.getMessage();
        }
    }
}
