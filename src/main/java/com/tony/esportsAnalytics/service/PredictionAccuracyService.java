package com.tony.esportsAnalytics.service;

import com.tony.esportsAnalytics.config.AnalyticsProperties;
import com.tony.esportsAnalytics.model.MatchStatus;
import com.tony.esportsAnalytics.model.dto.ComparisonResult;
import com.tony.esportsAnalytics.model.dto.DashboardStats;
import com.tony.esportsAnalytics.repository.MatchRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.util.Precision;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class PredictionAccuracyService {

    private final MatchRepository matchRepository;
    private final AnalyticsService analyticsService;
    private final AnalyticsProperties properties;

    @Transactional(readOnly = true)
    public DashboardStats summary() {
        long total = matchRepository.count();
        long finished = matchRepository.countByStatus(MatchStatus.FINISHED);

        // Seules les comparaisons applicables comptent (vainqueur prédit connu)
        List<ComparisonResult> evaluated = matchRepository.findFinishedWithPredictions().stream()
                .map(m -> analyticsService.evaluate(m, m.getPredictions()))
                .filter(ComparisonResult::isApplicable)
                .toList();

        long correct = evaluated.stream().filter(r -> Boolean.TRUE.equals(r.getCorrect())).count();

        List<ComparisonResult> confident = evaluated.stream()
                .filter(r -> r.getConfidence() != null && r.getConfidence() >= properties.getConfidenceThreshold())
                .toList();
        long confidentCorrect = confident.stream().filter(r -> Boolean.TRUE.equals(r.getCorrect())).count();

        double[] confidences = evaluated.stream()
                .filter(r -> r.getConfidence() != null)
                .mapToDouble(ComparisonResult::getConfidence)
                .toArray();
        Double averageConfidence = confidences.length == 0 ? null : Precision.round(new Mean().evaluate(confidences), 3);

        return new DashboardStats(total, finished, evaluated.size(), correct, percent(correct, evaluated.size()),
                confident.size(), percent(confidentCorrect, confident.size()), averageConfidence);
    }

    private double percent(long part, long whole) {
        return whole == 0 ? 0.0 : Precision.round((double) part / whole * 100, 1);
    }
}
