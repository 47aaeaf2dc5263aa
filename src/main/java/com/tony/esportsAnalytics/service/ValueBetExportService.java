package com.tony.esportsAnalytics.service;

import com.opencsv.CSVWriter;
import com.tony.esportsAnalytics.config.AnalyticsProperties;
import com.tony.esportsAnalytics.model.Match;
import com.tony.esportsAnalytics.model.MatchStatus;
import com.tony.esportsAnalytics.model.dto.ValueBetCandidate;
import com.tony.esportsAnalytics.repository.MatchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Export CSV des value bets de tous les matchs d'un statut, pour l'outil de reporting.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ValueBetExportService {

    static final String[] HEADER = {
            "match_id", "start_date", "team1", "team2", "side", "team", "provider",
            "odds", "implied_probability", "estimated_probability", "expected_value", "kelly_fraction"
    };

    private final MatchRepository matchRepository;
    private final AnalyticsService analyticsService;
    private final AnalyticsProperties properties;

    public String exportCsv() {
        return exportCsv(properties.getExportStatus(), properties.getDefaultMinExpectedValue());
    }

    @Transactional(readOnly = true)
    public String exportCsv(MatchStatus status, double minExpectedValue) {
        StringWriter out = new StringWriter();
        int rows = 0;

        try (CSVWriter csv = new CSVWriter(out)) {
            csv.writeNext(HEADER, false);
            for (Match match : matchRepository.findByStatus(status)) {
                for (ValueBetCandidate bet : analyticsService.evaluateValueBets(match.getId(), minExpectedValue)) {
                    csv.writeNext(new String[]{
                            match.getId().toString(),
                            match.getStartDate() != null ? match.getStartDate().toString() : "",
                            match.getTeam1() != null ? match.getTeam1().getName() : "",
                            match.getTeam2() != null ? match.getTeam2().getName() : "",
                            bet.getSide().name(),
                            bet.getTeamName(),
                            bet.getProvider(),
                            decimal(bet.getDecimalOdds()),
                            decimal(bet.getImpliedProbability()),
                            decimal(bet.getEstimatedProbability()),
                            decimal(bet.getExpectedValue()),
                            decimal(bet.getKellyFraction())
                    }, false);
                    rows++;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Échec de l'export CSV des value bets", e);
        }

        log.info("📄 Export value bets ({}, EV > {}) : {} lignes", status, minExpectedValue, rows);
        return out.toString();
    }

    private String decimal(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
