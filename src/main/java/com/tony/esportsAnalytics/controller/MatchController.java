package com.tony.esportsAnalytics.controller;

import com.tony.esportsAnalytics.model.MatchStatus;
import com.tony.esportsAnalytics.model.dto.ComparisonResult;
import com.tony.esportsAnalytics.model.dto.MatchView;
import com.tony.esportsAnalytics.model.dto.ValueBetCandidate;
import com.tony.esportsAnalytics.service.AnalyticsService;
import com.tony.esportsAnalytics.service.MatchQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/matches")
@RequiredArgsConstructor
public class MatchController {
    private final MatchQueryService matchQueryService;
    private final AnalyticsService analyticsService;

    @GetMapping
    public ResponseEntity<List<MatchView>> getMatches(
            @RequestParam(required = false) MatchStatus status,
            @RequestParam(required = false) String sourceType,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "false") boolean includeDetails) {
        return ResponseEntity.ok(matchQueryService.findMatches(status, sourceType, from, to, limit, includeDetails));
    }

    @GetMapping("/{id}")
    public ResponseEntity<MatchView> getMatch(@PathVariable UUID id,
                                              @RequestParam(defaultValue = "true") boolean includeDetails) {
        return ResponseEntity.ok(matchQueryService.getMatch(id, includeDetails));
    }

    // Prédiction vs résultat réel
    @GetMapping("/{id}/comparison")
    public ResponseEntity<ComparisonResult> getComparison(@PathVariable UUID id) {
        return ResponseEntity.ok(analyticsService.compareOutcome(id));
    }

    @GetMapping("/{id}/value-bets")
    public ResponseEntity<List<ValueBetCandidate>> getValueBets(@PathVariable UUID id,
                                                                @RequestParam(required = false) Double minExpectedValue) {
        List<ValueBetCandidate> bets = minExpectedValue != null
                ? analyticsService.evaluateValueBets(id, minExpectedValue)
                : analyticsService.evaluateValueBets(id);
        return ResponseEntity.ok(bets);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteMatch(@PathVariable UUID id) {
        matchQueryService.deleteMatch(id);
        return ResponseEntity.noContent().build();
    }
}
