package com.tony.esportsAnalytics.controller;

import com.tony.esportsAnalytics.model.MatchStatus;
import com.tony.esportsAnalytics.model.dto.DashboardStats;
import com.tony.esportsAnalytics.service.PredictionAccuracyService;
import com.tony.esportsAnalytics.service.ValueBetExportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {
    private final PredictionAccuracyService predictionAccuracyService;
    private final ValueBetExportService valueBetExportService;

    @GetMapping("/dashboard")
    public ResponseEntity<DashboardStats> getDashboardStats() {
        return ResponseEntity.ok(predictionAccuracyService.summary());
    }

    @GetMapping(value = "/value-bets/export", produces = "text/csv")
    public ResponseEntity<String> exportValueBets(@RequestParam(required = false) MatchStatus status,
                                                  @RequestParam(required = false) Double minExpectedValue) {
        String csv = status == null && minExpectedValue == null
                ? valueBetExportService.exportCsv()
                : valueBetExportService.exportCsv(
                        status != null ? status : MatchStatus.UPCOMING,
                        minExpectedValue != null ? minExpectedValue : 0.0);

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"value-bets.csv\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(csv);
    }
}
