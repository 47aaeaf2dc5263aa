package com.tony.esportsAnalytics.model.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Bilan d'un lot : chaque match est une unité indépendante, un échec n'annule pas les autres.
 */
@Data
public class IngestionReport {
    private String sourceType;
    private int received;
    private List<UUID> ingestedMatchIds = new ArrayList<>();
    private List<Failure> failures = new ArrayList<>();

    public IngestionReport(String sourceType) {
        this.sourceType = sourceType;
    }

    public void recordSuccess(UUID matchId) {
        ingestedMatchIds.add(matchId);
    }

    public void recordFailure(int index, String providerMatchId, String error) {
        failures.add(new Failure(index, providerMatchId, error));
    }

    public record Failure(int index, String providerMatchId, String error) {}
}
