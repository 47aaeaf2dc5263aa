package com.tony.esportsAnalytics.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class DashboardStats {
    private long totalMatches;
    private long finishedMatches;
    private long evaluatedPredictions;  // matchs terminés avec une prédiction exploitable
    private long correctPredictions;
    private double globalAccuracy;      // % de vainqueurs bien prédits
    private long confidentPredictions;
    private double confidenceAccuracy;  // % de réussite au-dessus du seuil de confiance
    private Double averageConfidence;
}
