package com.tony.esportsAnalytics.config;

import com.tony.esportsAnalytics.model.MatchStatus;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "analytics")
@Data
public class AnalyticsProperties {
    // --- Value bets ---
    // EV minimale quand l'appelant n'en précise pas (strictement supérieure)
    private double defaultMinExpectedValue = 0.0;

    // --- Dashboard ---
    // Au-dessus de ce facteur de proximité, une prédiction compte comme "confiante"
    private double confidenceThreshold = 0.5;

    // --- Export CSV ---
    private MatchStatus exportStatus = MatchStatus.UPCOMING;
}
