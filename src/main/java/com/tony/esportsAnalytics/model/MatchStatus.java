package com.tony.esportsAnalytics.model;

import com.tony.esportsAnalytics.exception.ValidationException;

import java.util.Locale;

public enum MatchStatus {
    UPCOMING, CURRENT, FINISHED, CANCELED;

    /**
     * Traduit le statut brut d'un fournisseur ("upcoming", "live", "finished"...).
     * Un statut absent est considéré comme "à venir", un statut inconnu est rejeté.
     */
    public static MatchStatus fromProvider(String raw) {
        if (raw == null || raw.isBlank()) return UPCOMING;

        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "upcoming", "scheduled", "not_started" -> UPCOMING;
            case "current", "live", "running" -> CURRENT;
            case "finished", "ended", "completed" -> FINISHED;
            case "canceled", "cancelled" -> CANCELED;
            default -> throw new ValidationException("Statut de match inconnu : " + raw);
        };
    }
}
