package com.tony.esportsAnalytics.model.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * Cotes d'un bookmaker telles que reçues. team1/team2 suivent l'ordre du bloc de cotes,
 * qui n'est pas forcément celui du match : voir {@link #swapSides()}.
 */
@Value
@Builder(toBuilder = true)
public class OddsData {
    String provider;
    Double team1Odds;
    Double team2Odds;
    // Identifiants d'équipe côté fournisseur, quand le bloc les donne
    Long team1ProviderTeamId;
    Long team2ProviderTeamId;
    JsonNode payload;

    public OddsData swapSides() {
        return toBuilder()
                .team1Odds(team2Odds).team2Odds(team1Odds)
                .team1ProviderTeamId(team2ProviderTeamId).team2ProviderTeamId(team1ProviderTeamId)
                .build();
    }
}
