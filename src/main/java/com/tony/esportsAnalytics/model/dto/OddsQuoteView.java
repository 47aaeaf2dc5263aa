package com.tony.esportsAnalytics.model.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.esportsAnalytics.model.OddsQuote;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.UUID;

@Value
@Builder
public class OddsQuoteView {
    UUID id;
    String sourceType;
    String provider;
    Double team1Odds;
    Double team2Odds;
    Double team1ImpliedProb;
    Double team2ImpliedProb;
    LocalDateTime fetchedAt;
    JsonNode payload;

    public static OddsQuoteView from(OddsQuote quote) {
        return OddsQuoteView.builder()
                .id(quote.getId())
                .sourceType(quote.getSourceType())
                .provider(quote.getProvider())
                .team1Odds(quote.getTeam1Odds())
                .team2Odds(quote.getTeam2Odds())
                .team1ImpliedProb(quote.getTeam1ImpliedProb())
                .team2ImpliedProb(quote.getTeam2ImpliedProb())
                .fetchedAt(quote.getFetchedAt())
                .payload(quote.getOddsPayload())
                .build();
    }
}
