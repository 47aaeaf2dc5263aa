package com.tony.esportsAnalytics.model.dto;

import com.tony.esportsAnalytics.model.BetSide;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class ValueBetCandidate {
    UUID matchId;
    BetSide side;
    UUID teamId;
    String teamName;
    String oddsSourceType;
    String provider;
    double decimalOdds;
    double impliedProbability;
    double estimatedProbability;
    double expectedValue;
    double kellyFraction;
}
