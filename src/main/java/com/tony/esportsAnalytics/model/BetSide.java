package com.tony.esportsAnalytics.model;

public enum BetSide {
    TEAM1, TEAM2
}
