package com.tony.esportsAnalytics.model.dto;

import com.tony.esportsAnalytics.model.Team;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class TeamView {
    UUID id;
    String sourceType;
    Long sourceId;
    String name;
    String slug;
    String countryCode;
    String logoUrl;

    public static TeamView from(Team team) {
        if (team == null) return null;
        return TeamView.builder()
                .id(team.getId())
                .sourceType(team.getSourceType())
                .sourceId(team.getSourceId())
                .name(team.getName())
                .slug(team.getSlug())
                .countryCode(team.getCountryCode())
                .logoUrl(team.getLogoUrl())
                .build();
    }
}
