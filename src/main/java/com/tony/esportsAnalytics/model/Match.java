package com.tony.esportsAnalytics.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Match canonique. Les colonnes scalaires sont une projection (avec pertes) du payload
 * fournisseur, conservé intégralement dans {@code raw_payload} pour pouvoir tout re-dériver.
 * <p>
 * Les scores, le vainqueur et le perdant sont soit tous NULL (match non terminé),
 * soit tous renseignés et cohérents quand le statut est FINISHED.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "matches",
        uniqueConstraints = @UniqueConstraint(name = "uk_matches_source", columnNames = {"source_type", "source_id"}),
        indexes = {
                @Index(name = "idx_matches_teams", columnList = "team1_id,team2_id"),
                @Index(name = "idx_matches_tournament", columnList = "tournament_id"),
                @Index(name = "idx_matches_status", columnList = "status"),
                @Index(name = "idx_matches_start_date", columnList = "start_date")
        })
public class Match {
    @Id
    private UUID id;

    @Column(name = "source_type", nullable = false, length = 50)
    private String sourceType;

    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    private String slug;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "team1_id")
    private Team team1;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "team2_id")
    private Team team2;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "tournament_id")
    private Tournament tournament;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private MatchStatus status;

    @Column(name = "start_date")
    private LocalDateTime startDate;

    // Best-of : 1, 3, 5
    @Column(name = "bo_type")
    private Integer boType;

    @Column(length = 10)
    private String tier;

    @Column(name = "team1_score")
    private Integer team1Score;

    @Column(name = "team2_score")
    private Integer team2Score;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "winner_team_id")
    private Team winner;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "loser_team_id")
    private Team loser;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_payload")
    private JsonNode rawPayload;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "last_fetched_at")
    private LocalDateTime lastFetchedAt;

    // Pas de cycle de vie propre : supprimés avec le match
    @OneToMany(mappedBy = "match", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("createdAt ASC")
    private List<Prediction> predictions = new ArrayList<>();

    @OneToMany(mappedBy = "match", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("provider ASC")
    private List<OddsQuote> oddsQuotes = new ArrayList<>();

    public boolean isFinished() {
        return status == MatchStatus.FINISHED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Match)) return false;
        return id != null && id.equals(((Match) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
