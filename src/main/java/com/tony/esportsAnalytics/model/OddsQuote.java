package com.tony.esportsAnalytics.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Dernière cote connue d'un bookmaker pour un match. Une ré-ingestion écrase la ligne,
 * aucun historique n'est conservé ici.
 * <p>
 * Les probabilités implicites valent 1/cote côté par côté, sans normalisation :
 * leur somme dépasse 1 de la marge du bookmaker (overround) et c'est voulu.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "betting_odds",
        uniqueConstraints = @UniqueConstraint(name = "uk_betting_odds_match_source_provider",
                columnNames = {"match_id", "source_type", "provider"}),
        indexes = {
                @Index(name = "idx_betting_odds_match", columnList = "match_id"),
                @Index(name = "idx_betting_odds_provider", columnList = "provider")
        })
public class OddsQuote {
    @Id
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "match_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Match match;

    @Column(name = "source_type", nullable = false, length = 50)
    private String sourceType;

    // '1xbit', 'bet365'...
    @Column(nullable = false, length = 100)
    private String provider;

    @Column(name = "team1_odds")
    private Double team1Odds;

    @Column(name = "team2_odds")
    private Double team2Odds;

    @Column(name = "team1_implied_prob")
    private Double team1ImpliedProb;

    @Column(name = "team2_implied_prob")
    private Double team2ImpliedProb;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "odds_payload", nullable = false)
    private JsonNode oddsPayload;

    @Column(name = "fetched_at")
    private LocalDateTime fetchedAt;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OddsQuote)) return false;
        return id != null && id.equals(((OddsQuote) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
