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
 * Prédiction d'un fournisseur pour un match : au plus une par (match, source).
 * Le payload complet (vainqueur prédit, scores prédits, facteurs de proximité...) est gardé tel quel.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "ai_predictions",
        uniqueConstraints = @UniqueConstraint(name = "uk_predictions_match_source", columnNames = {"match_id", "source_type"}),
        indexes = @Index(name = "idx_ai_predictions_match", columnList = "match_id"))
public class Prediction {
    @Id
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "match_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Match match;

    @Column(name = "source_type", nullable = false, length = 50)
    private String sourceType;

    @Column(name = "source_id")
    private Long sourceId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "prediction_payload", nullable = false)
    private JsonNode predictionPayload;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Prediction)) return false;
        return id != null && id.equals(((Prediction) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
