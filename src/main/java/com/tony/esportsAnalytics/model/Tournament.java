package com.tony.esportsAnalytics.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "tournaments",
        uniqueConstraints = @UniqueConstraint(name = "uk_tournaments_source", columnNames = {"source_type", "source_id"}),
        indexes = {
                @Index(name = "idx_tournaments_tier", columnList = "tier"),
                @Index(name = "idx_tournaments_dates", columnList = "start_date,end_date")
        })
public class Tournament {
    @Id
    private UUID id;

    @Column(name = "source_type", nullable = false, length = 50)
    private String sourceType;

    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    @Column(nullable = false)
    private String name;

    private String slug;

    // 's', 'a', 'b'...
    @Column(length = 10)
    private String tier;

    @Column(name = "tier_rank")
    private Integer tierRank;

    @Column(name = "prize_pool")
    private Long prizePool;

    @Column(name = "discipline_id")
    private Integer disciplineId;

    // Statut fournisseur tel quel : 'upcoming', 'current', 'finished'
    @Column(length = 50)
    private String status;

    @Column(name = "start_date")
    private LocalDateTime startDate;

    @Column(name = "end_date")
    private LocalDateTime endDate;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata")
    private JsonNode metadata;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tournament)) return false;
        return id != null && id.equals(((Tournament) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
