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

/**
 * Équipe telle que vue par UNE source. Deux fournisseurs qui décrivent la même équipe
 * réelle produisent deux lignes distinctes : l'identité est (source_type, source_id).
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "teams",
        uniqueConstraints = @UniqueConstraint(name = "uk_teams_source", columnNames = {"source_type", "source_id"}),
        indexes = @Index(name = "idx_teams_name", columnList = "name"))
public class Team {
    @Id
    private UUID id;

    @Column(name = "source_type", nullable = false, length = 50)
    private String sourceType;

    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    @Column(nullable = false)
    private String name;

    private String slug;

    @Column(name = "country_code", length = 2)
    private String countryCode;

    @Column(name = "logo_url", length = 500)
    private String logoUrl;

    // Sous-objet "team" brut du fournisseur
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata")
    private JsonNode metadata;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public Team(UUID id, String sourceType, Long sourceId, String name) {
        this.id = id;
        this.sourceType = sourceType;
        this.sourceId = sourceId;
        this.name = name;
    }

    // HashCode compatible JPA (évite les bugs quand l'ID change après save)
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Team)) return false;
        return id != null && id.equals(((Team) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
