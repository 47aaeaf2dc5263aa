package com.tony.esportsAnalytics.repository;

import com.tony.esportsAnalytics.model.Match;
import com.tony.esportsAnalytics.model.MatchStatus;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MatchRepository extends JpaRepository<Match, UUID>, JpaSpecificationExecutor<Match> {

    Optional<Match> findBySourceTypeAndSourceId(String sourceType, Long sourceId);

    // Équipes chargées d'office : toutes les vues de match les affichent
    @EntityGraph(attributePaths = {"team1", "team2", "tournament"})
    Optional<Match> findWithTeamsById(UUID id);

    @EntityGraph(attributePaths = {"team1", "team2"})
    List<Match> findByStatus(MatchStatus status);

    long countByStatus(MatchStatus status);

    @Query("""
        SELECT DISTINCT m FROM Match m
        JOIN FETCH m.predictions
        LEFT JOIN FETCH m.winner
        WHERE m.status = com.tony.esportsAnalytics.model.MatchStatus.FINISHED
        """)
    List<Match> findFinishedWithPredictions();

    // --- Filtres de recherche (null = pas de filtre) ---

    static Specification<Match> hasStatus(MatchStatus status) {
        return (root, query, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    static Specification<Match> hasSourceType(String sourceType) {
        return (root, query, cb) -> sourceType == null ? null : cb.equal(root.get("sourceType"), sourceType);
    }

    static Specification<Match> startsAfter(LocalDateTime from) {
        return (root, query, cb) -> from == null ? null : cb.greaterThanOrEqualTo(root.get("startDate"), from);
    }

    static Specification<Match> startsBefore(LocalDateTime to) {
        return (root, query, cb) -> to == null ? null : cb.lessThanOrEqualTo(root.get("startDate"), to);
    }
}
