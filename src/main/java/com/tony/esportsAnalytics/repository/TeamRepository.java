package com.tony.esportsAnalytics.repository;

import com.tony.esportsAnalytics.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TeamRepository extends JpaRepository<Team, UUID> {
    Optional<Team> findBySourceTypeAndSourceId(String sourceType, Long sourceId);
}
