package com.tony.esportsAnalytics.repository;

import com.tony.esportsAnalytics.model.Prediction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PredictionRepository extends JpaRepository<Prediction, UUID> {
    List<Prediction> findByMatchIdOrderByCreatedAtAsc(UUID matchId);
}
