package com.tony.esportsAnalytics.repository;

import com.tony.esportsAnalytics.model.OddsQuote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface OddsQuoteRepository extends JpaRepository<OddsQuote, UUID> {
    List<OddsQuote> findByMatchIdOrderByProviderAsc(UUID matchId);
}
