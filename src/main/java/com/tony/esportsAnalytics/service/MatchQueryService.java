package com.tony.esportsAnalytics.service;

import com.tony.esportsAnalytics.exception.ResourceNotFoundException;
import com.tony.esportsAnalytics.model.Match;
import com.tony.esportsAnalytics.model.MatchStatus;
import com.tony.esportsAnalytics.model.dto.MatchView;
import com.tony.esportsAnalytics.repository.MatchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class MatchQueryService {

    static final int MAX_LIMIT = 500;

    private final MatchRepository matchRepository;

    /**
     * Recherche filtrée, plus récents d'abord. Chaque filtre null est ignoré.
     */
    @Transactional(readOnly = true)
    public List<MatchView> findMatches(MatchStatus status, String sourceType, LocalDateTime from, LocalDateTime to,
                                       int limit, boolean includeDetails) {
        String source = sourceType != null && !sourceType.isBlank()
                ? EntityResolverService.normalizeSourceType(sourceType)
                : null;
        int size = Math.max(1, Math.min(limit, MAX_LIMIT));

        Specification<Match> filters = Specification.where(MatchRepository.hasStatus(status))
                .and(MatchRepository.hasSourceType(source))
                .and(MatchRepository.startsAfter(from))
                .and(MatchRepository.startsBefore(to));

        return matchRepository.findAll(filters, PageRequest.of(0, size, Sort.by(Sort.Direction.DESC, "startDate")))
                .stream()
                .map(m -> MatchView.from(m, includeDetails))
                .toList();
    }

    @Transactional(readOnly = true)
    public MatchView getMatch(UUID id, boolean includeDetails) {
        return matchRepository.findWithTeamsById(id)
                .map(m -> MatchView.from(m, includeDetails))
                .orElseThrow(() -> new ResourceNotFoundException("Match", id));
    }

    /**
     * Supprime le match ainsi que ses prédictions et cotes. Équipes et tournoi restent.
     */
    @Transactional
    public void deleteMatch(UUID id) {
        Match match = matchRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Match", id));
        matchRepository.delete(match);
        log.info("🗑️ Match {}/{} supprimé", match.getSourceType(), match.getSourceId());
    }
}
