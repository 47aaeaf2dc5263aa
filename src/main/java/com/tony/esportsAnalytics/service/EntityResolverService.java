package com.tony.esportsAnalytics.service;

import com.tony.esportsAnalytics.exception.ValidationException;
import com.tony.esportsAnalytics.model.dto.TeamData;
import com.tony.esportsAnalytics.model.dto.TournamentData;
import com.tony.esportsAnalytics.repository.CanonicalStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * Transforme une identité fournisseur (source, id local) en id canonique stable.
 * Première rencontre : création. Rencontres suivantes : mise à jour des attributs, id inchangé.
 * Aucune fusion entre sources : la même équipe vue par deux fournisseurs donne deux lignes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityResolverService {

    private final CanonicalStore store;
    private final Clock clock;

    public UUID resolveTeam(String sourceType, TeamData team) {
        String source = normalizeSourceType(sourceType);
        if (team == null) {
            throw new ValidationException("Équipe manquante");
        }
        requireIdentity(team.getSourceId(), team.getName(), "équipe");

        UUID id = store.upsertTeam(source, team, LocalDateTime.now(clock));
        log.debug("Équipe {}/{} ({}) -> {}", source, team.getSourceId(), team.getName(), id);
        return id;
    }

    public UUID resolveTournament(String sourceType, TournamentData tournament) {
        String source = normalizeSourceType(sourceType);
        if (tournament == null) {
            throw new ValidationException("Tournoi manquant");
        }
        requireIdentity(tournament.getSourceId(), tournament.getName(), "tournoi");

        UUID id = store.upsertTournament(source, tournament, LocalDateTime.now(clock));
        log.debug("Tournoi {}/{} ({}) -> {}", source, tournament.getSourceId(), tournament.getName(), id);
        return id;
    }

    /**
     * Les identifiants de source sont comparés en minuscules sans espaces : 'BO3 ' et 'bo3' sont la même source.
     */
    public static String normalizeSourceType(String sourceType) {
        if (sourceType == null || sourceType.isBlank()) {
            throw new ValidationException("Type de source manquant");
        }
        return sourceType.trim().toLowerCase(Locale.ROOT);
    }

    private void requireIdentity(Long sourceId, String name, String what) {
        if (sourceId == null || sourceId <= 0) {
            throw new ValidationException(String.format("Identifiant source invalide pour %s : %s", what, sourceId));
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException(String.format("Nom manquant pour %s %d", what, sourceId));
        }
    }
}
