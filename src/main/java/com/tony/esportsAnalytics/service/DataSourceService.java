package com.tony.esportsAnalytics.service;

import com.tony.esportsAnalytics.config.IngestionProperties;
import com.tony.esportsAnalytics.exception.ConflictException;
import com.tony.esportsAnalytics.exception.ResourceNotFoundException;
import com.tony.esportsAnalytics.model.DataSource;
import com.tony.esportsAnalytics.repository.DataSourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Registre des sources. Une fois créée, une source ne change plus que par son flag actif.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DataSourceService {

    private final DataSourceRepository repository;
    private final IngestionProperties ingestionProperties;
    private final Clock clock;

    public List<DataSource> findAll() {
        return repository.findAll();
    }

    public Optional<DataSource> findByName(String name) {
        return repository.findByName(EntityResolverService.normalizeSourceType(name));
    }

    public DataSource getByName(String name) {
        return findByName(name).orElseThrow(() -> new ResourceNotFoundException("Source de données", name));
    }

    @Transactional
    public DataSource register(String name, String displayName, String description, String baseUrl) {
        String normalized = EntityResolverService.normalizeSourceType(name);
        if (repository.existsByName(normalized)) {
            throw new ConflictException("Source déjà enregistrée : " + normalized);
        }

        DataSource source = new DataSource(normalized, displayName != null ? displayName : normalized);
        source.setDescription(description);
        source.setBaseUrl(baseUrl);
        LocalDateTime now = LocalDateTime.now(clock);
        source.setCreatedAt(now);
        source.setUpdatedAt(now);

        try {
            return repository.saveAndFlush(source);
        } catch (DataIntegrityViolationException e) {
            // Enregistrement concurrent du même nom
            throw new ConflictException("Source déjà enregistrée : " + normalized, e);
        }
    }

    @Transactional
    public DataSource setActive(String name, boolean active) {
        DataSource source = getByName(name);
        if (source.isActive() != active) {
            source.setActive(active);
            source.setUpdatedAt(LocalDateTime.now(clock));
            log.info("Source '{}' {}", source.getName(), active ? "activée" : "désactivée");
        }
        return repository.save(source);
    }

    /**
     * Source à utiliser pour une ingestion. Inconnue : créée si {@code ingestion.auto-register-sources}
     * est activé, sinon 404.
     */
    @Transactional
    public DataSource resolveForIngestion(String name) {
        Optional<DataSource> existing = findByName(name);
        if (existing.isPresent()) return existing.get();

        if (!ingestionProperties.isAutoRegisterSources()) {
            throw new ResourceNotFoundException("Source de données", name);
        }
        log.info("Source inconnue '{}', enregistrement automatique", name);
        return register(name, null, null, null);
    }
}
