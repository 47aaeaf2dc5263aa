package com.tony.esportsAnalytics.service;

import com.tony.esportsAnalytics.config.IngestionProperties;
import com.tony.esportsAnalytics.exception.ConflictException;
import com.tony.esportsAnalytics.exception.ResourceNotFoundException;
import com.tony.esportsAnalytics.model.DataSource;
import com.tony.esportsAnalytics.repository.DataSourceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DataSourceServiceTest {

    @Mock
    private DataSourceRepository repository;

    private IngestionProperties properties;
    private DataSourceService service;

    @BeforeEach
    void setUp() {
        properties = new IngestionProperties();
        service = new DataSourceService(repository, properties,
                Clock.fixed(Instant.parse("2025-03-14T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("L'enregistrement normalise le nom et horodate la source")
    void registerNormalizesName() {
        when(repository.existsByName("hltv")).thenReturn(false);
        when(repository.saveAndFlush(any(DataSource.class))).thenAnswer(invocation -> invocation.getArgument(0));

        DataSource source = service.register(" HLTV ", "HLTV.org", null, "https://www.hltv.org");

        assertThat(source.getName()).isEqualTo("hltv");
        assertThat(source.isActive()).isTrue();
        assertThat(source.getCreatedAt()).isEqualTo(LocalDateTime.of(2025, 3, 14, 12, 0));
    }

    @Test
    @DisplayName("Un nom déjà pris est un conflit")
    void duplicateNameIsConflict() {
        when(repository.existsByName("bo3")).thenReturn(true);

        assertThatThrownBy(() -> service.register("bo3", "BO3.gg", null, null)).isInstanceOf(ConflictException.class);
        verify(repository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("Désactiver une source ne touche qu'au flag actif")
    void deactivateSource() {
        DataSource source = new DataSource("bo3", "BO3.gg");
        when(repository.findByName("bo3")).thenReturn(Optional.of(source));
        when(repository.save(source)).thenReturn(source);

        DataSource updated = service.setActive("bo3", false);

        assertThat(updated.isActive()).isFalse();
        assertThat(updated.getDisplayName()).isEqualTo("BO3.gg");
    }

    @Test
    @DisplayName("Source inconnue à l'ingestion : 404 sauf si l'enregistrement automatique est activé")
    void resolveForIngestion() {
        when(repository.findByName("pandascore")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.resolveForIngestion("pandascore")).isInstanceOf(ResourceNotFoundException.class);

        properties.setAutoRegisterSources(true);
        when(repository.existsByName("pandascore")).thenReturn(false);
        when(repository.saveAndFlush(any(DataSource.class))).thenAnswer(invocation -> invocation.getArgument(0));

        DataSource created = service.resolveForIngestion("pandascore");

        assertThat(created.getName()).isEqualTo("pandascore");
        assertThat(created.isActive()).isTrue();
    }
}
