package com.tony.esportsAnalytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "ingestion")
@Data
public class IngestionProperties {
    // Une source inconnue du registre est créée (active) à sa première ingestion
    private boolean autoRegisterSources = false;

    // Enregistre au démarrage une source par mapper disponible
    private boolean registerMappersOnStartup = true;
}
