package com.tony.esportsAnalytics.config;

import com.tony.esportsAnalytics.mapper.ProviderPayloadMapper;
import com.tony.esportsAnalytics.service.DataSourceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class DataSourceInitializer implements CommandLineRunner {
    private final List<ProviderPayloadMapper> mappers;
    private final DataSourceService dataSourceService;
    private final IngestionProperties properties;

    @Override
    public void run(String... args) {
        if (!properties.isRegisterMappersOnStartup()) return;

        // On ne crée que les sources absentes, l'état actif/inactif existant est conservé
        for (ProviderPayloadMapper mapper : mappers) {
            if (dataSourceService.findByName(mapper.sourceType()).isEmpty()) {
                dataSourceService.register(mapper.sourceType(), mapper.displayName(), null, null);
                log.info("🌱 Source '{}' enregistrée", mapper.sourceType());
            }
        }
    }
}
