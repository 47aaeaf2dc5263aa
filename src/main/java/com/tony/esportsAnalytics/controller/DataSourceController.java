package com.tony.esportsAnalytics.controller;

import com.tony.esportsAnalytics.model.DataSource;
import com.tony.esportsAnalytics.model.dto.DataSourceRequest;
import com.tony.esportsAnalytics.service.DataSourceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/sources")
@RequiredArgsConstructor
public class DataSourceController {
    private final DataSourceService dataSourceService;

    @GetMapping
    public ResponseEntity<List<DataSource>> getSources() {
        return ResponseEntity.ok(dataSourceService.findAll());
    }

    @GetMapping("/{name}")
    public ResponseEntity<DataSource> getSource(@PathVariable String name) {
        return ResponseEntity.ok(dataSourceService.getByName(name));
    }

    @PostMapping
    public ResponseEntity<DataSource> registerSource(@Valid @RequestBody DataSourceRequest request) {
        DataSource created = dataSourceService.register(request.getName(), request.getDisplayName(),
                request.getDescription(), request.getBaseUrl());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    // Activer / désactiver une source (les ingestions d'une source inactive sont refusées)
    @PutMapping("/{name}/active")
    public ResponseEntity<DataSource> setActive(@PathVariable String name, @RequestParam boolean active) {
        return ResponseEntity.ok(dataSourceService.setActive(name, active));
    }
}
