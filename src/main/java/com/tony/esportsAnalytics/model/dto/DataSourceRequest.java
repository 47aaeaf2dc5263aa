package com.tony.esportsAnalytics.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class DataSourceRequest {
    @NotBlank(message = "Le nom de la source est requis")
    @Size(max = 50)
    @Pattern(regexp = "[a-z0-9_-]+", message = "doit être en minuscules (ex: bo3, hltv)")
    private String name;

    @NotBlank(message = "Le nom affiché est requis")
    @Size(max = 100)
    private String displayName;

    private String description;
    private String baseUrl;
}
