package com.compareintel.compare.controller;

import com.compareintel.compare.model.ModelCatalogResponse;
import com.compareintel.compare.model.ModelStatsResponse;
import com.compareintel.compare.service.dispatch.ModelRegistry;
import com.compareintel.compare.service.stats.ModelStatsTracker;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class ModelController {

    private final ModelRegistry registry;
    private final ModelStatsTracker statsTracker;

    public ModelController(ModelRegistry registry, ModelStatsTracker statsTracker) {
        this.registry = registry;
        this.statsTracker = statsTracker;
    }

    @GetMapping("/models")
    public ModelCatalogResponse models() {
        return new ModelCatalogResponse(registry.models(), registry.modelsByProvider());
    }

    @GetMapping("/model-stats")
    public ModelStatsResponse modelStats() {
        return new ModelStatsResponse(statsTracker.snapshot());
    }
}
