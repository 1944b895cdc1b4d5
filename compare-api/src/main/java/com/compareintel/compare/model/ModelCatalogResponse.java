package com.compareintel.compare.model;

import java.util.List;
import java.util.Map;

public record ModelCatalogResponse(
        List<ModelDescriptor> models,
        Map<String, List<ModelDescriptor>> modelsByProvider
) {
}
