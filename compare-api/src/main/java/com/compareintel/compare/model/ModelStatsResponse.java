package com.compareintel.compare.model;

import java.util.Map;

public record ModelStatsResponse(Map<String, ModelStats> modelStatistics) {
}
