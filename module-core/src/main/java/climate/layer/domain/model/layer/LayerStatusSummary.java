package climate.layer.domain.model.layer;

public record LayerStatusSummary(
    int totalLayers, int layersWithFallback, int layersWithErrors, int layersWithRealData) {}
