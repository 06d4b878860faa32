package climate.layer.domain.event;

import climate.layer.domain.model.cache.SourceKind;
import climate.layer.domain.model.layer.LayerStatus;
import java.time.Instant;
import java.util.Map;

/**
 * Emitted once per state transition.
 *
 * <p>{@code sequence} increases monotonically across all layers; listeners that may receive events
 * from several threads can use it to drop out-of-order deliveries.
 */
public record LayerStatusEvent(
    String layerId,
    LayerStatus previousStatus,
    LayerStatus newStatus,
    SourceKind dataSource,
    Map<String, Object> metadata,
    Instant timestamp,
    long sequence) {}
