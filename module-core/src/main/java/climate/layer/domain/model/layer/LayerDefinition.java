package climate.layer.domain.model.layer;

import java.time.Duration;
import java.util.Objects;

/**
 * Static description of a layer registered in the catalog.
 *
 * @param layerId stable identifier used by callers
 * @param endpointId upstream endpoint this layer calls; circuits are tracked per endpoint
 * @param route upstream path relative to the base URL
 * @param kind how the data is produced
 * @param ttl cache lifetime of a successful payload
 * @param attemptTimeout deadline of a single upstream attempt
 * @param allowFallbackData whether fallback payloads may be cached
 * @param staleOnError whether an expired cache entry may be served when the upstream fails
 */
public record LayerDefinition(
    String layerId,
    String endpointId,
    String route,
    LayerKind kind,
    Duration ttl,
    Duration attemptTimeout,
    boolean allowFallbackData,
    boolean staleOnError) {

  public LayerDefinition {
    Objects.requireNonNull(layerId, "layerId");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(ttl, "ttl");
    if (kind != LayerKind.LOCAL) {
      Objects.requireNonNull(endpointId, "endpointId");
      Objects.requireNonNull(route, "route");
      Objects.requireNonNull(attemptTimeout, "attemptTimeout");
    }
  }

  public boolean isLocal() {
    return kind == LayerKind.LOCAL;
  }
}
