package climate.layer.domain.model.cache;

import java.util.Objects;

/**
 * Deterministic cache identity: {@code layerId + ":" + canonical(params)}.
 *
 * <p>Canonicalization (sorted keys, stable number rendering) happens in the infrastructure key
 * factory; this type only carries the result.
 */
public record CacheKey(String layerId, String value) {

  public CacheKey {
    Objects.requireNonNull(layerId, "layerId");
    Objects.requireNonNull(value, "value");
  }

  public static CacheKey of(String layerId, String canonicalParams) {
    return new CacheKey(layerId, layerId + ":" + canonicalParams);
  }

  @Override
  public String toString() {
    return value;
  }
}
