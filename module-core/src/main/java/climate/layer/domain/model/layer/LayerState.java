package climate.layer.domain.model.layer;

import climate.layer.domain.model.cache.SourceKind;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 레이어 상태 스냅샷 (불변)
 *
 * <p>상태 전이마다 새 인스턴스가 만들어지며, {@code cacheKey} 는 이 상태가 반영하는 요청을 식별합니다.
 * {@code data} 는 Success/Fallback 상태에서 렌더링할 payload 입니다.
 */
public record LayerState(
    String layerId,
    LayerStatus status,
    SourceKind dataSource,
    LayerError lastError,
    Map<String, Object> metadata,
    Instant lastUpdated,
    String cacheKey,
    String data) {

  public LayerState {
    Objects.requireNonNull(layerId, "layerId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(lastUpdated, "lastUpdated");
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static LayerState idle(String layerId, Instant now) {
    return new LayerState(layerId, LayerStatus.IDLE, null, null, Map.of(), now, null, null);
  }

  public boolean isStale() {
    return Boolean.TRUE.equals(metadata.get("stale"));
  }
}
