package climate.layer.domain.model.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 캐시 엔트리 (Value Object)
 *
 * <p>서빙 가능 조건: {@code now - createdAt <= ttl}. 만료된 엔트리도 stale 조회를 위해 보존될 수 있습니다.
 */
public record CacheEntry(
    String key, String payload, Instant createdAt, Duration ttl, SourceKind sourceKind) {

  public CacheEntry {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must not be negative: " + ttl);
    }
    if (sourceKind == null) {
      sourceKind = SourceKind.UNKNOWN;
    }
  }

  public boolean isServable(Instant now) {
    return age(now).compareTo(ttl) <= 0;
  }

  public Duration age(Instant now) {
    return Duration.between(createdAt, now);
  }
}
