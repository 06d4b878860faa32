package climate.layer.infrastructure.cache;

import climate.layer.domain.model.cache.CacheEntry;
import climate.layer.domain.model.cache.CacheKey;
import climate.layer.domain.model.cache.SourceKind;
import java.time.Duration;
import java.util.Optional;

/**
 * 레이어 payload 캐시
 *
 * <p>{@link #get} 은 TTL 이내의 엔트리만 반환하고, {@link #getStale} 는 나이와 무관하게 남아 있는 엔트리를 반환합니다 (업스트림 실패 시
 * stale 폴백용).
 */
public interface LayerCacheStore {

  Optional<CacheEntry> get(CacheKey key);

  CacheEntry put(CacheKey key, String payload, Duration ttl, SourceKind sourceKind);

  Optional<CacheEntry> getStale(CacheKey key);

  void invalidate(CacheKey key);

  void clear();
}
