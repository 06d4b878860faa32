package climate.layer.infrastructure.cache;

import climate.layer.domain.model.cache.CacheEntry;
import climate.layer.domain.model.cache.SourceKind;
import climate.layer.error.exception.CacheCorruptionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

/** CacheEntry ↔ 영속 바이트 변환 (JSON) */
public class CacheEntryCodec {

  private final ObjectMapper objectMapper;

  public CacheEntryCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public byte[] encode(CacheEntry entry) throws JsonProcessingException {
    return objectMapper.writeValueAsBytes(
        new PersistedEntry(
            entry.key(),
            entry.payload(),
            entry.createdAt().toEpochMilli(),
            entry.ttl().toMillis(),
            entry.sourceKind().wireName()));
  }

  /**
   * @throws CacheCorruptionException 해석할 수 없거나, 필수 필드가 없거나, 다른 키의 엔트리인 경우
   */
  public CacheEntry decode(String expectedKey, byte[] bytes) {
    PersistedEntry persisted;
    try {
      persisted = objectMapper.readValue(bytes, PersistedEntry.class);
    } catch (IOException e) {
      throw new CacheCorruptionException(expectedKey, e);
    }
    if (persisted == null
        || persisted.payload() == null
        || persisted.ttlMs() < 0
        || !expectedKey.equals(persisted.key())) {
      throw new CacheCorruptionException(expectedKey);
    }
    return new CacheEntry(
        persisted.key(),
        persisted.payload(),
        Instant.ofEpochMilli(persisted.createdAtMs()),
        Duration.ofMillis(persisted.ttlMs()),
        SourceKind.fromFlag(persisted.sourceKind()));
  }

  record PersistedEntry(
      String key, String payload, long createdAtMs, long ttlMs, String sourceKind) {}
}
