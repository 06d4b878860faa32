package climate.layer.infrastructure.cache;

import climate.layer.application.port.DurableStore;
import climate.layer.domain.model.cache.CacheEntry;
import climate.layer.domain.model.cache.CacheKey;
import climate.layer.domain.model.cache.SourceKind;
import climate.layer.error.exception.CacheCorruptionException;
import climate.layer.infrastructure.executor.LogicExecutor;
import climate.layer.infrastructure.executor.TaskContext;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * 2층 구조 캐시 (L1: Caffeine, L2: DurableStore)
 *
 * <ul>
 *   <li>조회: L1 → L2 순서, L2 적중 시 L1 으로 backfill
 *   <li>저장: L1 즉시 반영, L2 는 best-effort (실패해도 L1 결과로 서빙 계속)
 *   <li>만료: Caffeine 자체 만료를 쓰지 않고 {@link CacheEntry#isServable} 로 판정하여, 만료된 엔트리도 stale 폴백에 쓸 수 있도록
 *       보존
 *   <li>손상: L2 엔트리 해석 실패 시 WARN 로그 후 삭제하고 miss 로 처리
 * </ul>
 */
@Slf4j
public class TieredLayerCache implements LayerCacheStore {

  private static final String COMPONENT = "CacheStore";

  private final Cache<String, CacheEntry> l1;
  private final DurableStore l2;
  private final CacheEntryCodec codec;
  private final LogicExecutor executor;
  private final Clock clock;

  private final Counter l1HitCounter;
  private final Counter l2HitCounter;
  private final Counter missCounter;
  private final Counter expiredCounter;
  private final Counter corruptionCounter;

  public TieredLayerCache(
      long maxMemoryEntries,
      DurableStore l2,
      CacheEntryCodec codec,
      LogicExecutor executor,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.l1 = Caffeine.newBuilder().maximumSize(maxMemoryEntries).build();
    this.l2 = l2;
    this.codec = codec;
    this.executor = executor;
    this.clock = clock;

    this.l1HitCounter = requestCounter(meterRegistry, "l1_hit");
    this.l2HitCounter = requestCounter(meterRegistry, "l2_hit");
    this.missCounter = requestCounter(meterRegistry, "miss");
    this.expiredCounter = requestCounter(meterRegistry, "expired");
    this.corruptionCounter = requestCounter(meterRegistry, "corrupted");
  }

  private static Counter requestCounter(MeterRegistry registry, String result) {
    return Counter.builder("layer.cache.requests").tag("result", result).register(registry);
  }

  @Override
  public Optional<CacheEntry> get(CacheKey key) {
    Instant now = clock.instant();

    CacheEntry memory = l1.getIfPresent(key.value());
    if (memory != null) {
      if (memory.isServable(now)) {
        l1HitCounter.increment();
        return Optional.of(memory);
      }
      // 만료된 L1 엔트리는 stale 용도로 유지하고, 더 최신일 리 없는 L2 는 건너뜀
      expiredCounter.increment();
      return Optional.empty();
    }

    Optional<CacheEntry> durable = readDurable(key);
    if (durable.isPresent() && durable.get().isServable(now)) {
      l1.put(key.value(), durable.get());
      l2HitCounter.increment();
      return durable;
    }
    if (durable.isPresent()) {
      expiredCounter.increment();
    } else {
      missCounter.increment();
    }
    return Optional.empty();
  }

  @Override
  public CacheEntry put(CacheKey key, String payload, Duration ttl, SourceKind sourceKind) {
    CacheEntry entry = new CacheEntry(key.value(), payload, clock.instant(), ttl, sourceKind);
    l1.put(key.value(), entry);

    TaskContext context = TaskContext.of(COMPONENT, "DurableWrite", key.value());
    boolean persisted =
        executor.executeOrDefault(() -> writeDurable(entry), Boolean.FALSE, context);
    if (!persisted) {
      log.warn("[CacheStore] L2 저장 실패, 메모리 캐시로만 서빙합니다. key: {}", maskKey(key.value()));
    }
    return entry;
  }

  @Override
  public Optional<CacheEntry> getStale(CacheKey key) {
    CacheEntry memory = l1.getIfPresent(key.value());
    if (memory != null) {
      return Optional.of(memory);
    }
    return readDurable(key);
  }

  @Override
  public void invalidate(CacheKey key) {
    l1.invalidate(key.value());
    executor.executeOrDefault(
        () -> {
          l2.delete(key.value());
          return Boolean.TRUE;
        },
        Boolean.FALSE,
        TaskContext.of(COMPONENT, "DurableDelete", key.value()));
  }

  @Override
  public void clear() {
    l1.invalidateAll();
    executor.executeOrDefault(
        () -> {
          l2.clear();
          return Boolean.TRUE;
        },
        Boolean.FALSE,
        TaskContext.of(COMPONENT, "DurableClear"));
    log.info("[CacheStore] 전체 캐시 삭제 완료");
  }

  public long memorySize() {
    return l1.estimatedSize();
  }

  private Boolean writeDurable(CacheEntry entry) throws Exception {
    l2.write(entry.key(), codec.encode(entry));
    return Boolean.TRUE;
  }

  /** L2 조회. I/O 실패는 miss, 손상 엔트리는 삭제 후 miss */
  private Optional<CacheEntry> readDurable(CacheKey key) {
    TaskContext context = TaskContext.of(COMPONENT, "DurableRead", key.value());
    return executor.executeOrCatch(
        () -> l2.read(key.value()).map(bytes -> codec.decode(key.value(), bytes)),
        e -> recoverDurableRead(key, e),
        context);
  }

  private Optional<CacheEntry> recoverDurableRead(CacheKey key, Throwable e) {
    if (e instanceof CacheCorruptionException) {
      corruptionCounter.increment();
      log.warn("[CacheStore] 손상된 L2 엔트리 폐기. key: {}", maskKey(key.value()), e);
      executor.executeOrDefault(
          () -> {
            l2.delete(key.value());
            return Boolean.TRUE;
          },
          Boolean.FALSE,
          TaskContext.of(COMPONENT, "DurablePurge", key.value()));
      return Optional.empty();
    }
    log.warn(
        "[CacheStore] L2 조회 실패, miss 로 처리. key: {}, error: {}",
        maskKey(key.value()),
        e.toString());
    return Optional.empty();
  }

  static String maskKey(String key) {
    if (key == null) return "null";
    if (key.length() <= 8) return "***";
    return key.substring(0, 4) + "***" + key.substring(key.length() - 4);
  }
}
