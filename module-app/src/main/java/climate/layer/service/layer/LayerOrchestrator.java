package climate.layer.service.layer;

import climate.layer.application.port.ComputeRequest;
import climate.layer.application.port.UpstreamComputePort;
import climate.layer.domain.event.LayerStatusEvent;
import climate.layer.domain.event.LayerStatusListener;
import climate.layer.domain.event.Subscription;
import climate.layer.domain.model.cache.CacheEntry;
import climate.layer.domain.model.cache.CacheKey;
import climate.layer.domain.model.cache.SourceKind;
import climate.layer.domain.model.circuit.CircuitState;
import climate.layer.domain.model.layer.LayerDefinition;
import climate.layer.domain.model.layer.LayerError;
import climate.layer.domain.model.layer.LayerErrorType;
import climate.layer.domain.model.layer.LayerState;
import climate.layer.domain.model.layer.LayerStatus;
import climate.layer.domain.model.layer.LayerStatusSummary;
import climate.layer.domain.model.session.EnabledLayer;
import climate.layer.domain.model.session.SessionPreferences;
import climate.layer.domain.model.session.SessionSnapshot;
import climate.layer.domain.model.session.Viewport;
import climate.layer.error.exception.InvalidInputException;
import climate.layer.error.exception.RequestSupersededException;
import climate.layer.error.exception.UnknownLayerException;
import climate.layer.infrastructure.cache.CacheKeyFactory;
import climate.layer.infrastructure.cache.LayerCacheStore;
import climate.layer.infrastructure.concurrency.CancellationToken;
import climate.layer.infrastructure.concurrency.RequestCoordinator;
import climate.layer.infrastructure.resilience.ReliabilityGate;
import climate.layer.infrastructure.resilience.UpstreamFailures;
import climate.layer.infrastructure.session.SessionMemory;
import climate.layer.service.layer.DataSourceClassifier.Classification;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * 레이어 데이터 오케스트레이터
 *
 * <h4>FetchLayer 흐름</h4>
 *
 * <pre>
 * 캐시 키 계산 → 같은 레이어의 다른 키 요청 취소
 *   → (forceRefresh 가 아니면) 캐시 적중 시 즉시 Success/Fallback
 *   → Loading → RequestCoordinator(중복 제거) → ReliabilityGate(서킷/재시도/타임아웃) → upstream
 *   → 성공: 캐시 기록(취소되지 않은 경우만) + Success/Fallback
 *   → 실패: stale 캐시가 있으면 Fallback(stale=true), 없으면 Error
 * </pre>
 *
 * <p>공개 연산은 예외를 던지지 않습니다. 모든 실패는 {@link LayerState#lastError()} 로 전달됩니다.
 */
@Slf4j
public class LayerOrchestrator {

  private final LayerCatalog catalog;
  private final CacheKeyFactory keyFactory;
  private final LayerCacheStore cache;
  private final RequestCoordinator<UpstreamResult> coordinator;
  private final ReliabilityGate gate;
  private final UpstreamComputePort upstream;
  private final DataSourceClassifier classifier;
  private final LayerStateMachine stateMachine;
  private final SessionMemory session;
  private final ViewportChangePolicy viewportPolicy;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  private final Object enabledLock = new Object();
  private final Map<String, EnabledLayer> enabledLayers = new LinkedHashMap<>();
  private final Map<String, Viewport> viewportBaselines = new HashMap<>();

  public LayerOrchestrator(
      LayerCatalog catalog,
      CacheKeyFactory keyFactory,
      LayerCacheStore cache,
      RequestCoordinator<UpstreamResult> coordinator,
      ReliabilityGate gate,
      UpstreamComputePort upstream,
      DataSourceClassifier classifier,
      LayerStateMachine stateMachine,
      SessionMemory session,
      ViewportChangePolicy viewportPolicy,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.catalog = catalog;
    this.keyFactory = keyFactory;
    this.cache = cache;
    this.coordinator = coordinator;
    this.gate = gate;
    this.upstream = upstream;
    this.classifier = classifier;
    this.stateMachine = stateMachine;
    this.session = session;
    this.viewportPolicy = viewportPolicy;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  /** 업스트림 호출 한 건의 결과 (중복 제거된 대기자들이 공유) */
  public record UpstreamResult(String payload, Classification classification) {}

  // ==================== FetchLayer ====================

  public LayerState fetchLayer(String layerId, Map<String, Object> params) {
    return fetchLayer(layerId, params, false);
  }

  public LayerState fetchLayer(String layerId, Map<String, Object> params, boolean forceRefresh) {
    return fetchLayerAsync(layerId, params, forceRefresh).join();
  }

  /**
   * 비동기 FetchLayer
   *
   * <p>반환된 Future 는 예외 없이 완료됩니다. 호출자가 Future 를 취소하면 이 호출자만 대기에서 빠지며, 같은 키를 기다리는 다른 호출자가
   * 없을 때만 업스트림 요청이 취소됩니다.
   */
  public CompletableFuture<LayerState> fetchLayerAsync(
      String layerId, Map<String, Object> params, boolean forceRefresh) {
    Map<String, Object> safeParams = params == null ? Map.of() : params;

    LayerDefinition definition;
    CacheKey key;
    try {
      definition = catalog.require(layerId);
      key = definition.isLocal() ? null : keyFactory.keyFor(layerId, safeParams);
    } catch (UnknownLayerException | InvalidInputException e) {
      return CompletableFuture.completedFuture(rejected(layerId, e));
    }

    if (definition.isLocal()) {
      return CompletableFuture.completedFuture(serveLocal(definition));
    }

    coordinator.supersede(layerId, key.value());

    if (!forceRefresh) {
      Optional<CacheEntry> hit = cache.get(key);
      if (hit.isPresent()) {
        return CompletableFuture.completedFuture(serveCached(definition, key, hit.get()));
      }
    }

    stateMachine.markLoading(layerId, key.value(), Map.of("forceRefresh", forceRefresh));
    CompletableFuture<UpstreamResult> flight =
        coordinator.execute(
            key.value(), layerId, token -> fetchUpstream(definition, key, safeParams, token));
    CompletableFuture<LayerState> settled =
        flight.handle((result, error) -> settle(definition, key, result, error));

    CompletableFuture<LayerState> caller = new CompletableFuture<>();
    settled.whenComplete(
        (state, error) -> {
          if (error != null) {
            caller.completeExceptionally(error);
          } else {
            caller.complete(state);
          }
        });
    caller.whenComplete(
        (state, error) -> {
          if (error instanceof CancellationException) {
            onCallerCancelled(definition, key, flight);
          }
        });
    return caller;
  }

  /** 호출자 이탈. 같은 키를 기다리는 다른 호출자가 없으면 요청이 취소되고 상태는 Error(CANCELLED) */
  private void onCallerCancelled(
      LayerDefinition definition, CacheKey key, CompletableFuture<UpstreamResult> flight) {
    flight.cancel(true);
    if (coordinator.isInFlight(key.value())) {
      return;
    }
    log.info("[Orchestrator] {} 요청 취소됨", definition.layerId());
    complete(
        definition,
        key,
        LayerStatus.ERROR,
        null,
        LayerError.of(LayerErrorType.CANCELLED, "all waiters detached"),
        Map.of(),
        null);
  }

  private UpstreamResult fetchUpstream(
      LayerDefinition definition,
      CacheKey key,
      Map<String, Object> params,
      CancellationToken token) {
    ComputeRequest request =
        new ComputeRequest(
            definition.layerId(), definition.route(), params, definition.attemptTimeout());
    String payload =
        gate.call(
            definition.endpointId(),
            definition.attemptTimeout(),
            token::isCancelled,
            () -> upstream.compute(request));

    Classification classification = classifier.classify(definition.layerId(), payload);
    SourceKind kind = classification.sourceKind();
    if (kind == SourceKind.FALLBACK && !definition.allowFallbackData()) {
      log.info("[Orchestrator] {} 폴백 데이터는 캐시하지 않음", definition.layerId());
      if (token.isCancelled()) {
        throw new RequestSupersededException(key.value());
      }
    } else {
      token
          .callIfActive(() -> cache.put(key, payload, definition.ttl(), kind))
          .orElseThrow(() -> new RequestSupersededException(key.value()));
    }
    return new UpstreamResult(payload, classification);
  }

  private LayerState settle(
      LayerDefinition definition, CacheKey key, UpstreamResult result, Throwable error) {
    try {
      return error == null
          ? onUpstreamSuccess(definition, key, result)
          : onUpstreamFailure(definition, key, UpstreamFailures.unwrap(error));
    } catch (RuntimeException e) {
      log.error("[Orchestrator] {} 결과 반영 중 예외", definition.layerId(), e);
      return stateMachine.getLatestState(definition.layerId());
    }
  }

  private LayerState onUpstreamSuccess(
      LayerDefinition definition, CacheKey key, UpstreamResult result) {
    Classification classification = result.classification();
    SourceKind kind = classification.sourceKind();
    LayerStatus status = kind == SourceKind.FALLBACK ? LayerStatus.FALLBACK : LayerStatus.SUCCESS;

    Map<String, Object> metadata = new LinkedHashMap<>(classification.metadata());
    metadata.put("cached", false);
    log.debug("[Orchestrator] {} 업스트림 응답 반영 (dataSource: {})", definition.layerId(), kind);
    return complete(definition, key, status, kind, null, metadata, result.payload());
  }

  private LayerState onUpstreamFailure(LayerDefinition definition, CacheKey key, Throwable cause) {
    String layerId = definition.layerId();
    if (cause instanceof RequestSupersededException || cause instanceof CancellationException) {
      return stateMachine.getLatestState(layerId);
    }

    LayerError error = LayerErrorMapper.from(cause);
    Optional<CacheEntry> stale = definition.staleOnError() ? cache.getStale(key) : Optional.empty();
    if (stale.isPresent()) {
      CacheEntry entry = stale.get();
      log.warn(
          "[Orchestrator] {} 업스트림 실패, stale 캐시로 대체 (age: {}ms, error: {})",
          layerId,
          entry.age(clock.instant()).toMillis(),
          error.type());
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("stale", true);
      metadata.put("cached", true);
      metadata.put("staleAgeMs", entry.age(clock.instant()).toMillis());
      metadata.put("fallbackReason", "upstream failure: " + error.type());
      return complete(
          definition,
          key,
          LayerStatus.FALLBACK,
          entry.sourceKind(),
          error,
          metadata,
          entry.payload());
    }

    log.warn("[Orchestrator] {} 업스트림 실패 ({}): {}", layerId, error.type(), error.message());
    return complete(definition, key, LayerStatus.ERROR, null, error, Map.of(), null);
  }

  private LayerState complete(
      LayerDefinition definition,
      CacheKey key,
      LayerStatus status,
      SourceKind dataSource,
      LayerError error,
      Map<String, Object> metadata,
      String data) {
    Optional<LayerState> applied =
        stateMachine.completeIfActive(
            definition.layerId(), key.value(), status, dataSource, error, metadata, data);
    applied.ifPresent(state -> countFetch(state.status()));
    return applied.orElseGet(() -> stateMachine.getLatestState(definition.layerId()));
  }

  private LayerState serveCached(LayerDefinition definition, CacheKey key, CacheEntry entry) {
    LayerStatus status =
        entry.sourceKind() == SourceKind.FALLBACK ? LayerStatus.FALLBACK : LayerStatus.SUCCESS;
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("cached", true);
    metadata.put("cacheAgeMs", entry.age(clock.instant()).toMillis());
    log.debug("[Orchestrator] {} 캐시 적중", definition.layerId());
    LayerState state =
        stateMachine.apply(
            definition.layerId(),
            key.value(),
            status,
            entry.sourceKind(),
            null,
            metadata,
            entry.payload());
    countFetch(state.status());
    return state;
  }

  private LayerState serveLocal(LayerDefinition definition) {
    coordinator.supersede(definition.layerId(), null);
    LayerState state =
        stateMachine.apply(
            definition.layerId(),
            null,
            LayerStatus.SUCCESS,
            SourceKind.REAL,
            null,
            Map.of("source", "local"),
            null);
    countFetch(state.status());
    return state;
  }

  /** 미등록 레이어, 직렬화할 수 없는 파라미터 → Error */
  private LayerState rejected(String layerId, RuntimeException e) {
    log.warn("[Orchestrator] {} 요청 거부: {}", layerId, e.getMessage());
    stateMachine.markLoading(layerId, null, Map.of());
    LayerState state =
        stateMachine.apply(
            layerId, null, LayerStatus.ERROR, null, LayerErrorMapper.from(e), Map.of(), null);
    countFetch(state.status());
    return state;
  }

  private void countFetch(LayerStatus status) {
    meterRegistry
        .counter("layer.fetch", "status", status.name().toLowerCase(Locale.ROOT))
        .increment();
  }

  // ==================== SyncEnabledLayers ====================

  /**
   * 활성 레이어 집합 동기화
   *
   * <p>새로 켜졌거나 파라미터가 바뀐 레이어만 다시 요청하고, 꺼진 레이어의 진행 중 요청은 취소합니다. rememberLayers 가 켜져 있으면 세션에
   * 기록합니다.
   *
   * @return 요청된 레이어별 최신 상태 (요청 순서 유지)
   */
  public Map<String, LayerState> syncEnabledLayers(List<LayerRequest> desired) {
    Map<String, LayerRequest> desiredById = new LinkedHashMap<>();
    desired.forEach(request -> desiredById.put(request.layerId(), request));

    List<String> changed = new ArrayList<>();
    List<String> removed = new ArrayList<>();
    List<EnabledLayer> nextEnabled = new ArrayList<>();
    synchronized (enabledLock) {
      Instant now = clock.instant();
      for (LayerRequest request : desiredById.values()) {
        EnabledLayer previous = enabledLayers.get(request.layerId());
        boolean paramsChanged = previous == null || !previous.params().equals(request.params());
        if (paramsChanged) {
          changed.add(request.layerId());
        }
        Instant enabledAt = paramsChanged ? now : previous.enabledAt();
        nextEnabled.add(
            new EnabledLayer(request.layerId(), request.params(), request.opacity(), enabledAt));
      }
      for (String layerId : enabledLayers.keySet()) {
        if (!desiredById.containsKey(layerId)) {
          removed.add(layerId);
        }
      }
      enabledLayers.clear();
      nextEnabled.forEach(layer -> enabledLayers.put(layer.layerId(), layer));
    }

    for (String layerId : removed) {
      log.info("[Orchestrator] {} 비활성화, 진행 중인 요청 취소", layerId);
      coordinator.supersede(layerId, null);
    }
    Map<String, CompletableFuture<LayerState>> pending = new LinkedHashMap<>();
    for (LayerRequest request : desiredById.values()) {
      pending.put(
          request.layerId(),
          changed.contains(request.layerId())
              ? fetchLayerAsync(request.layerId(), request.params(), false)
              : CompletableFuture.completedFuture(stateMachine.getLatestState(request.layerId())));
    }

    if (session.getPreferences().rememberLayers()) {
      session.save(snapshot -> snapshot.setEnabledLayers(nextEnabled));
    }

    Map<String, LayerState> states = new LinkedHashMap<>();
    pending.forEach((layerId, future) -> states.put(layerId, future.join()));
    return states;
  }

  public List<EnabledLayer> getEnabledLayers() {
    synchronized (enabledLock) {
      return List.copyOf(enabledLayers.values());
    }
  }

  // ==================== Viewport ====================

  /**
   * 뷰포트 갱신
   *
   * <p>재요청 기준 뷰포트는 재요청이 필요하다고 판정될 때만 갱신되므로, 작은 이동이 누적되어 임계값을 넘으면 재요청됩니다.
   *
   * @return 레이어를 다시 요청해야 하면 true
   */
  public boolean updateViewport(String contextId, Viewport viewport) {
    Objects.requireNonNull(contextId, "contextId");
    Objects.requireNonNull(viewport, "viewport");
    boolean refetch;
    synchronized (enabledLock) {
      refetch = viewportPolicy.requiresRefetch(viewportBaselines.get(contextId), viewport);
      if (refetch) {
        viewportBaselines.put(contextId, viewport);
      }
    }
    boolean remember = session.getPreferences().rememberViewport();
    session.save(
        snapshot -> {
          if (remember) {
            snapshot.getViewportByContext().put(contextId, viewport);
          }
          snapshot.setLastActiveContext(contextId);
        });
    return refetch;
  }

  // ==================== Session ====================

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    restoreSession();
  }

  /**
   * 저장된 세션을 읽고, autoRestore + rememberLayers 인 경우 기억된 레이어를 다시 요청
   *
   * @return 재요청된 레이어별 상태 Future
   */
  public Map<String, CompletableFuture<LayerState>> restoreSession() {
    SessionSnapshot snapshot = session.load();
    SessionPreferences preferences = snapshot.getPreferences();
    synchronized (enabledLock) {
      viewportBaselines.clear();
      viewportBaselines.putAll(snapshot.getViewportByContext());
    }
    if (!preferences.autoRestore() || !preferences.rememberLayers()) {
      return Map.of();
    }

    synchronized (enabledLock) {
      enabledLayers.clear();
      snapshot.getEnabledLayers().forEach(layer -> enabledLayers.put(layer.layerId(), layer));
    }
    Map<String, CompletableFuture<LayerState>> restored = new LinkedHashMap<>();
    for (EnabledLayer layer : snapshot.getEnabledLayers()) {
      restored.put(layer.layerId(), fetchLayerAsync(layer.layerId(), layer.params(), false));
    }
    log.info("[Orchestrator] 세션 복원: 레이어 {}개 재요청", restored.size());
    return restored;
  }

  public byte[] exportSnapshot() {
    return session.exportSnapshot();
  }

  /**
   * 스냅샷 가져오기. 레이어를 자동으로 다시 요청하지는 않습니다.
   *
   * @throws climate.layer.error.exception.InvalidSnapshotException 해석할 수 없는 바이트
   */
  public SessionSnapshot importSnapshot(byte[] bytes) {
    SessionSnapshot imported = session.importSnapshot(bytes);
    synchronized (enabledLock) {
      enabledLayers.clear();
      imported.getEnabledLayers().forEach(layer -> enabledLayers.put(layer.layerId(), layer));
      viewportBaselines.clear();
      viewportBaselines.putAll(imported.getViewportByContext());
    }
    return imported;
  }

  public SessionPreferences getPreferences() {
    return session.getPreferences();
  }

  public void updatePreferences(SessionPreferences preferences) {
    session.updatePreferences(preferences);
  }

  /** 진행 중 요청 취소, 캐시/세션/상태 전체 초기화 */
  public void clearAll() {
    coordinator.cancelAll();
    cache.clear();
    session.clear();
    synchronized (enabledLock) {
      enabledLayers.clear();
      viewportBaselines.clear();
    }
    stateMachine.resetAll();
    log.info("[Orchestrator] 전체 초기화 완료");
  }

  // ==================== Observation ====================

  public Subscription subscribe(String layerId, LayerStatusListener listener) {
    return stateMachine.subscribe(layerId, listener);
  }

  public Subscription subscribeAll(LayerStatusListener listener) {
    return stateMachine.subscribeAll(listener);
  }

  public LayerState getLatestState(String layerId) {
    return stateMachine.getLatestState(layerId);
  }

  public List<LayerStatusEvent> getHistory(String layerId) {
    return stateMachine.getHistory(layerId);
  }

  public LayerStatusSummary getSummary() {
    return stateMachine.getSummary();
  }

  public void resetLayer(String layerId) {
    coordinator.supersede(layerId, null);
    stateMachine.reset(layerId);
  }

  public Collection<LayerDefinition> getLayerDefinitions() {
    return catalog.all();
  }

  // ==================== Circuit administration ====================

  public Map<String, CircuitState> getCircuitStates() {
    return gate.getAllCircuitStates();
  }

  public CircuitState getCircuitState(String endpointId) {
    return gate.getCircuitState(endpointId);
  }

  public void resetCircuit(String endpointId) {
    gate.resetCircuit(endpointId);
  }
}
