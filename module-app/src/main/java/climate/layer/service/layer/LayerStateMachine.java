package climate.layer.service.layer;

import climate.layer.domain.event.LayerStatusEvent;
import climate.layer.domain.event.LayerStatusListener;
import climate.layer.domain.event.Subscription;
import climate.layer.domain.model.cache.SourceKind;
import climate.layer.domain.model.layer.LayerError;
import climate.layer.domain.model.layer.LayerState;
import climate.layer.domain.model.layer.LayerStatus;
import climate.layer.domain.model.layer.LayerStatusSummary;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * 레이어별 상태 머신 + 이벤트 버스
 *
 * <h4>동시성</h4>
 *
 * <ul>
 *   <li>상태/히스토리/활성 키는 하나의 락으로 보호되며, 전이와 이벤트 시퀀스 부여는 원자적으로 수행
 *   <li>구독자 호출은 락 밖에서 수행. 콜백 안에서 unsubscribe 나 상태 조회를 해도 교착되지 않음
 *   <li>예외를 던지는 구독자는 로그만 남기고 나머지 구독자에게 계속 전달
 * </ul>
 *
 * <h4>활성 키</h4>
 *
 * <p>Loading 으로 전이할 때 요청의 캐시 키를 활성 키로 기록합니다. {@link #completeIfActive} 는 활성 키가 일치할 때만 적용되므로, 대체된
 * 요청의 늦은 완료가 최신 요청의 상태를 덮어쓰지 않습니다.
 */
@Slf4j
public class LayerStateMachine {

  static final int HISTORY_LIMIT = 50;

  private final Clock clock;

  private final Object lock = new Object();
  private final Map<String, LayerState> states = new HashMap<>();
  private final Map<String, String> activeKeys = new HashMap<>();
  private final Map<String, Deque<LayerStatusEvent>> history = new HashMap<>();
  private final Set<String> fallbackSeen = new HashSet<>();
  private long sequence;

  private final Map<String, List<LayerStatusListener>> listenersByLayer =
      new ConcurrentHashMap<>();
  private final List<LayerStatusListener> globalListeners = new CopyOnWriteArrayList<>();

  public LayerStateMachine(Clock clock) {
    this.clock = clock;
  }

  /** 최신 상태. 처음 참조되는 레이어는 Idle 로 생성됩니다. */
  public LayerState getLatestState(String layerId) {
    synchronized (lock) {
      return stateLocked(layerId);
    }
  }

  public Map<String, LayerState> getAllStates() {
    synchronized (lock) {
      return new TreeMap<>(states);
    }
  }

  public boolean isActive(String layerId, String cacheKey) {
    synchronized (lock) {
      return Objects.equals(activeKeys.get(layerId), cacheKey);
    }
  }

  /** Loading 으로 전이하고 cacheKey 를 활성 요청으로 기록 */
  public LayerState markLoading(String layerId, String cacheKey, Map<String, Object> metadata) {
    return apply(layerId, cacheKey, LayerStatus.LOADING, null, null, metadata, null);
  }

  /**
   * 무조건 전이 (캐시 적중, 로컬 레이어, 미등록 레이어 등 즉시 결정되는 결과)
   *
   * @throws IllegalStateException 허용되지 않은 전이
   */
  public LayerState apply(
      String layerId,
      String cacheKey,
      LayerStatus status,
      SourceKind dataSource,
      LayerError error,
      Map<String, Object> metadata,
      String data) {
    Transition transition;
    synchronized (lock) {
      transition = transitionLocked(layerId, cacheKey, status, dataSource, error, metadata, data);
    }
    publish(transition.event());
    return transition.state();
  }

  /**
   * cacheKey 가 여전히 활성 요청일 때만 전이
   *
   * @return 적용된 상태. 더 최신 요청으로 대체되었으면 empty
   */
  public Optional<LayerState> completeIfActive(
      String layerId,
      String cacheKey,
      LayerStatus status,
      SourceKind dataSource,
      LayerError error,
      Map<String, Object> metadata,
      String data) {
    Transition transition;
    synchronized (lock) {
      if (!Objects.equals(activeKeys.get(layerId), cacheKey)) {
        log.debug("[LayerState] {} 대체된 요청의 완료는 무시", layerId);
        return Optional.empty();
      }
      LayerState current = stateLocked(layerId);
      if (current.status().isSettled() && !current.status().canTransitionTo(status)) {
        // 같은 요청을 기다리던 호출자들의 중복 완료 (Error → Error)
        return Optional.of(current);
      }
      transition = transitionLocked(layerId, cacheKey, status, dataSource, error, metadata, data);
    }
    publish(transition.event());
    return Optional.of(transition.state());
  }

  private record Transition(LayerState state, LayerStatusEvent event) {}

  private Transition transitionLocked(
      String layerId,
      String cacheKey,
      LayerStatus status,
      SourceKind dataSource,
      LayerError error,
      Map<String, Object> metadata,
      String data) {
    LayerState previous = stateLocked(layerId);
    if (!previous.status().canTransitionTo(status)) {
      throw new IllegalStateException(
          "illegal layer transition " + previous.status() + " -> " + status + " (" + layerId + ")");
    }
    LayerState next =
        new LayerState(
            layerId, status, dataSource, error, metadata, clock.instant(), cacheKey, data);
    states.put(layerId, next);
    activeKeys.put(layerId, cacheKey);

    LayerStatusEvent event =
        new LayerStatusEvent(
            layerId,
            previous.status(),
            status,
            dataSource,
            next.metadata(),
            next.lastUpdated(),
            ++sequence);
    Deque<LayerStatusEvent> events = history.computeIfAbsent(layerId, id -> new ArrayDeque<>());
    events.addLast(event);
    while (events.size() > HISTORY_LIMIT) {
      events.removeFirst();
    }
    if (dataSource == SourceKind.FALLBACK) {
      fallbackSeen.add(layerId);
      log.warn(
          "[LayerState] {} 폴백 데이터 감지, reason: {}",
          layerId,
          next.metadata().getOrDefault("fallbackReason", "unknown"));
    }
    log.debug("[LayerState] {} {} → {} ({})", layerId, previous.status(), status, dataSource);
    return new Transition(next, event);
  }

  private LayerState stateLocked(String layerId) {
    return states.computeIfAbsent(layerId, id -> LayerState.idle(id, clock.instant()));
  }

  private void publish(LayerStatusEvent event) {
    List<LayerStatusListener> targets = new ArrayList<>(globalListeners);
    targets.addAll(listenersByLayer.getOrDefault(event.layerId(), List.of()));
    for (LayerStatusListener listener : targets) {
      try {
        listener.onStatusChange(event);
      } catch (RuntimeException e) {
        log.error("[LayerState] 구독자 처리 중 예외. layerId: {}", event.layerId(), e);
      }
    }
  }

  public Subscription subscribe(String layerId, LayerStatusListener listener) {
    List<LayerStatusListener> listeners =
        listenersByLayer.computeIfAbsent(layerId, id -> new CopyOnWriteArrayList<>());
    listeners.add(listener);
    return onceOnly(() -> listeners.remove(listener));
  }

  /** 모든 레이어의 이벤트 구독 */
  public Subscription subscribeAll(LayerStatusListener listener) {
    globalListeners.add(listener);
    return onceOnly(() -> globalListeners.remove(listener));
  }

  private static Subscription onceOnly(Runnable removal) {
    AtomicBoolean active = new AtomicBoolean(true);
    return () -> {
      if (active.compareAndSet(true, false)) {
        removal.run();
      }
    };
  }

  public List<LayerStatusEvent> getHistory(String layerId) {
    synchronized (lock) {
      Deque<LayerStatusEvent> events = history.get(layerId);
      return events == null ? List.of() : List.copyOf(events);
    }
  }

  public boolean hasFallback(String layerId) {
    synchronized (lock) {
      return fallbackSeen.contains(layerId);
    }
  }

  public LayerStatusSummary getSummary() {
    synchronized (lock) {
      int fallback = 0;
      int errors = 0;
      int real = 0;
      for (LayerState state : states.values()) {
        if (state.status() == LayerStatus.FALLBACK || state.dataSource() == SourceKind.FALLBACK) {
          fallback++;
        }
        if (state.status() == LayerStatus.ERROR) {
          errors++;
        }
        if (state.dataSource() == SourceKind.REAL) {
          real++;
        }
      }
      return new LayerStatusSummary(states.size(), fallback, errors, real);
    }
  }

  /** 레이어 상태를 Idle 로 되돌리고 히스토리를 비웁니다 (이벤트는 발행하지 않음) */
  public void reset(String layerId) {
    synchronized (lock) {
      states.put(layerId, LayerState.idle(layerId, clock.instant()));
      activeKeys.remove(layerId);
      history.remove(layerId);
      fallbackSeen.remove(layerId);
    }
  }

  public void resetAll() {
    synchronized (lock) {
      states.replaceAll((layerId, state) -> LayerState.idle(layerId, clock.instant()));
      activeKeys.clear();
      history.clear();
      fallbackSeen.clear();
    }
    log.info("[LayerState] 모든 레이어 상태 초기화");
  }
}
