package climate.layer.infrastructure.resilience;

import climate.layer.domain.model.circuit.CircuitState;
import climate.layer.domain.model.circuit.CircuitStatus;
import climate.layer.error.exception.CircuitOpenException;
import climate.layer.error.exception.marker.CircuitBreakerIgnoreMarker;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.core.IntervalFunction;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.function.BiConsumer;
import lombok.extern.slf4j.Slf4j;

/**
 * 엔드포인트 하나의 Resilience4j CircuitBreaker 와 조회용 부가 정보 (연속 실패, 다음 재시도 시각)
 *
 * <h4>설정</h4>
 *
 * <ul>
 *   <li>COUNT_BASED 윈도우 N, 최소 호출 N, 실패율 100% → 최근 N 회 연속 실패 시 Open
 *   <li>HalfOpen 허용 호출 1 회 (시험 호출)
 *   <li>Open 대기 시간은 재오픈마다 2 배 (initial-open-duration ~ max-open-duration)
 *   <li>{@link CircuitBreakerIgnoreMarker} 예외는 집계하지 않음
 * </ul>
 *
 * <h4>허가 세대</h4>
 *
 * <p>상태가 바뀔 때마다 세대가 증가하고, 허가는 발급 시점의 세대를 기억합니다. HalfOpen 에서 이전 세대 허가의 결과(Open 이전에 시작된 느린
 * 호출)는 버립니다. 그렇지 않으면 늦게 끝난 호출이 시험 호출의 결과로 집계되어 시험 호출의 성공이 유실됩니다.
 *
 * <p>CircuitBreaker 호출과 부가 정보 갱신은 인스턴스 모니터로 직렬화됩니다. 상태 전이 이벤트는 전이를 일으킨 스레드에서 동기적으로 전달되므로
 * 같은 모니터 안에서 처리됩니다.
 */
@Slf4j
public class EndpointCircuit {

  // 지연은 시도별 타임아웃이 다루므로 느린 호출 비율은 집계하지 않음
  private static final Duration SLOW_CALL_DISABLED = ChronoUnit.DAYS.getDuration();

  /** 호출 허가 (발급 세대 + 시작 시각) */
  public record Permit(long generation, long startedAt) {}

  private final String endpointId;
  private final CircuitBreaker breaker;
  private final IntervalFunction openInterval;
  private final Clock clock;
  private final BiConsumer<String, CircuitStatus> transitionListener;

  private long generation;
  private int consecutiveFailures;
  private int openAttempts;
  private Instant lastFailureAt;
  private Instant nextRetryAt;

  public EndpointCircuit(
      CircuitBreaker breaker,
      IntervalFunction openInterval,
      Clock clock,
      BiConsumer<String, CircuitStatus> transitionListener) {
    this.endpointId = breaker.getName();
    this.breaker = breaker;
    this.openInterval = openInterval;
    this.clock = clock;
    this.transitionListener = transitionListener;
    this.breaker
        .getEventPublisher()
        .onStateTransition(
            event ->
                onTransition(
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()));
  }

  /** 재오픈마다 2 배로 늘어나는 Open 대기 시간 */
  public static IntervalFunction openInterval(ReliabilityProperties properties) {
    return IntervalFunction.ofExponentialBackoff(
        properties.initialOpenDuration().toMillis(), 2.0, properties.maxOpenDuration().toMillis());
  }

  public static CircuitBreakerConfig circuitBreakerConfig(
      ReliabilityProperties properties, Clock clock) {
    return CircuitBreakerConfig.custom()
        .slidingWindowType(SlidingWindowType.COUNT_BASED)
        .slidingWindowSize(properties.failureThreshold())
        .minimumNumberOfCalls(properties.failureThreshold())
        .failureRateThreshold(100)
        .permittedNumberOfCallsInHalfOpenState(1)
        .waitIntervalFunctionInOpenState(openInterval(properties))
        .slowCallDurationThreshold(SLOW_CALL_DISABLED)
        .recordException(t -> !(t instanceof CircuitBreakerIgnoreMarker))
        .ignoreException(t -> t instanceof CircuitBreakerIgnoreMarker)
        .clock(clock)
        .build();
  }

  /**
   * 호출 허가 획득
   *
   * @throws CircuitOpenException Open 상태이거나 HalfOpen 시험 호출이 이미 진행 중인 경우
   */
  public synchronized Permit acquire() {
    try {
      breaker.acquirePermission();
    } catch (CallNotPermittedException e) {
      throw new CircuitOpenException(endpointId, nextRetryAt);
    }
    return new Permit(generation, breaker.getCurrentTimestamp());
  }

  public synchronized void onSuccess(Permit permit) {
    if (isStale(permit)) {
      return;
    }
    breaker.onSuccess(elapsed(permit), breaker.getTimestampUnit());
    consecutiveFailures = 0;
  }

  /** 실패 결과 보고. IgnoreMarker 예외는 HalfOpen 시험 호출 슬롯만 반납됩니다. */
  public synchronized void onFailure(Permit permit, Throwable failure) {
    if (isStale(permit)) {
      return;
    }
    if (!(failure instanceof CircuitBreakerIgnoreMarker)) {
      consecutiveFailures++;
      lastFailureAt = clock.instant();
    }
    breaker.onError(elapsed(permit), breaker.getTimestampUnit(), failure);
  }

  /** 결과 없이 끝난 호출 (Error 전파 등). 허가만 반납합니다. */
  public synchronized void release(Permit permit) {
    if (isStale(permit)) {
      return;
    }
    breaker.releasePermission();
  }

  public synchronized void reset() {
    breaker.reset();
    generation++;
    consecutiveFailures = 0;
    openAttempts = 0;
    lastFailureAt = null;
    nextRetryAt = null;
  }

  public synchronized CircuitState snapshot() {
    CircuitStatus status = toStatus(breaker.getState());
    int nextAttempt = status == CircuitStatus.OPEN ? openAttempts : openAttempts + 1;
    return new CircuitState(
        endpointId,
        status,
        consecutiveFailures,
        lastFailureAt,
        nextRetryAt,
        Duration.ofMillis(openInterval.apply(Math.max(nextAttempt, 1))));
  }

  private boolean isStale(Permit permit) {
    if (breaker.getState() == CircuitBreaker.State.HALF_OPEN && permit.generation() != generation) {
      log.debug("[Circuit] {} HalfOpen 이전에 허가된 호출의 결과는 무시", endpointId);
      return true;
    }
    return false;
  }

  private long elapsed(Permit permit) {
    return Math.max(0, breaker.getCurrentTimestamp() - permit.startedAt());
  }

  private void onTransition(CircuitBreaker.State from, CircuitBreaker.State to) {
    generation++;
    CircuitStatus next = toStatus(to);
    switch (next) {
      case OPEN -> {
        openAttempts++;
        nextRetryAt = clock.instant().plusMillis(openInterval.apply(openAttempts));
      }
      case CLOSED -> {
        openAttempts = 0;
        nextRetryAt = null;
        consecutiveFailures = 0;
      }
      case HALF_OPEN -> {}
    }
    if (next == CircuitStatus.CLOSED) {
      log.info("[Circuit] {} 상태 전이 {} → {}", endpointId, from, to);
    } else {
      log.warn(
          "[Circuit] {} 상태 전이 {} → {} (failures: {}, nextRetryAt: {})",
          endpointId,
          from,
          to,
          consecutiveFailures,
          nextRetryAt);
    }
    transitionListener.accept(endpointId, next);
  }

  private static CircuitStatus toStatus(CircuitBreaker.State state) {
    return switch (state) {
      case OPEN, FORCED_OPEN -> CircuitStatus.OPEN;
      case HALF_OPEN -> CircuitStatus.HALF_OPEN;
      default -> CircuitStatus.CLOSED;
    };
  }
}
