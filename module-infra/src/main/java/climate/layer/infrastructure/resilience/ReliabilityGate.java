package climate.layer.infrastructure.resilience;

import climate.layer.common.function.ThrowingSupplier;
import climate.layer.domain.model.circuit.CircuitState;
import climate.layer.domain.model.circuit.CircuitStatus;
import climate.layer.error.exception.RequestSupersededException;
import climate.layer.error.exception.base.BaseException;
import climate.layer.infrastructure.resilience.EndpointCircuit.Permit;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * 업스트림 호출 신뢰성 게이트
 *
 * <h4>호출 구조</h4>
 *
 * <pre>
 * Resilience4j CircuitBreaker (엔드포인트별, 호출 1건 = 집계 1회)
 *   └─ Resilience4j Retry (지수 백오프 + 지터, 일시적 오류만 재시도)
 *        └─ Resilience4j TimeLimiter (시도별 데드라인)
 *             └─ operation
 * </pre>
 *
 * <p>서킷은 재시도까지 모두 소진한 최종 결과만 집계합니다. Open 서킷은 upstream 을 호출하지 않고 즉시 {@code CircuitOpenException}
 * 을 던지며, 이 예외는 다시 집계되지 않습니다. 모든 실패는 common 모듈의 타입 예외로 정규화되어 전파됩니다.
 *
 * <p>결과는 호출 시작 시 받은 {@link EndpointCircuit.Permit} 으로 보고합니다. HalfOpen 중에 도착한 이전 상태의 결과는 버려집니다.
 */
@Slf4j
public class ReliabilityGate {

  private final ReliabilityProperties properties;
  private final Clock clock;
  private final Executor attemptExecutor;
  private final MeterRegistry meterRegistry;
  private final RetryRegistry retryRegistry;
  private final CircuitBreakerRegistry circuitBreakerRegistry;
  private final IntervalFunction openInterval;

  private final ConcurrentHashMap<String, EndpointCircuit> circuits = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<Duration, TimeLimiter> timeLimiters = new ConcurrentHashMap<>();

  public ReliabilityGate(
      ReliabilityProperties properties,
      Clock clock,
      Executor attemptExecutor,
      MeterRegistry meterRegistry) {
    this.properties = properties;
    this.clock = clock;
    this.attemptExecutor = attemptExecutor;
    this.meterRegistry = meterRegistry;
    this.retryRegistry = RetryRegistry.of(retryConfig(properties));
    this.retryRegistry
        .getEventPublisher()
        .onEntryAdded(event -> attachRetryLogging(event.getAddedEntry()));
    this.circuitBreakerRegistry =
        CircuitBreakerRegistry.of(EndpointCircuit.circuitBreakerConfig(properties, clock));
    this.openInterval = EndpointCircuit.openInterval(properties);
  }

  private static RetryConfig retryConfig(ReliabilityProperties properties) {
    return RetryConfig.custom()
        .maxAttempts(properties.maxAttempts())
        .intervalFunction(
            IntervalFunction.ofExponentialRandomBackoff(
                properties.initialBackoff().toMillis(),
                properties.backoffMultiplier(),
                properties.jitter(),
                properties.maxBackoff().toMillis()))
        .retryOnException(UpstreamFailures::isTransient)
        .build();
  }

  private void attachRetryLogging(Retry retry) {
    Counter retries =
        Counter.builder("layer.gate.retries")
            .tag("endpoint", retry.getName())
            .register(meterRegistry);
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              retries.increment();
              log.warn(
                  "[ReliabilityGate] {} 재시도 #{} ({}ms 후), 원인: {}",
                  event.getName(),
                  event.getNumberOfRetryAttempts(),
                  event.getWaitInterval().toMillis(),
                  String.valueOf(event.getLastThrowable()));
            });
  }

  public <T> T call(String endpointId, Duration attemptTimeout, ThrowingSupplier<T> operation) {
    return call(endpointId, attemptTimeout, () -> false, operation);
  }

  /**
   * 서킷 → 재시도 → 시도별 타임아웃 순으로 operation 을 실행
   *
   * @param attemptTimeout 시도별 데드라인 (null 이면 기본값)
   * @param cancelled 매 시도 직전에 확인하는 취소 신호. true 면 RequestSupersededException 으로 중단
   * @throws BaseException 정규화된 타입 예외 (CircuitOpen, UpstreamTimeout, TransientNetwork,
   *     UpstreamError, UpstreamValidation, RequestSuperseded)
   */
  public <T> T call(
      String endpointId,
      Duration attemptTimeout,
      BooleanSupplier cancelled,
      ThrowingSupplier<T> operation) {
    Duration timeout = attemptTimeout != null ? attemptTimeout : properties.defaultAttemptTimeout();
    EndpointCircuit circuit = circuitFor(endpointId);
    Permit permit = circuit.acquire();

    Retry retry = retryRegistry.retry(endpointId);
    try {
      T result =
          retry.executeCheckedSupplier(() -> attempt(endpointId, timeout, cancelled, operation));
      circuit.onSuccess(permit);
      return result;
    } catch (Error e) {
      circuit.release(permit);
      throw e;
    } catch (Throwable t) {
      BaseException failure = UpstreamFailures.normalize(endpointId, timeout, t);
      circuit.onFailure(permit, failure);
      throw failure;
    }
  }

  private <T> T attempt(
      String endpointId, Duration timeout, BooleanSupplier cancelled, ThrowingSupplier<T> operation)
      throws BaseException {
    if (cancelled.getAsBoolean()) {
      throw new RequestSupersededException(endpointId);
    }
    TimeLimiter limiter = timeLimiters.computeIfAbsent(timeout, ReliabilityGate::newTimeLimiter);
    try {
      return limiter.executeFutureSupplier(
          () -> CompletableFuture.supplyAsync(() -> invoke(operation), attemptExecutor));
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      throw UpstreamFailures.normalize(endpointId, timeout, t);
    }
  }

  private static TimeLimiter newTimeLimiter(Duration timeout) {
    return TimeLimiter.of(
        TimeLimiterConfig.custom().timeoutDuration(timeout).cancelRunningFuture(true).build());
  }

  private static <T> T invoke(ThrowingSupplier<T> operation) {
    try {
      return operation.get();
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new CompletionException(t);
    }
  }

  private EndpointCircuit circuitFor(String endpointId) {
    return circuits.computeIfAbsent(
        endpointId,
        id -> {
          CircuitBreaker breaker = circuitBreakerRegistry.circuitBreaker(id);
          return new EndpointCircuit(breaker, openInterval, clock, this::recordTransition);
        });
  }

  private void recordTransition(String endpointId, CircuitStatus to) {
    Counter.builder("layer.circuit.transitions")
        .tag("endpoint", endpointId)
        .tag("to", to.name())
        .register(meterRegistry)
        .increment();
  }

  public CircuitState getCircuitState(String endpointId) {
    return circuitFor(endpointId).snapshot();
  }

  public Map<String, CircuitState> getAllCircuitStates() {
    Map<String, CircuitState> states = new TreeMap<>();
    circuits.forEach((id, circuit) -> states.put(id, circuit.snapshot()));
    return states;
  }

  public void resetCircuit(String endpointId) {
    EndpointCircuit circuit = circuits.get(endpointId);
    if (circuit != null) {
      circuit.reset();
      log.info("[ReliabilityGate] {} 서킷 수동 리셋", endpointId);
    }
  }

  public void resetAllCircuits() {
    circuits.values().forEach(EndpointCircuit::reset);
    log.info("[ReliabilityGate] 전체 서킷 리셋 ({}개)", circuits.size());
  }
}
