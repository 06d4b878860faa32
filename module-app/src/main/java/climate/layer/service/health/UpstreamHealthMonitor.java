package climate.layer.service.health;

import climate.layer.application.port.UpstreamHealthPort;
import climate.layer.infrastructure.executor.LogicExecutor;
import climate.layer.infrastructure.executor.TaskContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * 업스트림 헬스 모니터
 *
 * <p>주기적으로 헬스 엔드포인트를 호출해 마지막 결과를 보관합니다. 서킷 브레이커와는 독립적이며, 헬스 체크 실패가 서킷 실패로 집계되지
 * 않습니다.
 *
 * <ul>
 *   <li>첫 체크 전에는 정상으로 간주 (낙관적)
 *   <li>마지막 결과가 health-stale-after 보다 오래되면 비정상으로 간주
 * </ul>
 */
@Slf4j
public class UpstreamHealthMonitor {

  private final UpstreamHealthPort upstream;
  private final LogicExecutor executor;
  private final Clock clock;
  private final Duration probeTimeout;
  private final Duration staleAfter;

  private final AtomicReference<HealthCheckResult> lastResult = new AtomicReference<>();

  public UpstreamHealthMonitor(
      UpstreamHealthPort upstream,
      LogicExecutor executor,
      Clock clock,
      Duration probeTimeout,
      Duration staleAfter) {
    this.upstream = upstream;
    this.executor = executor;
    this.clock = clock;
    this.probeTimeout = probeTimeout;
    this.staleAfter = staleAfter;
  }

  @Scheduled(
      fixedDelayString = "${layer.upstream.health-interval:PT30S}",
      initialDelayString = "${layer.upstream.health-initial-delay:PT1S}")
  public void scheduledCheck() {
    check();
  }

  /** 헬스 엔드포인트를 한 번 호출하고 결과를 기록 */
  public HealthCheckResult check() {
    Instant startedAt = clock.instant();
    HealthCheckResult result =
        executor.executeOrCatch(
            () -> {
              upstream.ping(probeTimeout);
              return new HealthCheckResult(true, elapsedMs(startedAt), clock.instant(), null);
            },
            e -> new HealthCheckResult(false, elapsedMs(startedAt), clock.instant(), describe(e)),
            TaskContext.of("UpstreamHealth", "Ping"));

    HealthCheckResult previous = lastResult.getAndSet(result);
    if (previous == null || previous.healthy() != result.healthy()) {
      if (result.healthy()) {
        log.info("[UpstreamHealth] 업스트림 정상 (latency: {}ms)", result.latencyMs());
      } else {
        log.warn("[UpstreamHealth] 업스트림 비정상: {}", result.error());
      }
    }
    return result;
  }

  public boolean isUpstreamHealthy() {
    HealthCheckResult result = lastResult.get();
    if (result == null) {
      return true;
    }
    if (Duration.between(result.timestamp(), clock.instant()).compareTo(staleAfter) > 0) {
      return false;
    }
    return result.healthy();
  }

  public Optional<HealthCheckResult> getLastResult() {
    return Optional.ofNullable(lastResult.get());
  }

  private long elapsedMs(Instant startedAt) {
    return Duration.between(startedAt, clock.instant()).toMillis();
  }

  private static String describe(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
