package climate.layer.infrastructure.resilience;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 업스트림 호출 신뢰성 설정 (서킷 + 재시도 + 시도별 타임아웃)
 *
 * <h2>설정</h2>
 *
 * <pre>{@code
 * layer:
 *   resilience:
 *     failure-threshold: 5        # 연속 실패 N 회 → Open
 *     initial-open-duration: 5s   # 첫 Open 쿨다운
 *     max-open-duration: 60s      # HalfOpen 시험 호출 실패마다 2배, 이 값이 상한
 *     max-attempts: 5             # 첫 시도 포함
 *     initial-backoff: 500ms
 *     backoff-multiplier: 2.0
 *     jitter: 0.3                 # ±30% 무작위화
 *     max-backoff: 30s
 *     default-attempt-timeout: 60s
 * }</pre>
 */
@ConfigurationProperties(prefix = "layer.resilience")
public record ReliabilityProperties(
    @DefaultValue("5") int failureThreshold,
    @DefaultValue("5s") Duration initialOpenDuration,
    @DefaultValue("60s") Duration maxOpenDuration,
    @DefaultValue("5") int maxAttempts,
    @DefaultValue("500ms") Duration initialBackoff,
    @DefaultValue("2.0") double backoffMultiplier,
    @DefaultValue("0.3") double jitter,
    @DefaultValue("30s") Duration maxBackoff,
    @DefaultValue("60s") Duration defaultAttemptTimeout) {

  public ReliabilityProperties {
    if (failureThreshold <= 0) {
      throw new IllegalArgumentException(
          "layer.resilience.failure-threshold must be positive, got: " + failureThreshold);
    }
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException(
          "layer.resilience.max-attempts must be positive, got: " + maxAttempts);
    }
    if (maxOpenDuration.compareTo(initialOpenDuration) < 0) {
      throw new IllegalArgumentException("max-open-duration must be >= initial-open-duration");
    }
    if (jitter < 0 || jitter >= 1) {
      throw new IllegalArgumentException("jitter must be within [0, 1), got: " + jitter);
    }
    if (backoffMultiplier < 1) {
      throw new IllegalArgumentException("backoff-multiplier must be >= 1");
    }
  }

  public static ReliabilityProperties defaults() {
    return new ReliabilityProperties(
        5,
        Duration.ofSeconds(5),
        Duration.ofSeconds(60),
        5,
        Duration.ofMillis(500),
        2.0,
        0.3,
        Duration.ofSeconds(30),
        Duration.ofSeconds(60));
  }
}
