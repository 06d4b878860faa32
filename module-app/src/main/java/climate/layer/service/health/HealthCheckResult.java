package climate.layer.service.health;

import java.time.Instant;

/**
 * 업스트림 헬스 체크 결과
 *
 * @param error 실패 시 원인 요약, 성공 시 null
 */
public record HealthCheckResult(boolean healthy, long latencyMs, Instant timestamp, String error) {}
