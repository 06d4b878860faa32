package climate.layer.controller.dto;

import climate.layer.service.health.HealthCheckResult;

/**
 * @param healthy 판정 결과 (첫 체크 전에는 true, 결과가 오래되면 false)
 * @param lastCheck 마지막 체크 결과, 아직 없으면 null
 */
public record UpstreamHealthResponse(boolean healthy, HealthCheckResult lastCheck) {}
