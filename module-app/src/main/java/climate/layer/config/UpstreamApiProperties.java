package climate.layer.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 업스트림 계산 서비스 연결 설정
 *
 * <p>시도별 응답 데드라인은 레이어 카탈로그(attempt-timeout)가 결정하므로 여기서는 연결 타임아웃만 둡니다.
 *
 * <pre>{@code
 * layer:
 *   upstream:
 *     base-url: http://localhost:3001
 *     connect-timeout: 3s
 *     health-path: /health
 *     health-interval: PT30S   # @Scheduled 가 함께 읽으므로 ISO-8601
 *     health-timeout: 5s
 *     health-stale-after: 2m
 * }</pre>
 */
@Validated
@ConfigurationProperties(prefix = "layer.upstream")
public record UpstreamApiProperties(
    @DefaultValue("http://localhost:3001") @NotBlank String baseUrl,
    @DefaultValue("3s") Duration connectTimeout,
    @DefaultValue("/health") String healthPath,
    @DefaultValue("PT30S") Duration healthInterval,
    @DefaultValue("5s") Duration healthTimeout,
    @DefaultValue("2m") Duration healthStaleAfter) {}
