package climate.layer.config;

import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 뷰포트 변경 시 재요청 임계값
 *
 * <pre>{@code
 * layer:
 *   viewport:
 *     min-zoom-delta: 0.5
 *     min-center-delta-degrees: 0.01
 * }</pre>
 */
@Validated
@ConfigurationProperties(prefix = "layer.viewport")
public record ViewportProperties(
    @DefaultValue("0.5") @PositiveOrZero double minZoomDelta,
    @DefaultValue("0.01") @PositiveOrZero double minCenterDeltaDegrees) {}
