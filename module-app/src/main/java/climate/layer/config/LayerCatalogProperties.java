package climate.layer.config;

import climate.layer.domain.model.layer.LayerKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 레이어 카탈로그 설정 (layerId → 레이어 정의)
 *
 * <pre>{@code
 * layer:
 *   catalog:
 *     temperature:
 *       endpoint: earth-engine
 *       route: /api/climate/temperature-projection
 *       kind: feature
 *       ttl: 60m               # 생략 시 종류별 기본값 (tile 10m, feature 60m)
 *       attempt-timeout: 60s   # 생략 시 layer.resilience.default-attempt-timeout
 *       allow-fallback-data: true
 *       stale-on-error: true
 * }</pre>
 *
 * @see climate.layer.service.layer.LayerCatalog
 */
@Validated
@ConfigurationProperties(prefix = "layer")
public record LayerCatalogProperties(@DefaultValue Map<String, @Valid LayerEntry> catalog) {

  public record LayerEntry(
      String endpoint,
      String route,
      @NotNull LayerKind kind,
      Duration ttl,
      Duration attemptTimeout,
      @DefaultValue("true") boolean allowFallbackData,
      @DefaultValue("true") boolean staleOnError) {}
}
