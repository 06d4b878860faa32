package climate.layer.service.layer;

import climate.layer.config.LayerCatalogProperties;
import climate.layer.config.LayerCatalogProperties.LayerEntry;
import climate.layer.domain.model.layer.LayerDefinition;
import climate.layer.domain.model.layer.LayerKind;
import climate.layer.error.exception.UnknownLayerException;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * 레이어 정의 조회
 *
 * <p>설정에서 누락된 값은 종류별 기본값으로 채웁니다: TILE 10분, FEATURE 60분, 시도별 타임아웃은 신뢰성 설정의 기본값.
 */
@Slf4j
public class LayerCatalog {

  static final Duration TILE_TTL = Duration.ofMinutes(10);
  static final Duration FEATURE_TTL = Duration.ofMinutes(60);

  private final Map<String, LayerDefinition> definitions;

  public LayerCatalog(
      LayerCatalogProperties properties, Duration defaultTtl, Duration defaultAttemptTimeout) {
    Map<String, LayerDefinition> built = new LinkedHashMap<>();
    properties
        .catalog()
        .forEach(
            (layerId, entry) ->
                built.put(
                    layerId, toDefinition(layerId, entry, defaultTtl, defaultAttemptTimeout)));
    this.definitions = Collections.unmodifiableMap(built);
    log.info("[LayerCatalog] 레이어 {}개 등록: {}", definitions.size(), definitions.keySet());
  }

  private static LayerDefinition toDefinition(
      String layerId, LayerEntry entry, Duration defaultTtl, Duration defaultAttemptTimeout) {
    LayerKind kind = entry.kind();
    Duration ttl = entry.ttl() != null ? entry.ttl() : defaultTtlFor(kind, defaultTtl);
    if (kind == LayerKind.LOCAL) {
      return new LayerDefinition(
          layerId, null, null, kind, ttl, null, entry.allowFallbackData(), entry.staleOnError());
    }
    if (entry.endpoint() == null || entry.route() == null) {
      throw new IllegalArgumentException(
          "layer.catalog." + layerId + " requires both endpoint and route");
    }
    Duration attemptTimeout =
        entry.attemptTimeout() != null ? entry.attemptTimeout() : defaultAttemptTimeout;
    return new LayerDefinition(
        layerId,
        entry.endpoint(),
        entry.route(),
        kind,
        ttl,
        attemptTimeout,
        entry.allowFallbackData(),
        entry.staleOnError());
  }

  private static Duration defaultTtlFor(LayerKind kind, Duration fallback) {
    return switch (kind) {
      case TILE -> TILE_TTL;
      case FEATURE -> FEATURE_TTL;
      case LOCAL -> fallback;
    };
  }

  /**
   * @throws UnknownLayerException 등록되지 않은 레이어
   */
  public LayerDefinition require(String layerId) {
    LayerDefinition definition = definitions.get(layerId);
    if (definition == null) {
      throw new UnknownLayerException(layerId);
    }
    return definition;
  }

  public Optional<LayerDefinition> find(String layerId) {
    return Optional.ofNullable(definitions.get(layerId));
  }

  public String endpointFor(String layerId) {
    return require(layerId).endpointId();
  }

  public Collection<LayerDefinition> all() {
    return definitions.values();
  }
}
