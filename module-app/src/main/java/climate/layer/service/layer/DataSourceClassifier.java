package climate.layer.service.layer;

import climate.layer.domain.model.cache.SourceKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 업스트림 payload 의 데이터 출처 판별
 *
 * <h4>판별 순서</h4>
 *
 * <ol>
 *   <li>{@code metadata.dataSource} (real | fallback | unknown)
 *   <li>{@code metadata.isRealData} (boolean) 또는 {@code metadata.dataType}
 *   <li>그 외에는 UNKNOWN. REAL 로 가정하지 않습니다.
 * </ol>
 *
 * <p>metadata 가 없으면 {@code properties} 를 대신 봅니다 (GeoJSON Feature 단건 응답).
 */
@Slf4j
@RequiredArgsConstructor
public class DataSourceClassifier {

  private final ObjectMapper objectMapper;

  public record Classification(SourceKind sourceKind, Map<String, Object> metadata) {}

  public Classification classify(String layerId, String payload) {
    JsonNode root = parse(layerId, payload);
    JsonNode metadata = root.has("metadata") ? root.path("metadata") : root.path("properties");

    SourceKind kind = declaredKind(metadata);
    if (kind == SourceKind.UNKNOWN) {
      log.warn("[LayerState] {} payload 에 데이터 출처 표시가 없어 UNKNOWN 으로 분류", layerId);
    }
    return new Classification(kind, summarize(root, metadata, kind));
  }

  private JsonNode parse(String layerId, String payload) {
    try {
      JsonNode root = objectMapper.readTree(payload);
      return root != null ? root : objectMapper.missingNode();
    } catch (JsonProcessingException e) {
      log.warn("[LayerState] {} payload 가 JSON 이 아닙니다: {}", layerId, e.getOriginalMessage());
      return objectMapper.missingNode();
    }
  }

  private static SourceKind declaredKind(JsonNode metadata) {
    JsonNode flag = metadata.path("dataSource");
    if (flag.isTextual()) {
      return SourceKind.fromFlag(flag.asText());
    }
    JsonNode isRealData = metadata.path("isRealData");
    if (isRealData.isBoolean()) {
      return isRealData.booleanValue() ? SourceKind.REAL : SourceKind.FALLBACK;
    }
    JsonNode dataType = metadata.path("dataType");
    if (dataType.isTextual()) {
      return SourceKind.fromFlag(dataType.asText());
    }
    return SourceKind.UNKNOWN;
  }

  /** 상태 이벤트에 싣는 요약 메타데이터 (payload 전체는 싣지 않음) */
  private static Map<String, Object> summarize(JsonNode root, JsonNode metadata, SourceKind kind) {
    Map<String, Object> summary = new LinkedHashMap<>();
    JsonNode features = root.path("features");
    if (features.isArray()) {
      summary.put("featureCount", features.size());
    }
    copyText(metadata, "source", summary);
    copyText(metadata, "model", summary);
    copyText(metadata, "scenario", summary);
    if (metadata.path("year").canConvertToInt()) {
      summary.put("year", metadata.path("year").asInt());
    }
    summary.put("isRealData", kind == SourceKind.REAL);
    if (kind == SourceKind.FALLBACK) {
      summary.put("fallbackReason", "upstream returned fallback data instead of real data");
    }
    return summary;
  }

  private static void copyText(JsonNode node, String field, Map<String, Object> target) {
    JsonNode value = node.path(field);
    if (value.isTextual()) {
      target.put(field, value.asText());
    }
  }
}
