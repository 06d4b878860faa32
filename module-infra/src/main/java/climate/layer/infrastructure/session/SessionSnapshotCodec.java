package climate.layer.infrastructure.session;

import climate.layer.domain.model.session.EnabledLayer;
import climate.layer.domain.model.session.SessionPreferences;
import climate.layer.domain.model.session.SessionSnapshot;
import climate.layer.domain.model.session.Viewport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.type.TypeFactory;
import java.io.IOException;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * 세션 스냅샷 JSON 코덱 (영속화와 내보내기 공용 스키마)
 *
 * <h4>버전 처리</h4>
 *
 * <ul>
 *   <li>{@value SessionSnapshot#CURRENT_VERSION}: 그대로 역직렬화
 *   <li>1.0.0: layerStates / viewPreferences / lastActiveView 구조를 현재 스키마로 변환
 *   <li>그 외: 알 수 없는 필드는 무시하고 읽을 수 있는 섹션만 취한 뒤 나머지는 기본값으로 병합
 * </ul>
 */
@Slf4j
public class SessionSnapshotCodec {

  static final String LEGACY_VERSION = "1.0.0";

  private final ObjectMapper objectMapper;

  public SessionSnapshotCodec(ObjectMapper objectMapper) {
    this.objectMapper =
        objectMapper
            .copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true);
  }

  public byte[] encode(SessionSnapshot snapshot) throws JsonProcessingException {
    return objectMapper.writeValueAsBytes(snapshot);
  }

  /**
   * @throws IOException JSON 이 아니거나 객체가 아닌 경우, 또는 현재 버전 스키마와 맞지 않는 경우
   */
  public SessionSnapshot decode(byte[] bytes) throws IOException {
    JsonNode root = objectMapper.readTree(bytes);
    if (root == null || !root.isObject()) {
      throw new IOException("session snapshot must be a JSON object");
    }
    String version = root.path("version").asText(null);
    if (SessionSnapshot.CURRENT_VERSION.equals(version)) {
      return objectMapper.treeToValue(root, SessionSnapshot.class).normalize();
    }
    log.info(
        "[SessionMemory] 스냅샷 버전 불일치 ({} → {}), 마이그레이션 수행",
        version,
        SessionSnapshot.CURRENT_VERSION);
    SessionSnapshot migrated =
        LEGACY_VERSION.equals(version) ? migrateLegacy(root) : migrateBestEffort(root);
    migrated.setVersion(SessionSnapshot.CURRENT_VERSION);
    return migrated.normalize();
  }

  private SessionSnapshot migrateLegacy(JsonNode root) {
    SessionSnapshot snapshot = SessionSnapshot.defaults();

    for (JsonNode layer : root.path("layerStates")) {
      String id = layer.path("id").asText(null);
      if (id == null || !layer.path("enabled").asBoolean(false)) {
        continue;
      }
      double opacity = clampOpacity(layer.path("opacity").asDouble(1.0));
      Instant enabledAt =
          layer.hasNonNull("lastViewed")
              ? Instant.ofEpochMilli(layer.path("lastViewed").asLong())
              : Instant.EPOCH;
      snapshot.putEnabledLayer(new EnabledLayer(id, Map.of(), opacity, enabledAt));
    }

    Iterator<Map.Entry<String, JsonNode>> views = root.path("viewPreferences").fields();
    while (views.hasNext()) {
      Map.Entry<String, JsonNode> view = views.next();
      JsonNode value = view.getValue();
      JsonNode center = value.path("center");
      snapshot
          .getViewportByContext()
          .put(
              view.getKey(),
              new Viewport(
                  center.path(0).asDouble(0),
                  center.path(1).asDouble(0),
                  value.path("zoom").asDouble(0),
                  value.path("pitch").asDouble(0),
                  value.path("bearing").asDouble(0)));
    }

    snapshot.setLastActiveContext(root.path("lastActiveView").asText(null));

    JsonNode prefs = root.path("preferences");
    SessionPreferences defaults = SessionPreferences.defaults();
    snapshot.setPreferences(
        new SessionPreferences(
            prefs.path("autoRestoreSession").asBoolean(defaults.autoRestore()),
            prefs.path("rememberLayerStates").asBoolean(defaults.rememberLayers()),
            prefs.path("rememberViewport").asBoolean(defaults.rememberViewport())));
    return snapshot;
  }

  private SessionSnapshot migrateBestEffort(JsonNode root) {
    SessionSnapshot snapshot = SessionSnapshot.defaults();
    TypeFactory types = objectMapper.getTypeFactory();
    JavaType layerList = types.constructCollectionType(List.class, EnabledLayer.class);
    JavaType viewportMap = types.constructMapType(Map.class, String.class, Viewport.class);

    readSection(
        root,
        "enabledLayers",
        node -> snapshot.setEnabledLayers(objectMapper.convertValue(node, layerList)));
    readSection(
        root,
        "viewportByContext",
        node -> snapshot.setViewportByContext(objectMapper.convertValue(node, viewportMap)));
    readSection(
        root,
        "preferences",
        node -> snapshot.setPreferences(objectMapper.convertValue(node, SessionPreferences.class)));
    readSection(root, "lastActiveContext", node -> snapshot.setLastActiveContext(node.asText()));
    return snapshot;
  }

  private void readSection(JsonNode root, String field, Consumer<JsonNode> reader) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull()) {
      return;
    }
    try {
      reader.accept(node);
    } catch (IllegalArgumentException e) {
      log.warn("[SessionMemory] 마이그레이션 중 '{}' 섹션을 읽을 수 없어 기본값 사용: {}", field, e.getMessage());
    }
  }

  private static double clampOpacity(double opacity) {
    return Math.max(0, Math.min(1, opacity));
  }
}
