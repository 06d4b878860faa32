package climate.layer.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import climate.layer.controller.dto.UpstreamHealthResponse;
import climate.layer.domain.model.cache.SourceKind;
import climate.layer.domain.model.circuit.CircuitState;
import climate.layer.domain.model.circuit.CircuitStatus;
import climate.layer.domain.model.layer.LayerError;
import climate.layer.domain.model.layer.LayerErrorType;
import climate.layer.domain.model.layer.LayerState;
import climate.layer.domain.model.layer.LayerStatus;
import climate.layer.domain.model.layer.LayerStatusSummary;
import climate.layer.domain.model.session.Viewport;
import climate.layer.error.exception.InvalidSnapshotException;
import climate.layer.global.error.GlobalExceptionHandler;
import climate.layer.global.response.ApiResponse;
import climate.layer.service.health.HealthCheckResult;
import climate.layer.service.health.UpstreamHealthMonitor;
import climate.layer.service.layer.LayerOrchestrator;
import climate.layer.service.layer.LayerRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * LayerController 단위 테스트
 *
 * <p>Spring Context 없이 MockMvc 로 요청 매핑과 예외 응답을 검증합니다. 비동기 엔드포인트는 컨트롤러를 직접 호출합니다.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
@DisplayName("LayerController 단위 테스트")
class LayerControllerTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  @Mock private LayerOrchestrator orchestrator;
  @Mock private UpstreamHealthMonitor healthMonitor;

  private LayerController controller;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    controller = new LayerController(orchestrator, healthMonitor);
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  private static LayerState success(String layerId) {
    return new LayerState(
        layerId,
        LayerStatus.SUCCESS,
        SourceKind.REAL,
        null,
        Map.of("cached", true),
        NOW,
        "key",
        "{}");
  }

  @Nested
  @DisplayName("레이어 조회")
  class LayerQueries {

    @Test
    @DisplayName("최신 상태 조회 → 200 + ApiResponse")
    void getState() throws Exception {
      given(orchestrator.getLatestState("temperature")).willReturn(success("temperature"));

      mockMvc
          .perform(get("/api/v1/layers/temperature/state"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.success").value(true))
          .andExpect(jsonPath("$.data.status").value("SUCCESS"))
          .andExpect(jsonPath("$.data.dataSource").value("REAL"))
          .andExpect(jsonPath("$.data.metadata.cached").value(true));
    }

    @Test
    @DisplayName("레이어 오류는 요청 오류가 아니다 → 200 + success=true + lastError, 직전 데이터 유지")
    void layerErrorIsReportedInsideState() throws Exception {
      LayerState failed =
          new LayerState(
              "temperature",
              LayerStatus.ERROR,
              SourceKind.REAL,
              new LayerError(LayerErrorType.CIRCUIT_OPEN, "earth-engine circuit open", null),
              Map.of(),
              NOW,
              "key",
              "{\"stale\":true}");
      given(orchestrator.getLatestState("temperature")).willReturn(failed);

      mockMvc
          .perform(get("/api/v1/layers/temperature/state"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.success").value(true))
          .andExpect(jsonPath("$.error").doesNotExist())
          .andExpect(jsonPath("$.data.status").value("ERROR"))
          .andExpect(jsonPath("$.data.lastError.type").value("CIRCUIT_OPEN"))
          .andExpect(jsonPath("$.data.data").value("{\"stale\":true}"));
    }

    @Test
    @DisplayName("요약 조회")
    void getSummary() throws Exception {
      given(orchestrator.getSummary()).willReturn(new LayerStatusSummary(3, 1, 0, 2));

      mockMvc
          .perform(get("/api/v1/layers/summary"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.data.totalLayers").value(3))
          .andExpect(jsonPath("$.data.layersWithFallback").value(1));
    }

    @Test
    @DisplayName("레이어 reset 후 Idle 상태 반환")
    void resetLayer() throws Exception {
      given(orchestrator.getLatestState("temperature"))
          .willReturn(LayerState.idle("temperature", NOW));

      mockMvc
          .perform(post("/api/v1/layers/temperature/reset"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.data.status").value("IDLE"));
      verify(orchestrator).resetLayer("temperature");
    }
  }

  @Nested
  @DisplayName("비동기 요청")
  class AsyncRequests {

    @Test
    @DisplayName("fetch 는 force 와 params 를 그대로 전달")
    void fetchLayer() {
      Map<String, Object> params = Map.of("year", 2050, "scenario", "ssp245");
      given(orchestrator.fetchLayerAsync("temperature", params, true))
          .willReturn(CompletableFuture.completedFuture(success("temperature")));

      ResponseEntity<ApiResponse<LayerState>> response =
          controller.fetchLayer("temperature", true, params).join();

      assertThat(response.getStatusCode().value()).isEqualTo(200);
      assertThat(response.getBody().data().status()).isEqualTo(LayerStatus.SUCCESS);
    }

    @Test
    @DisplayName("enabled 동기화 결과를 레이어별로 반환")
    void syncEnabled() {
      List<LayerRequest> layers = List.of(LayerRequest.of("temperature", Map.of("year", 2050)));
      given(orchestrator.syncEnabledLayers(layers))
          .willReturn(Map.of("temperature", success("temperature")));

      ResponseEntity<ApiResponse<Map<String, LayerState>>> response =
          controller.syncEnabled(layers).join();

      assertThat(response.getBody().success()).isTrue();
      assertThat(response.getBody().data()).containsOnlyKeys("temperature");
    }
  }

  @Nested
  @DisplayName("뷰포트와 세션")
  class ViewportAndSession {

    @Test
    @DisplayName("뷰포트 갱신 → refetch 여부 반환")
    void updateViewport() throws Exception {
      given(orchestrator.updateViewport(eq("main"), any(Viewport.class))).willReturn(true);

      mockMvc
          .perform(
              put("/api/v1/layers/viewport/main")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      "{\"longitude\":-73.6,\"latitude\":40.7,\"zoom\":9,"
                          + "\"pitch\":0,\"bearing\":0}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.data.refetch").value(true));
    }

    @Test
    @DisplayName("잘못된 JSON 본문 → 400 + C001")
    void malformedBody() throws Exception {
      mockMvc
          .perform(
              put("/api/v1/layers/viewport/main")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{not json"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("C001"));
    }

    @Test
    @DisplayName("스냅샷 내보내기는 JSON 바이트를 그대로 반환")
    void exportSession() throws Exception {
      byte[] snapshot = "{\"version\":\"2.0.0\"}".getBytes(StandardCharsets.UTF_8);
      given(orchestrator.exportSnapshot()).willReturn(snapshot);

      mockMvc
          .perform(get("/api/v1/layers/session/export"))
          .andExpect(status().isOk())
          .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
          .andExpect(content().bytes(snapshot));
    }

    @Test
    @DisplayName("해석할 수 없는 스냅샷 가져오기 → 400 + C003")
    void importInvalidSnapshot() throws Exception {
      willThrow(new InvalidSnapshotException("not a snapshot"))
          .given(orchestrator)
          .importSnapshot(any());

      mockMvc
          .perform(
              post("/api/v1/layers/session/import")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("[1,2,3]"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("C003"));
    }

    @Test
    @DisplayName("전체 초기화")
    void clearAll() throws Exception {
      mockMvc
          .perform(delete("/api/v1/layers"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.success").value(true));
      verify(orchestrator).clearAll();
    }
  }

  @Nested
  @DisplayName("업스트림 관리")
  class UpstreamAdministration {

    @Test
    @DisplayName("서킷 상태 목록")
    void circuits() throws Exception {
      CircuitState open =
          new CircuitState(
              "earth-engine",
              CircuitStatus.OPEN,
              5,
              NOW,
              NOW.plusSeconds(5),
              Duration.ofSeconds(5));
      given(orchestrator.getCircuitStates()).willReturn(Map.of("earth-engine", open));

      mockMvc
          .perform(get("/api/v1/layers/circuits"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.data['earth-engine'].state").value("OPEN"))
          .andExpect(jsonPath("$.data['earth-engine'].consecutiveFailures").value(5));
    }

    @Test
    @DisplayName("서킷 수동 리셋")
    void resetCircuit() throws Exception {
      given(orchestrator.getCircuitState("earth-engine"))
          .willReturn(
              new CircuitState(
                  "earth-engine", CircuitStatus.CLOSED, 0, null, null, Duration.ofSeconds(5)));

      mockMvc
          .perform(post("/api/v1/layers/circuits/earth-engine/reset"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.data.state").value("CLOSED"));
      verify(orchestrator).resetCircuit("earth-engine");
    }

    @Test
    @DisplayName("첫 헬스 체크 전에는 healthy=true, lastCheck 없음")
    void upstreamHealth_beforeFirstProbe() {
      given(healthMonitor.isUpstreamHealthy()).willReturn(true);
      given(healthMonitor.getLastResult()).willReturn(Optional.empty());

      UpstreamHealthResponse body = controller.getUpstreamHealth().getBody().data();

      assertThat(body.healthy()).isTrue();
      assertThat(body.lastCheck()).isNull();
    }

    @Test
    @DisplayName("헬스 체크 결과 포함")
    void upstreamHealth_withResult() throws Exception {
      given(healthMonitor.isUpstreamHealthy()).willReturn(false);
      given(healthMonitor.getLastResult())
          .willReturn(Optional.of(new HealthCheckResult(false, 12, NOW, "connection refused")));

      mockMvc
          .perform(get("/api/v1/layers/health/upstream"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.data.healthy").value(false))
          .andExpect(jsonPath("$.data.lastCheck.error").value("connection refused"));
    }

    @Test
    @DisplayName("예상하지 못한 예외 → 500 + S001, 상세 메시지는 노출하지 않음")
    void unexpectedFailure() throws Exception {
      given(orchestrator.getSummary()).willThrow(new IllegalStateException("secret detail"));

      mockMvc
          .perform(get("/api/v1/layers/summary"))
          .andExpect(status().isInternalServerError())
          .andExpect(jsonPath("$.code").value("S001"))
          .andExpect(
              result ->
                  assertThat(result.getResponse().getContentAsString())
                      .doesNotContain("secret detail"));
    }
  }
}
