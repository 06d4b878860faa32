package climate.layer.controller;

import climate.layer.controller.dto.UpstreamHealthResponse;
import climate.layer.controller.dto.ViewportUpdateResponse;
import climate.layer.domain.event.LayerStatusEvent;
import climate.layer.domain.model.circuit.CircuitState;
import climate.layer.domain.model.layer.LayerDefinition;
import climate.layer.domain.model.layer.LayerState;
import climate.layer.domain.model.layer.LayerStatusSummary;
import climate.layer.domain.model.session.SessionPreferences;
import climate.layer.domain.model.session.SessionSnapshot;
import climate.layer.domain.model.session.Viewport;
import climate.layer.global.response.ApiResponse;
import climate.layer.service.health.UpstreamHealthMonitor;
import climate.layer.service.layer.LayerOrchestrator;
import climate.layer.service.layer.LayerRequest;
import jakarta.validation.Valid;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 레이어 오케스트레이터 REST API
 *
 * <p>레이어 요청 결과는 실패해도 200 으로 응답하며, 실패 원인은 {@code LayerState.lastError} 에 담깁니다. 4xx/5xx 는 요청 자체가
 * 잘못된 경우(스냅샷 형식 오류, 검증 실패)에만 사용합니다.
 */
@Validated
@RestController
@RequestMapping("/api/v1/layers")
@RequiredArgsConstructor
public class LayerController {

  private final LayerOrchestrator orchestrator;
  private final UpstreamHealthMonitor healthMonitor;

  /** 등록된 레이어 정의 목록 */
  @GetMapping
  public ResponseEntity<ApiResponse<Collection<LayerDefinition>>> getCatalog() {
    return ResponseEntity.ok(ApiResponse.success(orchestrator.getLayerDefinitions()));
  }

  /**
   * 레이어 데이터 요청
   *
   * @param force true 면 유효한 캐시가 있어도 업스트림을 다시 호출
   * @param params 레이어 파라미터 (생략 가능)
   */
  @PostMapping("/{layerId}/fetch")
  public CompletableFuture<ResponseEntity<ApiResponse<LayerState>>> fetchLayer(
      @PathVariable String layerId,
      @RequestParam(defaultValue = "false") boolean force,
      @RequestBody(required = false) Map<String, Object> params) {
    return orchestrator
        .fetchLayerAsync(layerId, params, force)
        .thenApply(state -> ResponseEntity.ok(ApiResponse.success(state)));
  }

  @GetMapping("/{layerId}/state")
  public ResponseEntity<ApiResponse<LayerState>> getState(@PathVariable String layerId) {
    return ResponseEntity.ok(ApiResponse.success(orchestrator.getLatestState(layerId)));
  }

  @GetMapping("/{layerId}/history")
  public ResponseEntity<ApiResponse<List<LayerStatusEvent>>> getHistory(
      @PathVariable String layerId) {
    return ResponseEntity.ok(ApiResponse.success(orchestrator.getHistory(layerId)));
  }

  /** 레이어 상태를 Idle 로 되돌림 */
  @PostMapping("/{layerId}/reset")
  public ResponseEntity<ApiResponse<LayerState>> resetLayer(@PathVariable String layerId) {
    orchestrator.resetLayer(layerId);
    return ResponseEntity.ok(ApiResponse.success(orchestrator.getLatestState(layerId)));
  }

  @GetMapping("/summary")
  public ResponseEntity<ApiResponse<LayerStatusSummary>> getSummary() {
    return ResponseEntity.ok(ApiResponse.success(orchestrator.getSummary()));
  }

  /** 활성 레이어 집합 동기화. 새로 켜졌거나 파라미터가 바뀐 레이어만 다시 요청합니다. */
  @PutMapping("/enabled")
  public CompletableFuture<ResponseEntity<ApiResponse<Map<String, LayerState>>>> syncEnabled(
      @RequestBody List<@Valid LayerRequest> layers) {
    return CompletableFuture.supplyAsync(
        () -> ResponseEntity.ok(ApiResponse.success(orchestrator.syncEnabledLayers(layers))));
  }

  @PutMapping("/viewport/{contextId}")
  public ResponseEntity<ApiResponse<ViewportUpdateResponse>> updateViewport(
      @PathVariable String contextId, @RequestBody Viewport viewport) {
    boolean refetch = orchestrator.updateViewport(contextId, viewport);
    return ResponseEntity.ok(ApiResponse.success(new ViewportUpdateResponse(refetch)));
  }

  // ==================== Session ====================

  /** 영속화와 같은 스키마의 스냅샷 JSON */
  @GetMapping(value = "/session/export", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<byte[]> exportSession() {
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_JSON)
        .body(orchestrator.exportSnapshot());
  }

  @PostMapping(value = "/session/import", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ApiResponse<SessionSnapshot>> importSession(@RequestBody byte[] body) {
    return ResponseEntity.ok(ApiResponse.success(orchestrator.importSnapshot(body)));
  }

  @GetMapping("/session/preferences")
  public ResponseEntity<ApiResponse<SessionPreferences>> getPreferences() {
    return ResponseEntity.ok(ApiResponse.success(orchestrator.getPreferences()));
  }

  @PutMapping("/session/preferences")
  public ResponseEntity<ApiResponse<SessionPreferences>> updatePreferences(
      @RequestBody SessionPreferences preferences) {
    orchestrator.updatePreferences(preferences);
    return ResponseEntity.ok(ApiResponse.success(orchestrator.getPreferences()));
  }

  /** 캐시, 세션, 레이어 상태 전체 초기화 */
  @DeleteMapping
  public ResponseEntity<ApiResponse<String>> clearAll() {
    orchestrator.clearAll();
    return ResponseEntity.ok(ApiResponse.success("cleared"));
  }

  // ==================== Upstream ====================

  @GetMapping("/circuits")
  public ResponseEntity<ApiResponse<Map<String, CircuitState>>> getCircuits() {
    return ResponseEntity.ok(ApiResponse.success(orchestrator.getCircuitStates()));
  }

  @PostMapping("/circuits/{endpointId}/reset")
  public ResponseEntity<ApiResponse<CircuitState>> resetCircuit(@PathVariable String endpointId) {
    orchestrator.resetCircuit(endpointId);
    return ResponseEntity.ok(ApiResponse.success(orchestrator.getCircuitState(endpointId)));
  }

  @GetMapping("/health/upstream")
  public ResponseEntity<ApiResponse<UpstreamHealthResponse>> getUpstreamHealth() {
    UpstreamHealthResponse response =
        new UpstreamHealthResponse(
            healthMonitor.isUpstreamHealthy(), healthMonitor.getLastResult().orElse(null));
    return ResponseEntity.ok(ApiResponse.success(response));
  }
}
