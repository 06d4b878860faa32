package climate.layer.service.layer;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/**
 * 활성화할 레이어 한 건 (동기화 요청 단위)
 *
 * @param opacity 생략 시 1.0
 */
public record LayerRequest(
    @NotBlank String layerId,
    Map<String, Object> params,
    @DecimalMin("0.0") @DecimalMax("1.0") Double opacity) {

  public LayerRequest {
    params = params == null ? Map.of() : params;
    opacity = opacity == null ? 1.0 : opacity;
  }

  public static LayerRequest of(String layerId, Map<String, Object> params) {
    return new LayerRequest(layerId, params, 1.0);
  }
}
