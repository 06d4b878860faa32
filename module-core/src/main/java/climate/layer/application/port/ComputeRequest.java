package climate.layer.application.port;

import java.time.Duration;
import java.util.Map;

/**
 * One upstream compute call.
 *
 * @param deadline upper bound for this single attempt
 */
public record ComputeRequest(
    String layerId, String route, Map<String, Object> params, Duration deadline) {

  public ComputeRequest {
    params = params == null ? Map.of() : params;
  }
}
