package climate.layer.domain.model.session;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A layer the user has switched on, with the parameters it was last requested with. */
public record EnabledLayer(
    String layerId, Map<String, Object> params, double opacity, Instant enabledAt) {

  public EnabledLayer {
    Objects.requireNonNull(layerId, "layerId");
    params =
        params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    if (opacity < 0 || opacity > 1) {
      throw new IllegalArgumentException("opacity must be within [0, 1]: " + opacity);
    }
  }
}
