package climate.layer.domain.model.layer;

import java.util.Objects;

/**
 * Last failure recorded on a layer.
 *
 * @param httpStatus upstream status when the failure came from an HTTP response, otherwise null
 */
public record LayerError(LayerErrorType type, String message, Integer httpStatus) {

  public LayerError {
    Objects.requireNonNull(type, "type");
    if (message == null) {
      message = "";
    }
  }

  public static LayerError of(LayerErrorType type, String message) {
    return new LayerError(type, message, null);
  }
}
