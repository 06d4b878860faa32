package climate.layer.service.layer;

import climate.layer.domain.model.layer.LayerError;
import climate.layer.domain.model.layer.LayerErrorType;
import climate.layer.error.exception.CircuitOpenException;
import climate.layer.error.exception.InvalidInputException;
import climate.layer.error.exception.RequestSupersededException;
import climate.layer.error.exception.TransientNetworkException;
import climate.layer.error.exception.UnknownLayerException;
import climate.layer.error.exception.UpstreamErrorException;
import climate.layer.error.exception.UpstreamTimeoutException;
import climate.layer.error.exception.UpstreamValidationException;
import java.util.concurrent.CancellationException;

/** 실패 원인을 레이어 상태의 lastError 로 변환 */
final class LayerErrorMapper {

  private LayerErrorMapper() {}

  static LayerError from(Throwable cause) {
    String message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
    if (cause instanceof CircuitOpenException) {
      return LayerError.of(LayerErrorType.CIRCUIT_OPEN, message);
    }
    if (cause instanceof UpstreamTimeoutException) {
      return LayerError.of(LayerErrorType.TIMEOUT, message);
    }
    if (cause instanceof UpstreamValidationException e) {
      return new LayerError(LayerErrorType.UPSTREAM_VALIDATION, message, e.getStatus());
    }
    if (cause instanceof InvalidInputException) {
      return LayerError.of(LayerErrorType.UPSTREAM_VALIDATION, message);
    }
    if (cause instanceof UpstreamErrorException e) {
      return new LayerError(
          LayerErrorType.UPSTREAM_ERROR, message, e.getStatus() > 0 ? e.getStatus() : null);
    }
    if (cause instanceof TransientNetworkException) {
      return LayerError.of(LayerErrorType.NETWORK, message);
    }
    if (cause instanceof UnknownLayerException) {
      return LayerError.of(LayerErrorType.UNKNOWN_LAYER, message);
    }
    if (cause instanceof CancellationException || cause instanceof RequestSupersededException) {
      return LayerError.of(LayerErrorType.CANCELLED, message);
    }
    return LayerError.of(LayerErrorType.INTERNAL, message);
  }
}
