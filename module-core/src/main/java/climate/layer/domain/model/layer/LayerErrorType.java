package climate.layer.domain.model.layer;

public enum LayerErrorType {
  CIRCUIT_OPEN,
  TIMEOUT,
  UPSTREAM_ERROR,
  UPSTREAM_VALIDATION,
  NETWORK,
  CANCELLED,
  UNKNOWN_LAYER,
  INTERNAL
}
