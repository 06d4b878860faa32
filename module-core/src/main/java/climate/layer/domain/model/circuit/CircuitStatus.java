package climate.layer.domain.model.circuit;

public enum CircuitStatus {
  CLOSED,
  OPEN,
  HALF_OPEN
}
