package climate.layer.error.exception;

import climate.layer.error.CommonErrorCode;
import climate.layer.error.exception.base.ServerBaseException;
import climate.layer.error.exception.marker.CircuitBreakerIgnoreMarker;
import java.time.Instant;
import lombok.Getter;

/** 서킷이 Open(또는 시험 호출 진행 중인 HalfOpen) 상태라 호출을 즉시 거부한 경우 */
@Getter
public class CircuitOpenException extends ServerBaseException
    implements CircuitBreakerIgnoreMarker {

  private final String endpointId;
  private final Instant retryAt;

  public CircuitOpenException(String endpointId, Instant retryAt) {
    super(CommonErrorCode.CIRCUIT_OPEN, endpointId, retryAt);
    this.endpointId = endpointId;
    this.retryAt = retryAt;
  }
}
