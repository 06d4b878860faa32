package climate.layer.error.exception;

import climate.layer.error.CommonErrorCode;
import climate.layer.error.exception.base.ServerBaseException;
import climate.layer.error.exception.marker.CircuitBreakerRecordMarker;
import java.time.Duration;
import lombok.Getter;

/** 시도 단위 데드라인 초과 (재시도 대상) */
@Getter
public class UpstreamTimeoutException extends ServerBaseException
    implements CircuitBreakerRecordMarker {

  private final String endpointId;
  private final Duration timeout;

  public UpstreamTimeoutException(String endpointId, Duration timeout) {
    super(CommonErrorCode.UPSTREAM_TIMEOUT, endpointId, timeout);
    this.endpointId = endpointId;
    this.timeout = timeout;
  }

  public UpstreamTimeoutException(String endpointId, Duration timeout, Throwable cause) {
    super(CommonErrorCode.UPSTREAM_TIMEOUT, cause, endpointId, timeout);
    this.endpointId = endpointId;
    this.timeout = timeout;
  }
}
