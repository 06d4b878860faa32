package climate.layer.error.exception;

import climate.layer.error.CommonErrorCode;
import climate.layer.error.exception.base.ServerBaseException;
import climate.layer.error.exception.marker.CircuitBreakerRecordMarker;
import lombok.Getter;

/** 연결 거부, 리셋, DNS 실패 등 일시적인 네트워크 오류 (재시도 대상) */
@Getter
public class TransientNetworkException extends ServerBaseException
    implements CircuitBreakerRecordMarker {

  private final String endpointId;

  public TransientNetworkException(String endpointId, Throwable cause) {
    super(CommonErrorCode.UPSTREAM_NETWORK_ERROR, cause, endpointId);
    this.endpointId = endpointId;
  }
}
