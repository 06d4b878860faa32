package climate.layer.error.exception;

import climate.layer.error.CommonErrorCode;
import climate.layer.error.exception.base.ClientBaseException;
import climate.layer.error.exception.marker.CircuitBreakerIgnoreMarker;

/** 같은 레이어에 대한 더 최신 요청이 진행 중인 요청을 대체(취소)한 경우 */
public class RequestSupersededException extends ClientBaseException
    implements CircuitBreakerIgnoreMarker {

  public RequestSupersededException(String key) {
    super(CommonErrorCode.REQUEST_SUPERSEDED, key);
  }
}
