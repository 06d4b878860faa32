package climate.layer.error.exception;

import climate.layer.error.CommonErrorCode;
import climate.layer.error.exception.base.ClientBaseException;
import climate.layer.error.exception.marker.CircuitBreakerRecordMarker;
import lombok.Getter;

/** 업스트림이 요청 파라미터를 거부한 4xx 응답 (재시도하지 않음) */
@Getter
public class UpstreamValidationException extends ClientBaseException
    implements CircuitBreakerRecordMarker {

  private final int status;
  private final String body;

  public UpstreamValidationException(int status, String body) {
    super(CommonErrorCode.UPSTREAM_VALIDATION_FAILED, status);
    this.status = status;
    this.body = body;
  }
}
