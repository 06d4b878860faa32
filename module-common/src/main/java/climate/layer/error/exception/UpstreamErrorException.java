package climate.layer.error.exception;

import climate.layer.error.CommonErrorCode;
import climate.layer.error.exception.base.ServerBaseException;
import climate.layer.error.exception.marker.CircuitBreakerRecordMarker;
import lombok.Getter;

/**
 * 업스트림이 오류 응답을 돌려준 경우.
 *
 * <p>5xx, 408, 429 는 일시적 오류로 보고 재시도합니다. status 0 은 HTTP 상태가 없는 응답 처리 실패(빈 본문, 디코딩 오류 등)를 뜻하며
 * 재시도하지 않습니다.
 */
@Getter
public class UpstreamErrorException extends ServerBaseException
    implements CircuitBreakerRecordMarker {

  private final int status;
  private final String body;

  public UpstreamErrorException(int status, String body) {
    super(CommonErrorCode.UPSTREAM_ERROR, status);
    this.status = status;
    this.body = body;
  }

  public UpstreamErrorException(int status, String body, Throwable cause) {
    super(CommonErrorCode.UPSTREAM_ERROR, cause, status);
    this.status = status;
    this.body = body;
  }

  public boolean isTransient() {
    return status >= 500 || status == 408 || status == 429;
  }
}
