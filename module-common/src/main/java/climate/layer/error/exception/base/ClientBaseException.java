package climate.layer.error.exception.base;

import climate.layer.error.ErrorCode;

/**
 * ClientBaseException: 호출자가 잘못된 레이어/파라미터/스냅샷을 넘긴 경우의 '클라이언트 예외' 4xx 계열입니다. 재시도해도 결과가 달라지지 않으므로
 * 로그는 WARN 수준으로 남깁니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ClientBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
