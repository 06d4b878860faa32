package climate.layer.error.exception.base;

import climate.layer.error.ErrorCode;

/**
 * ServerBaseException: 업스트림 장애나 저장소 손상 등 시스템 내부 원인으로 발생하는 '서버 예외' 5xx 계열의 에러를 처리하며, 장애 회고를 위한 상세
 * 로그를 남기는 것이 주 목적입니다.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // 엔드포인트/키 등 구체적인 식별자를 로그에 남기기 위해 사용합니다.
  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  // 실제 에러(cause)를 포함하여 디버깅 정보 확보
  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  // 상세 메시지(args)와 실제 에러(cause)를 동시에 기록
  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
