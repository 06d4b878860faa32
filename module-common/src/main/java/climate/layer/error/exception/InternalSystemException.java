package climate.layer.error.exception;

import climate.layer.error.CommonErrorCode;
import climate.layer.error.exception.base.ServerBaseException;

/** LogicExecutor 가 런타임 예외가 아닌 checked 예외를 감쌀 때 사용하는 시스템 예외 */
public class InternalSystemException extends ServerBaseException {

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause, taskName);
  }
}
