package climate.layer.error.exception;

import climate.layer.error.CommonErrorCode;
import climate.layer.error.exception.base.ClientBaseException;

public class InvalidInputException extends ClientBaseException {

  public InvalidInputException(String detail) {
    super(CommonErrorCode.INVALID_INPUT_VALUE, detail);
  }

  public InvalidInputException(String detail, Throwable cause) {
    super(CommonErrorCode.INVALID_INPUT_VALUE, cause, detail);
  }
}
