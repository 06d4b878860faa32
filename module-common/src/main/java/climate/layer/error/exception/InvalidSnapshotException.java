package climate.layer.error.exception;

import climate.layer.error.CommonErrorCode;
import climate.layer.error.exception.base.ClientBaseException;

/** 가져오기(import) 요청의 스냅샷 바이트가 올바르지 않은 경우 */
public class InvalidSnapshotException extends ClientBaseException {

  public InvalidSnapshotException(String reason) {
    super(CommonErrorCode.INVALID_SNAPSHOT, reason);
  }

  public InvalidSnapshotException(String reason, Throwable cause) {
    super(CommonErrorCode.INVALID_SNAPSHOT, cause, reason);
  }
}
