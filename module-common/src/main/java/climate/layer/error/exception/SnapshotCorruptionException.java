package climate.layer.error.exception;

import climate.layer.error.CommonErrorCode;
import climate.layer.error.exception.base.ServerBaseException;

/** 저장된 세션 스냅샷을 해석할 수 없는 경우 (기본값으로 복구됨) */
public class SnapshotCorruptionException extends ServerBaseException {

  public SnapshotCorruptionException(String reason, Throwable cause) {
    super(CommonErrorCode.SNAPSHOT_CORRUPTED, cause, reason);
  }
}
