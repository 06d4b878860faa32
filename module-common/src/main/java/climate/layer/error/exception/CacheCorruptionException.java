package climate.layer.error.exception;

import climate.layer.error.CommonErrorCode;
import climate.layer.error.exception.base.ServerBaseException;

/** 영속 캐시 엔트리를 해석할 수 없는 경우 (엔트리는 폐기되고 miss 로 처리됨) */
public class CacheCorruptionException extends ServerBaseException {

  public CacheCorruptionException(String key, Throwable cause) {
    super(CommonErrorCode.CACHE_CORRUPTED, cause, key);
  }

  public CacheCorruptionException(String key) {
    super(CommonErrorCode.CACHE_CORRUPTED, key);
  }
}
