package climate.layer.infrastructure.resilience;

import climate.layer.error.exception.TransientNetworkException;
import climate.layer.error.exception.UpstreamErrorException;
import climate.layer.error.exception.UpstreamTimeoutException;
import climate.layer.error.exception.UpstreamValidationException;
import climate.layer.error.exception.base.BaseException;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/** 업스트림 실패 분류 유틸리티 */
public final class UpstreamFailures {

  private UpstreamFailures() {}

  /** 재시도할 가치가 있는 실패인지 (네트워크, 타임아웃, 5xx/408/429) */
  public static boolean isTransient(Throwable t) {
    return t instanceof TransientNetworkException
        || t instanceof UpstreamTimeoutException
        || (t instanceof UpstreamErrorException e && e.isTransient());
  }

  /** HTTP 오류 상태를 타입 예외로 변환. 408/429 외의 4xx 는 호출자 파라미터 오류로 봅니다. */
  public static BaseException fromStatus(int status, String body) {
    if (status >= 400 && status < 500 && status != 408 && status != 429) {
      return new UpstreamValidationException(status, body);
    }
    return new UpstreamErrorException(status, body);
  }

  /**
   * 임의의 Throwable 을 타입 예외로 정규화
   *
   * <p>이미 규격화된 예외는 그대로 반환하고, 타임아웃은 UpstreamTimeout, I/O 오류는 TransientNetwork, 그 외는 재시도하지 않는
   * UpstreamError(status 0) 로 변환합니다.
   */
  public static BaseException normalize(String endpointId, Duration timeout, Throwable t) {
    Throwable cause = unwrap(t);
    if (cause instanceof BaseException be) {
      return be;
    }
    if (cause instanceof TimeoutException) {
      return new UpstreamTimeoutException(endpointId, timeout, cause);
    }
    if (cause instanceof IOException) {
      return new TransientNetworkException(endpointId, cause);
    }
    return new UpstreamErrorException(0, String.valueOf(cause.getMessage()), cause);
  }

  public static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
