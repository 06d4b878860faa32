package climate.layer.infrastructure.concurrency;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * 진행 중인 요청의 취소 신호
 *
 * <p>{@link #callIfActive} 와 {@link #cancel} 은 같은 모니터를 사용하므로, 취소된 요청의 부수 효과(캐시 쓰기 등)는 취소 이후에 절대
 * 실행되지 않습니다.
 */
public final class CancellationToken {

  private boolean cancelled;

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  synchronized void cancel() {
    cancelled = true;
  }

  /** 취소되지 않은 경우에만 action 을 실행하고 결과를 반환 */
  public synchronized <T> Optional<T> callIfActive(Supplier<T> action) {
    if (cancelled) {
      return Optional.empty();
    }
    return Optional.ofNullable(action.get());
  }
}
