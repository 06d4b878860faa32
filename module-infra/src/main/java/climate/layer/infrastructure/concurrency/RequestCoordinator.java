package climate.layer.infrastructure.concurrency;

import climate.layer.error.exception.RequestSupersededException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * 요청 중복 제거 + 대체 취소 실행기
 *
 * <h4>핵심 기능</h4>
 *
 * <ul>
 *   <li>동일 키 동시 요청 N개 중 실제 호출은 1회만 수행 (Leader), 나머지는 결과 공유 (Follower)
 *   <li>같은 그룹(레이어)에 다른 키의 요청이 들어오면 기존 요청을 취소 (RequestSupersededException)
 *   <li>호출자별 독립 Future: 한 호출자가 자기 Future 를 취소해도 다른 대기자에게 전파되지 않음
 *   <li>대기자가 모두 떠나면 underlying 요청도 취소
 * </ul>
 *
 * <p>in-flight 맵과 그룹 맵은 하나의 락으로 보호되며, 취소 시 맵에서 즉시 제거되므로 같은 키의 새 요청은 취소된 요청에 합류하지 않고 새로
 * 시작합니다.
 *
 * @param <T> 결과 타입
 */
@Slf4j
public class RequestCoordinator<T> {

  private final Executor executor;
  private final Counter joinCounter;

  private final Object lock = new Object();
  private final Map<String, InFlight<T>> inFlight = new HashMap<>();
  private final Map<String, String> activeKeyByGroup = new HashMap<>();

  public RequestCoordinator(Executor executor, MeterRegistry meterRegistry) {
    this.executor = executor;
    this.joinCounter = Counter.builder("layer.coordinator.joins").register(meterRegistry);
  }

  private static final class InFlight<T> {
    private final String key;
    private final String group;
    private final CancellationToken token = new CancellationToken();
    private final CompletableFuture<T> promise = new CompletableFuture<>();
    private int waiters;

    private InFlight(String key, String group) {
      this.key = key;
      this.group = group;
    }

    private void cancel(Throwable cause) {
      token.cancel();
      promise.completeExceptionally(cause);
    }
  }

  /**
   * 키 단위 중복 제거 실행
   *
   * @param key 요청 식별 키 (캐시 키)
   * @param group 대체 그룹 (레이어 ID). 같은 그룹의 다른 키 요청은 취소됩니다.
   * @param task 실제 작업. 전달되는 토큰으로 취소 여부를 확인하고 부수 효과를 원자적으로 수행합니다.
   * @return 호출자 전용 Future. 취소하면 이 호출자만 대기에서 빠집니다.
   */
  public CompletableFuture<T> execute(
      String key, String group, Function<CancellationToken, T> task) {
    InFlight<T> flight;
    boolean leader;
    List<InFlight<T>> superseded;

    synchronized (lock) {
      superseded = supersedeLocked(group, key);
      flight = inFlight.get(key);
      leader = flight == null;
      if (leader) {
        flight = new InFlight<>(key, group);
        inFlight.put(key, flight);
        activeKeyByGroup.put(group, key);
      }
      flight.waiters++;
    }

    cancelAll(superseded, "superseded");

    if (leader) {
      startLeader(flight, task);
    } else {
      joinCounter.increment();
      log.debug("[Coordinator] 진행 중인 요청에 합류. key: {}", maskKey(key));
    }
    return attach(flight);
  }

  /** 그룹에서 keepKey 가 아닌 진행 중 요청을 취소 (keepKey 가 null 이면 그룹 전체) */
  public void supersede(String group, String keepKey) {
    List<InFlight<T>> superseded;
    synchronized (lock) {
      superseded = supersedeLocked(group, keepKey);
    }
    cancelAll(superseded, "superseded");
  }

  /** 모든 진행 중 요청 취소 */
  public void cancelAll() {
    List<InFlight<T>> all;
    synchronized (lock) {
      all = new ArrayList<>(inFlight.values());
      inFlight.clear();
      activeKeyByGroup.clear();
    }
    cancelAll(all, "cleared");
  }

  public boolean isInFlight(String key) {
    synchronized (lock) {
      return inFlight.containsKey(key);
    }
  }

  public int getInFlightCount() {
    synchronized (lock) {
      return inFlight.size();
    }
  }

  private List<InFlight<T>> supersedeLocked(String group, String keepKey) {
    String active = activeKeyByGroup.get(group);
    if (active == null || active.equals(keepKey)) {
      return List.of();
    }
    activeKeyByGroup.remove(group);
    InFlight<T> previous = inFlight.remove(active);
    return previous == null ? List.of() : List.of(previous);
  }

  private void cancelAll(List<InFlight<T>> flights, String reason) {
    for (InFlight<T> flight : flights) {
      log.info("[Coordinator] 진행 중인 요청 취소 ({}). key: {}", reason, maskKey(flight.key));
      flight.cancel(new RequestSupersededException(flight.key));
    }
  }

  private void startLeader(InFlight<T> flight, Function<CancellationToken, T> task) {
    try {
      executor.execute(() -> runLeader(flight, task));
    } catch (RejectedExecutionException e) {
      log.error("[Coordinator] 실행기 포화로 요청 거부. key: {}", maskKey(flight.key), e);
      flight.promise.completeExceptionally(e);
      release(flight);
    }
  }

  /** Leader 실행. 동기 예외를 포함한 모든 종료 경로에서 promise 완료와 맵 정리를 보장 */
  private void runLeader(InFlight<T> flight, Function<CancellationToken, T> task) {
    try {
      flight.promise.complete(task.apply(flight.token));
    } catch (Throwable t) {
      Throwable cause = unwrapCause(t);
      if (!flight.token.isCancelled()) {
        log.debug(
            "[Coordinator] Leader 실패. key: {}, error: {}", maskKey(flight.key), cause.toString());
      }
      flight.promise.completeExceptionally(cause);
      if (t instanceof Error e) {
        throw e;
      }
    } finally {
      release(flight);
    }
  }

  private void release(InFlight<T> flight) {
    synchronized (lock) {
      inFlight.remove(flight.key, flight);
      activeKeyByGroup.remove(flight.group, flight.key);
    }
  }

  /** 호출자별 독립 Future 생성. 공유 promise 는 호출자 취소로부터 보호됩니다. */
  private CompletableFuture<T> attach(InFlight<T> flight) {
    CompletableFuture<T> isolated = new CompletableFuture<>();
    flight.promise.whenComplete(
        (result, error) -> {
          if (error != null) {
            isolated.completeExceptionally(error);
          } else {
            isolated.complete(result);
          }
        });
    isolated.whenComplete(
        (result, error) -> {
          if (error instanceof CancellationException && !flight.promise.isDone()) {
            detach(flight);
          }
        });
    return isolated;
  }

  private void detach(InFlight<T> flight) {
    boolean abandoned;
    synchronized (lock) {
      flight.waiters--;
      abandoned = flight.waiters <= 0;
      if (abandoned) {
        inFlight.remove(flight.key, flight);
        activeKeyByGroup.remove(flight.group, flight.key);
      }
    }
    if (abandoned) {
      log.info("[Coordinator] 대기자가 없어 요청 취소. key: {}", maskKey(flight.key));
      flight.cancel(new CancellationException("all waiters detached"));
    }
  }

  private Throwable unwrapCause(Throwable e) {
    return (e instanceof CompletionException ce && ce.getCause() != null) ? ce.getCause() : e;
  }

  private String maskKey(String key) {
    if (key == null) return "null";
    if (key.length() <= 8) return "***";
    return key.substring(0, 4) + "***" + key.substring(key.length() - 4);
  }
}
