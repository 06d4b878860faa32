package climate.layer.infrastructure.concurrency;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import climate.layer.error.exception.RequestSupersededException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("RequestCoordinator 테스트")
class RequestCoordinatorTest {

  private ExecutorService executor;
  private SimpleMeterRegistry meterRegistry;
  private RequestCoordinator<String> coordinator;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(8);
    meterRegistry = new SimpleMeterRegistry();
    coordinator = new RequestCoordinator<>(executor, meterRegistry);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  /** latch 가 열릴 때까지 대기한 뒤 value 를 반환하는 작업 */
  private static String blockUntil(CountDownLatch latch, String value) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    return value;
  }

  @Nested
  @DisplayName("중복 제거")
  class Dedup {

    @Test
    @DisplayName("같은 키 동시 요청 10개 → 실제 실행 1회, 모두 같은 결과")
    void concurrentSameKeyRunsOnce() throws Exception {
      CountDownLatch release = new CountDownLatch(1);
      AtomicInteger invocations = new AtomicInteger();
      List<CompletableFuture<String>> futures = new ArrayList<>();

      for (int i = 0; i < 10; i++) {
        futures.add(
            coordinator.execute(
                "temperature:{}",
                "temperature",
                token -> {
                  invocations.incrementAndGet();
                  return blockUntil(release, "payload");
                }));
      }
      release.countDown();

      for (CompletableFuture<String> f : futures) {
        assertThat(f.get(5, TimeUnit.SECONDS)).isEqualTo("payload");
      }
      assertThat(invocations).hasValue(1);
      assertThat(meterRegistry.get("layer.coordinator.joins").counter().count()).isEqualTo(9);
    }

    @Test
    @DisplayName("완료 후에는 in-flight 엔트리가 정리된다")
    void cleansUpAfterCompletion() throws Exception {
      coordinator.execute("k", "g", token -> "v").get(5, TimeUnit.SECONDS);

      await().atMost(Duration.ofSeconds(2)).until(() -> coordinator.getInFlightCount() == 0);
    }

    @Test
    @DisplayName("Leader 실패는 모든 대기자에게 전파")
    void failurePropagatesToAll() {
      CountDownLatch release = new CountDownLatch(1);
      CompletableFuture<String> first =
          coordinator.execute(
              "k",
              "g",
              token -> {
                blockUntil(release, "");
                throw new IllegalStateException("boom");
              });
      CompletableFuture<String> second = coordinator.execute("k", "g", token -> "unused");
      release.countDown();

      assertThatThrownBy(() -> first.get(5, TimeUnit.SECONDS))
          .hasCauseInstanceOf(IllegalStateException.class);
      assertThatThrownBy(() -> second.get(5, TimeUnit.SECONDS))
          .hasCauseInstanceOf(IllegalStateException.class);
    }
  }

  @Nested
  @DisplayName("대체 취소")
  class Supersede {

    @Test
    @DisplayName("같은 그룹의 다른 키 요청은 기존 요청을 취소하고, 취소된 요청의 부수 효과는 실행되지 않는다")
    void newKeyCancelsPrevious() throws Exception {
      CountDownLatch releaseA = new CountDownLatch(1);
      AtomicBoolean sideEffectA = new AtomicBoolean();
      AtomicReference<CancellationToken> tokenA = new AtomicReference<>();

      CompletableFuture<String> a =
          coordinator.execute(
              "layer:A",
              "layer",
              token -> {
                tokenA.set(token);
                blockUntil(releaseA, "A");
                token.callIfActive(() -> sideEffectA.getAndSet(true));
                return "A";
              });
      CompletableFuture<String> b = coordinator.execute("layer:B", "layer", token -> "B");
      releaseA.countDown();

      assertThat(b.get(5, TimeUnit.SECONDS)).isEqualTo("B");
      assertThatThrownBy(() -> a.get(5, TimeUnit.SECONDS))
          .isInstanceOf(ExecutionException.class)
          .hasCauseInstanceOf(RequestSupersededException.class);
      await().atMost(Duration.ofSeconds(2)).until(() -> tokenA.get() != null);
      await().atMost(Duration.ofSeconds(2)).until(() -> coordinator.getInFlightCount() == 0);
      assertThat(tokenA.get().isCancelled()).isTrue();
      assertThat(sideEffectA).isFalse();
    }

    @Test
    @DisplayName("다른 그룹의 요청은 서로 취소하지 않는다")
    void differentGroupsIndependent() throws Exception {
      CountDownLatch release = new CountDownLatch(1);
      CompletableFuture<String> a =
          coordinator.execute("t:A", "temperature", token -> blockUntil(release, "A"));
      CompletableFuture<String> b = coordinator.execute("s:B", "sea_level", token -> "B");
      release.countDown();

      assertThat(a.get(5, TimeUnit.SECONDS)).isEqualTo("A");
      assertThat(b.get(5, TimeUnit.SECONDS)).isEqualTo("B");
    }

    @Test
    @DisplayName("취소된 키로 다시 요청하면 취소된 요청에 합류하지 않고 새로 실행")
    void resubmittedKeyStartsFresh() throws Exception {
      CountDownLatch never = new CountDownLatch(1);
      AtomicInteger invocations = new AtomicInteger();

      CompletableFuture<String> a1 =
          coordinator.execute(
              "layer:A",
              "layer",
              token -> {
                invocations.incrementAndGet();
                return blockUntil(never, "stale");
              });
      coordinator.supersede("layer", "layer:B");
      CompletableFuture<String> a2 =
          coordinator.execute(
              "layer:A",
              "layer",
              token -> {
                invocations.incrementAndGet();
                return "fresh";
              });

      assertThat(a2.get(5, TimeUnit.SECONDS)).isEqualTo("fresh");
      assertThat(a1).isCompletedExceptionally();
      await().atMost(Duration.ofSeconds(2)).until(() -> invocations.get() == 2);
      never.countDown();
    }

    @Test
    @DisplayName("cancelAll 은 모든 진행 중 요청을 취소")
    void cancelAll() {
      CountDownLatch never = new CountDownLatch(1);
      CompletableFuture<String> a = coordinator.execute("a", "g1", t -> blockUntil(never, "a"));
      CompletableFuture<String> b = coordinator.execute("b", "g2", t -> blockUntil(never, "b"));

      coordinator.cancelAll();

      assertThat(a).isCompletedExceptionally();
      assertThat(b).isCompletedExceptionally();
      assertThat(coordinator.getInFlightCount()).isZero();
      never.countDown();
    }
  }

  @Nested
  @DisplayName("호출자 분리")
  class Detach {

    @Test
    @DisplayName("한 호출자의 취소는 다른 대기자에게 영향을 주지 않는다")
    void cancellingOneWaiterKeepsOthers() throws Exception {
      CountDownLatch release = new CountDownLatch(1);
      AtomicReference<CancellationToken> token = new AtomicReference<>();
      CompletableFuture<String> first =
          coordinator.execute(
              "k",
              "g",
              t -> {
                token.set(t);
                return blockUntil(release, "v");
              });
      CompletableFuture<String> second = coordinator.execute("k", "g", t -> "unused");

      first.cancel(true);
      release.countDown();

      assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo("v");
      assertThat(token.get().isCancelled()).isFalse();
    }

    @Test
    @DisplayName("모든 대기자가 떠나면 underlying 요청도 취소")
    void lastWaiterLeavingCancelsCall() {
      CountDownLatch never = new CountDownLatch(1);
      AtomicReference<CancellationToken> token = new AtomicReference<>();
      CompletableFuture<String> only =
          coordinator.execute(
              "k",
              "g",
              t -> {
                token.set(t);
                return blockUntil(never, "v");
              });
      await().atMost(Duration.ofSeconds(2)).until(() -> token.get() != null);

      only.cancel(true);

      assertThat(token.get().isCancelled()).isTrue();
      assertThat(coordinator.getInFlightCount()).isZero();
      never.countDown();
    }
  }
}
