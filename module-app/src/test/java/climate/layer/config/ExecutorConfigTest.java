package climate.layer.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Tag("unit")
@DisplayName("ExecutorConfig 병렬성 테스트")
class ExecutorConfigTest {

  private final ExecutorConfig executorConfig = new ExecutorConfig();
  private final TaskDecorator noOpDecorator = runnable -> runnable;

  @Test
  @DisplayName("layerFetchExecutor 는 블로킹 중인 Leader 8개를 큐 대기 없이 동시에 실행")
  void layerFetchExecutor_RunsBlockedLeadersInParallel() throws InterruptedException {
    ThreadPoolTaskExecutor executor =
        (ThreadPoolTaskExecutor) executorConfig.layerFetchExecutor(noOpDecorator);

    assertThat(executor.getCorePoolSize()).isEqualTo(executor.getMaxPoolSize());
    assertAllStartConcurrently(executor, 8);
  }

  @Test
  @DisplayName("upstreamAttemptExecutor 도 core == max 로 시도를 병렬 실행")
  void upstreamAttemptExecutor_RunsAttemptsInParallel() throws InterruptedException {
    ThreadPoolTaskExecutor executor =
        (ThreadPoolTaskExecutor) executorConfig.upstreamAttemptExecutor(noOpDecorator);

    assertThat(executor.getCorePoolSize()).isEqualTo(executor.getMaxPoolSize());
    assertAllStartConcurrently(executor, 8);
  }

  private static void assertAllStartConcurrently(ThreadPoolTaskExecutor executor, int tasks)
      throws InterruptedException {
    CountDownLatch started = new CountDownLatch(tasks);
    CountDownLatch blocker = new CountDownLatch(1);
    try {
      for (int i = 0; i < tasks; i++) {
        executor.execute(
            () -> {
              started.countDown();
              try {
                blocker.await(30, TimeUnit.SECONDS);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            });
      }

      assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
      assertThat(executor.getThreadPoolExecutor().getQueue()).isEmpty();
    } finally {
      blocker.countDown();
      executor.shutdown();
      executor.getThreadPoolExecutor().awaitTermination(10, TimeUnit.SECONDS);
    }
  }
}
