package climate.layer.config;

import java.util.Map;
import java.util.concurrent.Executor;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 오케스트레이터 스레드 풀 설정
 *
 * <ul>
 *   <li><b>layerFetchExecutor</b>: RequestCoordinator 의 Leader 실행 (재시도 backoff 대기 포함)
 *   <li><b>upstreamAttemptExecutor</b>: 시도별 타임아웃을 걸기 위한 업스트림 호출 실행
 *   <li><b>taskScheduler</b>: 세션 debounce 쓰기 + 헬스 체크 @Scheduled
 * </ul>
 *
 * <p>모든 풀은 MDC 를 워커 스레드로 전파합니다.
 *
 * <p>fetch/upstream 풀은 core == max 입니다. ThreadPoolExecutor 는 큐가 가득 찬 뒤에만 core 를 넘는 스레드를 만들기
 * 때문에, core 가 작으면 서로 다른 레이어의 Leader 가 병렬로 실행되지 않고 큐에서 대기합니다.
 */
@Configuration
public class ExecutorConfig {

  @Bean
  public TaskDecorator mdcPropagatingDecorator() {
    return runnable -> {
      Map<String, String> captured = MDC.getCopyOfContextMap();
      return () -> {
        Map<String, String> before = MDC.getCopyOfContextMap();
        if (captured != null) {
          MDC.setContextMap(captured);
        } else {
          MDC.clear();
        }
        try {
          runnable.run();
        } finally {
          if (before != null) {
            MDC.setContextMap(before);
          } else {
            MDC.clear();
          }
        }
      };
    };
  }

  @Bean(name = "layerFetchExecutor")
  public Executor layerFetchExecutor(TaskDecorator mdcPropagatingDecorator) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(16);
    executor.setMaxPoolSize(16);
    executor.setAllowCoreThreadTimeOut(true);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("layer-fetch-");
    executor.setTaskDecorator(mdcPropagatingDecorator);
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  @Bean(name = "upstreamAttemptExecutor")
  public Executor upstreamAttemptExecutor(TaskDecorator mdcPropagatingDecorator) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(16);
    executor.setMaxPoolSize(16);
    executor.setAllowCoreThreadTimeOut(true);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("upstream-");
    executor.setTaskDecorator(mdcPropagatingDecorator);
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  @Bean
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setThreadNamePrefix("layer-scheduler-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(10);
    scheduler.initialize();
    return scheduler;
  }
}
