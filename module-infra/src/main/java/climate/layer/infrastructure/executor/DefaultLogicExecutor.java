package climate.layer.infrastructure.executor;

import climate.layer.common.function.ThrowingSupplier;
import climate.layer.error.exception.InternalSystemException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer Timer 기반 LogicExecutor 구현체
 *
 * <ul>
 *   <li><b>Error 즉시 rethrow</b>: VirtualMachineError 등은 번역 없이 전파
 *   <li><b>checked 예외 규격화</b>: RuntimeException 이 아닌 예외는 {@link InternalSystemException} 으로 감쌈
 *   <li><b>메트릭</b>: {@code logic.executor} Timer (component, operation, outcome 태그)
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String METRIC_NAME = "logic.executor";

  private final MeterRegistry meterRegistry;

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");

    long start = System.nanoTime();
    try {
      T result = task.get();
      record(context, "success", start);
      return result;
    } catch (Error e) {
      record(context, "error", start);
      throw e;
    } catch (Throwable t) {
      record(context, "failure", start);
      log.debug(
          "[Task:FAILURE] {}, errorType={}", context.toTaskName(), t.getClass().getSimpleName());
      throw translate(t, context);
    }
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(recovery, "recovery");
    try {
      return execute(task, context);
    } catch (InternalSystemException e) {
      return recovery.apply(e.getCause() != null ? e.getCause() : e);
    } catch (RuntimeException e) {
      return recovery.apply(e);
    }
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(
        task,
        e -> {
          log.warn(
              "[Task:RECOVERED] {}, errorType={}, message={}",
              context.toTaskName(),
              e.getClass().getSimpleName(),
              e.getMessage());
          return defaultValue;
        },
        context);
  }

  private RuntimeException translate(Throwable t, TaskContext context) {
    if (t instanceof RuntimeException re) {
      return re;
    }
    if (t instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    return new InternalSystemException(context.toTaskName(), t);
  }

  private void record(TaskContext context, String outcome, long startNanos) {
    Timer.builder(METRIC_NAME)
        .tag("component", context.component())
        .tag("operation", context.operation())
        .tag("outcome", outcome)
        .register(meterRegistry)
        .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
  }
}
