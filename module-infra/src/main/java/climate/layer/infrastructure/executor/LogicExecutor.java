package climate.layer.infrastructure.executor;

import climate.layer.common.function.ThrowingSupplier;
import java.util.function.Function;

/**
 * 예외 처리 패턴을 추상화한 실행기
 *
 * <p>비즈니스 로직은 별도 메서드로 분리하고 메서드 참조({@code this::method})를 활용하세요. 저장소 I/O 처럼 실패해도 흐름을 멈추지 않아야
 * 하는 경계는 {@link #executeOrDefault} 로, 실패 원인에 따라 복구가 달라지는 경계는 {@link #executeOrCatch} 로 감쌉니다.
 *
 * <h3>사용 예시</h3>
 *
 * <pre>{@code
 * Optional<byte[]> bytes = executor.executeOrDefault(
 *     () -> durableStore.read(key),
 *     Optional.empty(),
 *     TaskContext.of("CacheStore", "DurableRead", key));
 * }</pre>
 */
public interface LogicExecutor {

  /**
   * 예외를 그대로(또는 checked 예외는 InternalSystemException 으로 감싸) 전파
   *
   * @throws RuntimeException 런타임 예외 또는 감싼 checked 예외
   */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /** 예외 발생 시 recovery 함수의 결과를 반환 (Error 는 항상 재전파) */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  /** 예외 발생 시 WARN 로그 후 기본값 반환 */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);
}
