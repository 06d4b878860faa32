package climate.layer.common.function;

/**
 * Checked 예외를 던질 수 있는 Supplier
 *
 * @param <T> 결과 타입
 */
@FunctionalInterface
public interface ThrowingSupplier<T> {
  T get() throws Throwable;
}
