package climate.layer.infrastructure.executor;

import java.util.Objects;

/**
 * {@link LogicExecutor} 작업 식별자
 *
 * <p>component 와 operation 은 {@code logic.executor} Timer 의 태그가 되므로 고정된 어휘만 씁니다. 캐시 키나 세션 저장 키처럼
 * 레이어마다 달라지는 값은 dynamicValue 로 넘기며 로그에만 남습니다.
 *
 * <pre>
 * TaskContext.of("CacheStore", "DurableRead", "temperature:{\"year\":2024}")
 *   → "CacheStore:DurableRead:temperature:{\"year\":2024}"
 * TaskContext.of("UpstreamHealth", "Ping")
 *   → "UpstreamHealth:Ping"
 * </pre>
 *
 * <p>캐시 키 자체에 ':' 가 들어가므로 구분자는 component 와 operation 에서만 금지되고, dynamicValue 는 항상 마지막에 붙습니다.
 *
 * @param component CacheStore, SessionMemory, UpstreamHealth 등 호출 컴포넌트
 * @param operation DurableRead, Flush, Ping 등 작업 유형
 * @param dynamicValue 캐시 키 또는 저장 키 (없으면 빈 문자열)
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  private static final String SEPARATOR = ":";

  public TaskContext {
    requireTagValue(component, "component");
    requireTagValue(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  /** 로그용 작업 이름 */
  public String toTaskName() {
    String name = component + SEPARATOR + operation;
    return dynamicValue.isEmpty() ? name : name + SEPARATOR + dynamicValue;
  }

  private static void requireTagValue(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank() || value.contains(SEPARATOR)) {
      throw new IllegalArgumentException(name + " must be a non-blank tag without ':': " + value);
    }
  }
}
