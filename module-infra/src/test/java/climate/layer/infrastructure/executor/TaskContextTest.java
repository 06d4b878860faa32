package climate.layer.infrastructure.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("TaskContext 작업 이름 테스트")
class TaskContextTest {

  @Test
  @DisplayName("':' 가 들어간 캐시 키는 dynamicValue 로 그대로 뒤에 붙는다")
  void cacheKeyWithSeparatorIsAppended() {
    String cacheKey = "temperature:{\"year\":2024}";
    TaskContext context = TaskContext.of("CacheStore", "DurableRead", cacheKey);

    assertThat(context.toTaskName()).isEqualTo("CacheStore:DurableRead:" + cacheKey);
  }

  @Test
  @DisplayName("dynamicValue 가 없으면 component:operation")
  void withoutDynamicValue() {
    assertThat(TaskContext.of("UpstreamHealth", "Ping").toTaskName())
        .isEqualTo("UpstreamHealth:Ping");
    assertThat(TaskContext.of("SessionMemory", "Flush", null).dynamicValue()).isEmpty();
  }

  @Test
  @DisplayName("메트릭 태그가 되는 component/operation 에는 ':' 와 공백 값을 허용하지 않음")
  void rejectsUnsafeTagValues() {
    assertThatThrownBy(() -> TaskContext.of("CacheStore:temperature", "Read"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TaskContext.of("CacheStore", " "))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TaskContext.of(null, "Read")).isInstanceOf(NullPointerException.class);
  }
}
