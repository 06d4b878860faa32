package climate.layer.domain.model.layer;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("LayerStatus 전이 규칙")
class LayerStatusTest {

  @ParameterizedTest
  @EnumSource(LayerStatus.class)
  @DisplayName("어떤 상태에서도 Idle 로 직접 전이할 수 없다")
  void neverBackToIdle(LayerStatus from) {
    assertThat(from.canTransitionTo(LayerStatus.IDLE)).isFalse();
  }

  @Test
  @DisplayName("Loading 은 모든 결과 상태로 전이할 수 있다")
  void loadingSettles() {
    assertThat(LayerStatus.LOADING.canTransitionTo(LayerStatus.SUCCESS)).isTrue();
    assertThat(LayerStatus.LOADING.canTransitionTo(LayerStatus.ERROR)).isTrue();
    assertThat(LayerStatus.LOADING.canTransitionTo(LayerStatus.FALLBACK)).isTrue();
  }

  @Test
  @DisplayName("정착 상태에서 Error 로는 Loading 을 거쳐야 한다")
  void settledToErrorRequiresLoading() {
    assertThat(LayerStatus.SUCCESS.canTransitionTo(LayerStatus.ERROR)).isFalse();
    assertThat(LayerStatus.FALLBACK.canTransitionTo(LayerStatus.ERROR)).isFalse();
    assertThat(LayerStatus.SUCCESS.canTransitionTo(LayerStatus.LOADING)).isTrue();
  }

  @Test
  @DisplayName("캐시 적중 시 Idle 에서 Success 로 바로 전이")
  void idleToSuccessOnCacheHit() {
    assertThat(LayerStatus.IDLE.canTransitionTo(LayerStatus.SUCCESS)).isTrue();
  }
}
