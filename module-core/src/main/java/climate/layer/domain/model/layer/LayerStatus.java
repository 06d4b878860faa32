package climate.layer.domain.model.layer;

import java.util.EnumSet;
import java.util.Set;

/**
 * 레이어 상태
 *
 * <pre>
 * Idle ──▶ Loading ──▶ Success | Error | Fallback
 *  │          ▲  │
 *  │          └──┘ (새 파라미터로 재요청)
 *  └──▶ Success | Fallback (캐시 적중) | Error (미등록 레이어)
 * Success | Error | Fallback ──▶ Loading | Success | Fallback
 * </pre>
 *
 * <p>Idle 로의 복귀는 reset 을 통해서만 가능합니다.
 */
public enum LayerStatus {
  IDLE,
  LOADING,
  SUCCESS,
  ERROR,
  FALLBACK;

  private static final Set<LayerStatus> FROM_IDLE = EnumSet.of(LOADING, SUCCESS, FALLBACK, ERROR);
  private static final Set<LayerStatus> FROM_LOADING =
      EnumSet.of(LOADING, SUCCESS, ERROR, FALLBACK);
  private static final Set<LayerStatus> FROM_SETTLED = EnumSet.of(LOADING, SUCCESS, FALLBACK);

  public boolean canTransitionTo(LayerStatus next) {
    return switch (this) {
      case IDLE -> FROM_IDLE.contains(next);
      case LOADING -> FROM_LOADING.contains(next);
      case SUCCESS, ERROR, FALLBACK -> FROM_SETTLED.contains(next);
    };
  }

  public boolean isSettled() {
    return this == SUCCESS || this == ERROR || this == FALLBACK;
  }
}
