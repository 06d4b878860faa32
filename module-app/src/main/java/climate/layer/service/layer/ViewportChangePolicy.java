package climate.layer.service.layer;

import climate.layer.config.ViewportProperties;
import climate.layer.domain.model.session.Viewport;

/** 뷰포트 변경이 레이어 재요청을 일으킬 만큼 큰지 판정 */
public class ViewportChangePolicy {

  private final double minZoomDelta;
  private final double minCenterDeltaDegrees;

  public ViewportChangePolicy(ViewportProperties properties) {
    this.minZoomDelta = properties.minZoomDelta();
    this.minCenterDeltaDegrees = properties.minCenterDeltaDegrees();
  }

  /** previous 가 null 이면 (해당 컨텍스트의 첫 뷰포트) 항상 true */
  public boolean requiresRefetch(Viewport previous, Viewport next) {
    if (previous == null) {
      return true;
    }
    if (Math.abs(next.zoom() - previous.zoom()) >= minZoomDelta) {
      return true;
    }
    return Math.abs(next.longitude() - previous.longitude()) >= minCenterDeltaDegrees
        || Math.abs(next.latitude() - previous.latitude()) >= minCenterDeltaDegrees;
  }
}
