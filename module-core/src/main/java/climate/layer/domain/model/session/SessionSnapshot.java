package climate.layer.domain.model.session;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 세션 메모리 스냅샷 (가변)
 *
 * <p>SessionMemory 의 mutator 가 직접 수정하는 작업 사본입니다. 외부로 노출할 때는 항상 {@link #copy()} 로 복제합니다. 내보내기와
 * 영속화는 같은 스키마를 사용합니다.
 */
public class SessionSnapshot {

  public static final String CURRENT_VERSION = "2.0.0";

  private String version = CURRENT_VERSION;
  private List<EnabledLayer> enabledLayers = new ArrayList<>();
  private Map<String, Viewport> viewportByContext = new LinkedHashMap<>();
  private SessionPreferences preferences = SessionPreferences.defaults();
  private String lastActiveContext;

  public static SessionSnapshot defaults() {
    return new SessionSnapshot();
  }

  public SessionSnapshot copy() {
    SessionSnapshot copy = new SessionSnapshot();
    copy.version = version;
    copy.enabledLayers = new ArrayList<>(enabledLayers);
    copy.viewportByContext = new LinkedHashMap<>(viewportByContext);
    copy.preferences = preferences;
    copy.lastActiveContext = lastActiveContext;
    return copy;
  }

  /** Replaces missing sections with their defaults after deserialization. */
  public SessionSnapshot normalize() {
    if (version == null) {
      version = CURRENT_VERSION;
    }
    if (enabledLayers == null) {
      enabledLayers = new ArrayList<>();
    }
    if (viewportByContext == null) {
      viewportByContext = new LinkedHashMap<>();
    }
    if (preferences == null) {
      preferences = SessionPreferences.defaults();
    }
    return this;
  }

  public void putEnabledLayer(EnabledLayer layer) {
    removeEnabledLayer(layer.layerId());
    enabledLayers.add(layer);
  }

  public void removeEnabledLayer(String layerId) {
    enabledLayers.removeIf(l -> l.layerId().equals(layerId));
  }

  public String getVersion() {
    return version;
  }

  public void setVersion(String version) {
    this.version = version;
  }

  public List<EnabledLayer> getEnabledLayers() {
    return enabledLayers;
  }

  public void setEnabledLayers(List<EnabledLayer> enabledLayers) {
    this.enabledLayers = enabledLayers == null ? new ArrayList<>() : new ArrayList<>(enabledLayers);
  }

  public Map<String, Viewport> getViewportByContext() {
    return viewportByContext;
  }

  public void setViewportByContext(Map<String, Viewport> viewportByContext) {
    this.viewportByContext =
        viewportByContext == null ? new LinkedHashMap<>() : new LinkedHashMap<>(viewportByContext);
  }

  public SessionPreferences getPreferences() {
    return preferences;
  }

  public void setPreferences(SessionPreferences preferences) {
    this.preferences = preferences;
  }

  public String getLastActiveContext() {
    return lastActiveContext;
  }

  public void setLastActiveContext(String lastActiveContext) {
    this.lastActiveContext = lastActiveContext;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SessionSnapshot that)) {
      return false;
    }
    return Objects.equals(version, that.version)
        && Objects.equals(enabledLayers, that.enabledLayers)
        && Objects.equals(viewportByContext, that.viewportByContext)
        && Objects.equals(preferences, that.preferences)
        && Objects.equals(lastActiveContext, that.lastActiveContext);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        version, enabledLayers, viewportByContext, preferences, lastActiveContext);
  }

  @Override
  public String toString() {
    return "SessionSnapshot{version="
        + version
        + ", enabledLayers="
        + enabledLayers.size()
        + ", contexts="
        + viewportByContext.keySet()
        + ", lastActiveContext="
        + lastActiveContext
        + "}";
  }
}
