package climate.layer.domain.model.session;

public record SessionPreferences(
    boolean autoRestore, boolean rememberLayers, boolean rememberViewport) {

  public static SessionPreferences defaults() {
    return new SessionPreferences(true, true, true);
  }
}
