package climate.layer.domain.model.session;

/** Map camera position for one rendering context. */
public record Viewport(
    double longitude, double latitude, double zoom, double pitch, double bearing) {

  public static Viewport of(double longitude, double latitude, double zoom) {
    return new Viewport(longitude, latitude, zoom, 0, 0);
  }
}
