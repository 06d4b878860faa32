package climate.layer.domain.model.layer;

/** How a layer's data is produced. */
public enum LayerKind {
  /** Raster tiles computed upstream; short-lived. */
  TILE,
  /** Vector features computed upstream. */
  FEATURE,
  /** Rendered entirely client-side; never touches the upstream. */
  LOCAL
}
