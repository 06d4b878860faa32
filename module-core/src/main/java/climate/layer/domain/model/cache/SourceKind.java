package climate.layer.domain.model.cache;

import java.util.Locale;

/**
 * Origin of a payload as reported by the upstream in {@code metadata.dataSource}.
 *
 * <p>An absent or unrecognized flag maps to {@link #UNKNOWN}; callers must never assume
 * {@link #REAL} by default.
 */
public enum SourceKind {
  REAL,
  FALLBACK,
  UNKNOWN;

  public static SourceKind fromFlag(String flag) {
    if (flag == null) {
      return UNKNOWN;
    }
    return switch (flag.trim().toLowerCase(Locale.ROOT)) {
      case "real" -> REAL;
      case "fallback" -> FALLBACK;
      default -> UNKNOWN;
    };
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
