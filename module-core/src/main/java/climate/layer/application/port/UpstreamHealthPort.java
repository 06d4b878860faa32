package climate.layer.application.port;

import java.time.Duration;

/** Lightweight liveness probe against the upstream service. */
public interface UpstreamHealthPort {

  /**
   * Sends a single health request.
   *
   * @throws RuntimeException when the upstream is unreachable or unhealthy
   */
  void ping(Duration timeout);
}
