package climate.layer.application.port;

/**
 * Upstream Compute Port
 *
 * <h3>Role</h3>
 *
 * <p>Executes a layer computation on the upstream service and returns the raw JSON payload. The
 * payload is expected to carry {@code metadata.dataSource}; this port does not interpret it.
 *
 * <h3>Failure contract</h3>
 *
 * <p>Implementations throw only the typed upstream exceptions from the common error module:
 * TransientNetworkException, UpstreamTimeoutException, UpstreamErrorException or
 * UpstreamValidationException.
 */
public interface UpstreamComputePort {

  String compute(ComputeRequest request);
}
