package climate.layer.domain.model.circuit;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of one endpoint's circuit.
 *
 * @param openDuration cool-down applied the next time (or currently) the circuit is open
 */
public record CircuitState(
    String endpointId,
    CircuitStatus state,
    int consecutiveFailures,
    Instant lastFailureAt,
    Instant nextRetryAt,
    Duration openDuration) {}
