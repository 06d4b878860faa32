package climate.layer.infrastructure.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import climate.layer.domain.model.circuit.CircuitState;
import climate.layer.domain.model.circuit.CircuitStatus;
import climate.layer.error.exception.CircuitOpenException;
import climate.layer.error.exception.RequestSupersededException;
import climate.layer.error.exception.UpstreamErrorException;
import climate.layer.infrastructure.resilience.EndpointCircuit.Permit;
import climate.layer.infrastructure.support.MutableClock;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("EndpointCircuit 상태 전이 테스트")
class EndpointCircuitTest {

  private MutableClock clock;
  private List<CircuitStatus> transitions;
  private EndpointCircuit circuit;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    transitions = new ArrayList<>();
    ReliabilityProperties properties =
        new ReliabilityProperties(
            5,
            Duration.ofSeconds(5),
            Duration.ofSeconds(60),
            5,
            Duration.ofMillis(1),
            2.0,
            0,
            Duration.ofMillis(10),
            Duration.ofSeconds(1));
    CircuitBreaker breaker =
        CircuitBreaker.of("earth-engine", EndpointCircuit.circuitBreakerConfig(properties, clock));
    circuit =
        new EndpointCircuit(
            breaker,
            EndpointCircuit.openInterval(properties),
            clock,
            (id, to) -> transitions.add(to));
  }

  private static UpstreamErrorException serverError() {
    return new UpstreamErrorException(500, "internal error");
  }

  private void fail(int times) {
    for (int i = 0; i < times; i++) {
      circuit.onFailure(circuit.acquire(), serverError());
    }
  }

  private void openAndExpire() {
    fail(5);
    passCooldown();
  }

  // Open 대기는 nextRetryAt 이후(초과)에 끝난다
  private void passCooldown() {
    clock.advance(circuit.snapshot().openDuration().plusMillis(1));
  }

  @Test
  @DisplayName("연속 실패 4회까지는 Closed 유지")
  void staysClosedBelowThreshold() {
    fail(4);

    assertThat(circuit.snapshot().state()).isEqualTo(CircuitStatus.CLOSED);
    assertThat(circuit.snapshot().consecutiveFailures()).isEqualTo(4);
  }

  @Test
  @DisplayName("성공은 연속 실패 카운트를 초기화")
  void successResetsCount() {
    fail(4);
    circuit.onSuccess(circuit.acquire());
    fail(4);

    assertThat(circuit.snapshot().state()).isEqualTo(CircuitStatus.CLOSED);
    assertThat(circuit.snapshot().consecutiveFailures()).isEqualTo(4);
  }

  @Test
  @DisplayName("연속 실패 5회에 Open, nextRetryAt = now + 초기 쿨다운")
  void opensAtThreshold() {
    fail(5);

    CircuitState state = circuit.snapshot();
    assertThat(state.state()).isEqualTo(CircuitStatus.OPEN);
    assertThat(state.consecutiveFailures()).isEqualTo(5);
    assertThat(state.nextRetryAt()).isEqualTo(clock.instant().plusSeconds(5));
    assertThat(transitions).containsExactly(CircuitStatus.OPEN);
  }

  @Test
  @DisplayName("Open 상태에서는 쿨다운 동안 즉시 거부")
  void rejectsWhileOpen() {
    fail(5);
    clock.advance(Duration.ofSeconds(4));

    assertThatThrownBy(circuit::acquire)
        .isInstanceOf(CircuitOpenException.class)
        .extracting("retryAt")
        .isEqualTo(circuit.snapshot().nextRetryAt());
  }

  @Nested
  @DisplayName("HalfOpen")
  class HalfOpen {

    @Test
    @DisplayName("쿨다운 경과 후 정확히 하나의 시험 호출만 허용")
    void singleTrialCall() {
      openAndExpire();

      circuit.acquire();

      assertThat(circuit.snapshot().state()).isEqualTo(CircuitStatus.HALF_OPEN);
      assertThatThrownBy(circuit::acquire).isInstanceOf(CircuitOpenException.class);
    }

    @Test
    @DisplayName("시험 호출 성공 시 Closed, 실패 카운트 초기화")
    void trialSuccessCloses() {
      openAndExpire();
      Permit trial = circuit.acquire();

      circuit.onSuccess(trial);

      CircuitState state = circuit.snapshot();
      assertThat(state.state()).isEqualTo(CircuitStatus.CLOSED);
      assertThat(state.consecutiveFailures()).isZero();
      assertThat(transitions)
          .containsExactly(CircuitStatus.OPEN, CircuitStatus.HALF_OPEN, CircuitStatus.CLOSED);
    }

    @Test
    @DisplayName("시험 호출 실패 시 Open 복귀 + 쿨다운 2배")
    void trialFailureDoublesCooldown() {
      openAndExpire();
      Permit trial = circuit.acquire();

      circuit.onFailure(trial, serverError());

      CircuitState state = circuit.snapshot();
      assertThat(state.state()).isEqualTo(CircuitStatus.OPEN);
      assertThat(state.openDuration()).isEqualTo(Duration.ofSeconds(10));
      assertThat(state.nextRetryAt()).isEqualTo(clock.instant().plusSeconds(10));
    }

    @Test
    @DisplayName("쿨다운은 최대값에서 더 늘지 않는다")
    void cooldownCapped() {
      openAndExpire();
      for (int i = 0; i < 6; i++) {
        circuit.onFailure(circuit.acquire(), serverError());
        passCooldown();
      }

      assertThat(circuit.snapshot().openDuration()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("집계 제외 예외는 시험 호출 슬롯을 반납한다")
    void ignoredFailureReleasesTrialSlot() {
      openAndExpire();
      Permit trial = circuit.acquire();

      circuit.onFailure(trial, new RequestSupersededException("earth-engine:2024-01"));

      circuit.acquire();
      assertThat(circuit.snapshot().state()).isEqualTo(CircuitStatus.HALF_OPEN);
    }

    @Test
    @DisplayName("Open 이전에 허가된 느린 호출의 실패는 시험 호출 결과로 집계하지 않는다")
    void staleFailureDoesNotReopen() {
      Permit slow = circuit.acquire();
      openAndExpire();
      Permit trial = circuit.acquire();

      circuit.onFailure(slow, serverError());

      assertThat(circuit.snapshot().state()).isEqualTo(CircuitStatus.HALF_OPEN);
      circuit.onSuccess(trial);
      assertThat(circuit.snapshot().state()).isEqualTo(CircuitStatus.CLOSED);
      assertThat(transitions)
          .containsExactly(CircuitStatus.OPEN, CircuitStatus.HALF_OPEN, CircuitStatus.CLOSED);
    }

    @Test
    @DisplayName("Open 이전에 허가된 느린 호출의 성공은 서킷을 닫지 않는다")
    void staleSuccessDoesNotClose() {
      Permit slow = circuit.acquire();
      openAndExpire();
      Permit trial = circuit.acquire();

      circuit.onSuccess(slow);

      assertThat(circuit.snapshot().state()).isEqualTo(CircuitStatus.HALF_OPEN);
      circuit.onFailure(trial, serverError());
      assertThat(circuit.snapshot().state()).isEqualTo(CircuitStatus.OPEN);
    }
  }

  @Test
  @DisplayName("reset 은 Closed 와 초기 쿨다운으로 되돌린다")
  void resetRestoresInitialState() {
    openAndExpire();
    circuit.onFailure(circuit.acquire(), serverError());

    circuit.reset();

    CircuitState state = circuit.snapshot();
    assertThat(state.state()).isEqualTo(CircuitStatus.CLOSED);
    assertThat(state.openDuration()).isEqualTo(Duration.ofSeconds(5));
    assertThat(state.consecutiveFailures()).isZero();
    circuit.acquire();
  }
}
