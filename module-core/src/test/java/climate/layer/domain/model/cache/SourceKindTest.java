package climate.layer.domain.model.cache;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

class SourceKindTest {

  @ParameterizedTest
  @CsvSource({
    "real, REAL",
    "REAL, REAL",
    "fallback, FALLBACK",
    " Fallback , FALLBACK",
    "mock, UNKNOWN"
  })
  void parsesFlag(String flag, SourceKind expected) {
    assertThat(SourceKind.fromFlag(flag)).isEqualTo(expected);
  }

  @ParameterizedTest
  @NullAndEmptySource
  void absentFlagIsUnknown(String flag) {
    assertThat(SourceKind.fromFlag(flag)).isEqualTo(SourceKind.UNKNOWN);
  }
}
