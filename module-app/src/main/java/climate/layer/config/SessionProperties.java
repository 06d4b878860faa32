package climate.layer.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 세션 메모리 설정
 *
 * <pre>{@code
 * layer:
 *   session:
 *     debounce: 500ms
 *     directory: ./data/session   # 비워 두면 프로세스 메모리만 사용
 *     storage-key: climate-suite-orchestrator-memory
 * }</pre>
 */
@Validated
@ConfigurationProperties(prefix = "layer.session")
public record SessionProperties(
    @DefaultValue("500ms") Duration debounce,
    String directory,
    @DefaultValue("climate-suite-orchestrator-memory") @NotBlank String storageKey) {

  public SessionProperties {
    if (debounce.isNegative()) {
      throw new IllegalArgumentException("layer.session.debounce must not be negative");
    }
  }

  public boolean hasDirectory() {
    return directory != null && !directory.isBlank();
  }
}
