package climate.layer.config;

import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 레이어 캐시 설정
 *
 * <pre>{@code
 * layer:
 *   cache:
 *     memory-max-entries: 10000
 *     durable-directory: ./data/layer-cache   # 비워 두면 프로세스 메모리만 사용
 *     default-ttl: 1h
 * }</pre>
 */
@Validated
@ConfigurationProperties(prefix = "layer.cache")
public record CacheProperties(
    @DefaultValue("10000") @Min(1) long memoryMaxEntries,
    String durableDirectory,
    @DefaultValue("1h") Duration defaultTtl) {

  public boolean hasDurableDirectory() {
    return durableDirectory != null && !durableDirectory.isBlank();
  }
}
