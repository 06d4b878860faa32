package climate.layer.infrastructure.cache;

import climate.layer.domain.model.cache.CacheKey;
import climate.layer.error.exception.InvalidInputException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.Map;

/**
 * 파라미터 맵을 정규화하여 캐시 키를 생성
 *
 * <p>맵 키는 (중첩 맵 포함) 사전순으로 정렬되어 직렬화되므로 삽입 순서가 달라도 같은 키가 만들어집니다. 숫자 2050 과 문자열 "2050" 은 서로
 * 다른 키입니다.
 */
public class CacheKeyFactory {

  private final ObjectMapper canonicalMapper;

  public CacheKeyFactory(ObjectMapper objectMapper) {
    this.canonicalMapper =
        objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
  }

  public CacheKey keyFor(String layerId, Map<String, ?> params) {
    return CacheKey.of(layerId, canonicalize(params));
  }

  private String canonicalize(Map<String, ?> params) {
    if (params == null || params.isEmpty()) {
      return "{}";
    }
    try {
      return canonicalMapper.writeValueAsString(params);
    } catch (JsonProcessingException e) {
      throw new InvalidInputException("params 를 직렬화할 수 없습니다", e);
    }
  }
}
