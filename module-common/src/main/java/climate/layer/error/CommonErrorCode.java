package climate.layer.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
  UNKNOWN_LAYER("C002", "등록되지 않은 레이어입니다 (layerId: %s)", HttpStatus.NOT_FOUND),
  INVALID_SNAPSHOT("C003", "세션 스냅샷 형식이 올바르지 않습니다: %s", HttpStatus.BAD_REQUEST),
  UPSTREAM_VALIDATION_FAILED("C004", "업스트림 요청 파라미터 오류 (status: %s)", HttpStatus.BAD_REQUEST),
  REQUEST_SUPERSEDED("C005", "더 최신 요청으로 대체되었습니다 (key: %s)", HttpStatus.CONFLICT),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다: %s", HttpStatus.INTERNAL_SERVER_ERROR),
  DATA_PROCESSING_ERROR("S002", "데이터 처리 중 오류 발생 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  UPSTREAM_ERROR("S003", "업스트림 오류 응답 (status: %s)", HttpStatus.BAD_GATEWAY),
  UPSTREAM_TIMEOUT(
      "S004", "업스트림 응답 시간 초과 (endpoint: %s, timeout: %s)", HttpStatus.GATEWAY_TIMEOUT),
  UPSTREAM_NETWORK_ERROR("S005", "업스트림 네트워크 오류 (endpoint: %s)", HttpStatus.SERVICE_UNAVAILABLE),
  CIRCUIT_OPEN(
      "S006", "서킷이 열려 호출이 차단되었습니다 (endpoint: %s, retryAt: %s)", HttpStatus.SERVICE_UNAVAILABLE),
  CACHE_CORRUPTED("S007", "캐시 엔트리 손상 (key: %s)", HttpStatus.INTERNAL_SERVER_ERROR),
  SNAPSHOT_CORRUPTED("S008", "세션 스냅샷 손상 (%s)", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
