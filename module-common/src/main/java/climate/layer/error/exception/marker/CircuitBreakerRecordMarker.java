package climate.layer.error.exception.marker;

/**
 * 서킷 브레이커가 실패로 집계해야 하는 예외 표식.
 *
 * <p>업스트림이 실제로 응답하지 못했거나(네트워크, 타임아웃, 5xx) 요청 자체를 거부한 경우에 붙입니다.
 */
public interface CircuitBreakerRecordMarker {}
