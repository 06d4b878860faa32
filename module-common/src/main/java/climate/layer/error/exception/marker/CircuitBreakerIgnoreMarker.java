package climate.layer.error.exception.marker;

/**
 * 서킷 브레이커가 집계하지 않아야 하는 예외 표식.
 *
 * <p>서킷 자체가 던지는 차단 예외나 호출자 쪽 취소처럼 업스트림 건강 상태와 무관한 실패에 붙입니다.
 */
public interface CircuitBreakerIgnoreMarker {}
