package climate.layer.global.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 레이어 API 응답 래퍼
 *
 * <p>{@code success} 는 요청 처리 여부만 나타냅니다. 업스트림 실패, Open 서킷, 검증 실패 같은 레이어 단위 오류는 요청 오류가 아니라
 * 레이어 상태이므로 {@code success=true} 와 함께 {@code LayerState.status = ERROR}, {@code lastError} 로 전달되고,
 * 직전 데이터가 있으면 그대로 남아 있습니다.
 *
 * <p>알 수 없는 layerId, 잘못된 본문처럼 요청 자체가 처리되지 못한 경우에는 이 래퍼 대신 {@code GlobalExceptionHandler} 가
 * {@code ErrorResponse} 를 반환합니다.
 *
 * @param <T> 레이어 상태, 카탈로그, 세션 스냅샷 등 응답 본문 타입
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data) {

  public static <T> ApiResponse<T> success(T data) {
    return new ApiResponse<>(true, data);
  }
}
