package climate.layer.error.dto;

import climate.layer.error.ErrorCode;
import climate.layer.error.exception.base.BaseException;
import java.time.LocalDateTime;
import org.springframework.http.ResponseEntity;

public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

  public static ErrorResponseBuilder builder() {
    return new ErrorResponseBuilder();
  }

  public static class ErrorResponseBuilder {
    private Integer status;
    private String code;
    private String message;
    private LocalDateTime timestamp;

    public ErrorResponseBuilder status(int status) {
      this.status = status;
      return this;
    }

    public ErrorResponseBuilder code(String code) {
      this.code = code;
      return this;
    }

    public ErrorResponseBuilder message(String message) {
      this.message = message;
      return this;
    }

    public ErrorResponseBuilder timestamp(LocalDateTime timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public ErrorResponse build() {
      return new ErrorResponse(
          status != null ? status : 500,
          code != null ? code : "E000",
          message != null ? message : "Unknown error",
          timestamp != null ? timestamp : LocalDateTime.now());
    }
  }

  /**
   * 비즈니스 예외로부터 생성 (동적 메시지)
   *
   * <p>e.getMessage() 로 가공된 메시지(예: 어떤 레이어가 없는지)를 그대로 전달합니다.
   */
  public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
    ErrorCode errorCode = e.getErrorCode();
    return ResponseEntity.status(errorCode.getStatus())
        .body(
            ErrorResponse.builder()
                .status(errorCode.getStatus().value())
                .code(errorCode.getCode())
                .message(e.getMessage())
                .timestamp(LocalDateTime.now())
                .build());
  }

  /**
   * ErrorCode 로부터 생성 (정적 메시지)
   *
   * <p>상세 원인은 응답에 노출하지 않고 args 로 전달된 요약만 메시지에 채웁니다.
   */
  public static ResponseEntity<ErrorResponse> toResponseEntity(
      ErrorCode errorCode, Object... args) {
    return ResponseEntity.status(errorCode.getStatus())
        .body(
            ErrorResponse.builder()
                .status(errorCode.getStatus().value())
                .code(errorCode.getCode())
                .message(String.format(errorCode.getMessage(), args))
                .timestamp(LocalDateTime.now())
                .build());
  }
}
