package climate.layer.global.error;

import climate.layer.error.CommonErrorCode;
import climate.layer.error.dto.ErrorResponse;
import climate.layer.error.exception.base.BaseException;
import climate.layer.error.exception.base.ServerBaseException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /** 비즈니스 예외 (동적 메시지 포함) */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
    if (e instanceof ServerBaseException) {
      log.error(
          "Server Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage(), e);
    } else {
      log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    }
    return ErrorResponse.toResponseEntity(e);
  }

  /** @Valid 검증 실패 */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  protected ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    String detail =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    log.warn("Validation Failed: {}", detail);
    return ErrorResponse.toResponseEntity(CommonErrorCode.INVALID_INPUT_VALUE, detail);
  }

  /** 요청 본문을 읽을 수 없는 경우 (잘못된 JSON 등) */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  protected ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
    log.warn("Unreadable Request Body: {}", e.getMessage());
    return ErrorResponse.toResponseEntity(CommonErrorCode.INVALID_INPUT_VALUE, "malformed body");
  }

  /** 예측하지 못한 시스템 예외. 상세 메시지는 응답에 노출하지 않습니다. */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    log.error("Unexpected System Failure: ", e);
    return ErrorResponse.toResponseEntity(
        CommonErrorCode.INTERNAL_SERVER_ERROR, e.getClass().getSimpleName());
  }
}
