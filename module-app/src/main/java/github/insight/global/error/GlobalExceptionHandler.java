package github.insight.global.error;

import github.insight.error.CommonErrorCode;
import github.insight.error.dto.ErrorResponse;
import github.insight.error.exception.InvalidInputValueException;
import github.insight.error.exception.base.BaseException;
import github.insight.error.exception.base.ServerBaseException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.core.MethodParameter;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.method.ParameterValidationResult;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /** 비즈니스 예외. 가공된 메시지(예: 어떤 리소스가 없는지)를 그대로 내려줍니다. */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
    if (e instanceof ServerBaseException) {
      log.error("Server Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage(), e);
    } else {
      log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    }
    return ErrorResponse.toResponseEntity(e);
  }

  /** 컨트롤러 파라미터 제약 위반 (@Min, @Max, @Pattern, @NotBlank) */
  @ExceptionHandler(HandlerMethodValidationException.class)
  protected ResponseEntity<ErrorResponse> handleMethodValidation(
      HandlerMethodValidationException e) {
    String detail =
        e.getAllValidationResults().stream()
            .map(GlobalExceptionHandler::describe)
            .collect(Collectors.joining(", "));
    return invalidInput(detail);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  protected ResponseEntity<ErrorResponse> handleConstraintViolation(
      ConstraintViolationException e) {
    String detail =
        e.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .collect(Collectors.joining(", "));
    return invalidInput(detail);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  protected ResponseEntity<ErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException e) {
    return invalidInput(e.getParameterName() + " 파라미터가 필요합니다");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  protected ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
    return invalidInput(e.getName() + "=" + e.getValue());
  }

  /** 예측하지 못한 시스템 예외. 상세 메시지는 숨기고 공통 코드만 내려줍니다. */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    log.error("Unexpected System Failure: ", e);
    return ErrorResponse.toResponseEntity(CommonErrorCode.INTERNAL_SERVER_ERROR);
  }

  private ResponseEntity<ErrorResponse> invalidInput(String detail) {
    InvalidInputValueException exception = new InvalidInputValueException(detail);
    log.warn("Invalid Input: {}", exception.getMessage());
    return ErrorResponse.toResponseEntity(exception);
  }

  private static String describe(ParameterValidationResult result) {
    String messages =
        result.getResolvableErrors().stream()
            .map(MessageSourceResolvable::getDefaultMessage)
            .collect(Collectors.joining("; "));
    return parameterName(result.getMethodParameter()) + " " + messages;
  }

  private static String parameterName(MethodParameter parameter) {
    RequestParam requestParam = parameter.getParameterAnnotation(RequestParam.class);
    if (requestParam != null && !requestParam.name().isEmpty()) {
      return requestParam.name();
    }
    String name = parameter.getParameterName();
    return name != null ? name : "arg" + parameter.getParameterIndex();
  }
}
