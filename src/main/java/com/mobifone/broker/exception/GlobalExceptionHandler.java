package com.mobifone.broker.exception;

import com.mobifone.broker.dto.response.ResultEnvelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(value = Exception.class)
    ResponseEntity<ResultEnvelope> handlingRuntimeException(Exception exception) {
        log.error("Exception: ", exception);
        ErrorCode errorCode = ErrorCode.UNCATEGORIZED_EXCEPTION;
        return ResponseEntity.status(errorCode.getStatusCode()).body(ResultEnvelope.error(errorCode));
    }

    @ExceptionHandler(value = AppException.class)
    ResponseEntity<ResultEnvelope> handlingAppException(AppException exception) {
        ErrorCode errorCode = exception.getErrorCode();
        log.info("Request failed with {}", errorCode);
        return ResponseEntity.status(errorCode.getStatusCode()).body(ResultEnvelope.error(errorCode));
    }

    @ExceptionHandler(value = AccessDeniedException.class)
    ResponseEntity<ResultEnvelope> handlingAccessDeniedException(AccessDeniedException exception) {
        ErrorCode errorCode = ErrorCode.UNAUTHORIZED;
        return ResponseEntity.status(errorCode.getStatusCode()).body(ResultEnvelope.error(errorCode));
    }

    @ExceptionHandler(value = {MethodArgumentNotValidException.class, MissingServletRequestParameterException.class})
    ResponseEntity<ResultEnvelope> handlingValidation(Exception exception) {
        log.info("Invalid request: {}", exception.getMessage());
        ErrorCode errorCode = ErrorCode.INVALID_REQUEST;
        return ResponseEntity.status(errorCode.getStatusCode()).body(ResultEnvelope.error(errorCode));
    }
}
