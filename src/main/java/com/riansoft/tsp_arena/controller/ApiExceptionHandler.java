package com.riansoft.tsp_arena.controller;

import com.riansoft.tsp_arena.dto.ErrorResponseDto;
import com.riansoft.tsp_arena.exception.ConfigurationException;
import com.riansoft.tsp_arena.exception.InvalidRouteException;
import com.riansoft.tsp_arena.exception.SearchBudgetException;
import com.riansoft.tsp_arena.exception.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 엔진 예외를 HTTP 상태와 {@code { "error": message }} 본문으로 바꿉니다.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidRouteException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidRoute(InvalidRouteException e) {
        log.info("[API] 잘못된 경로: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleSessionNotFound(SessionNotFoundException e) {
        log.info("[API] 세션 없음: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({ConfigurationException.class, SearchBudgetException.class})
    public ResponseEntity<ErrorResponseDto> handleMisconfiguration(RuntimeException e) {
        log.error("[API] 서버 설정 오류: {}", e.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request body.");
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponseDto> handleUnexpected(RuntimeException e) {
        log.error("[API] 처리되지 않은 오류", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private ResponseEntity<ErrorResponseDto> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorResponseDto(message));
    }
}
