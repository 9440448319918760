package com.turnhub.turnservice.common;

import com.turnhub.turnservice.common.error.TurnHubException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * 全局异常映射处理器。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 业务异常：按 ErrorKind 映射 HTTP 状态。
     * 服务端故障类（5xx）记 ERROR，其余记 WARN。
     */
    @ExceptionHandler(TurnHubException.class)
    public ResponseEntity<ApiResponse<Object>> business(TurnHubException e) {
        HttpStatus status = e.getKind().httpStatus();
        if (status.is5xxServerError()) {
            log.error("请求失败: kind={}, sessionId={}, msg={}", e.getKind(), e.getSessionId(), e.getMessage(), e);
        } else {
            log.warn("请求被拒绝: kind={}, sessionId={}, msg={}", e.getKind(), e.getSessionId(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ApiResponse.error(e.getKind(), e.getMessage()));
    }

    /**
     * 请求体校验失败（@Valid）。
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> invalidBody(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .map(f -> f + " 不合法")
                .collect(Collectors.joining("; "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(msg));
    }

    /**
     * 处理参数不合法异常（IllegalArgumentException）。
     * @return HTTP 400（Bad Request），响应体为异常信息
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 处理非法状态异常（IllegalStateException）。
     * @return HTTP 409（Conflict），响应体为异常信息
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }
}
