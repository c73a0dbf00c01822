package com.bit.gauge.api;

import com.bit.gauge.exception.ErrorType;
import com.bit.gauge.exception.GaugeException;
import com.bit.gauge.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 把引擎异常统一转换为 Result 返回
 */
@Slf4j
@RestControllerAdvice(annotations = RestController.class)
public class GlobalExceptionHandler {

    @ExceptionHandler(GaugeException.class)
    public ResponseEntity<Result<Void>> handleGauge(GaugeException e) {
        ErrorType type = e.getErrorType();
        HttpStatus status;
        if (type == ErrorType.PERMISSION_DENIED) {
            status = HttpStatus.FORBIDDEN;
        } else if (type.getCode() < 5000) {
            status = HttpStatus.BAD_REQUEST;
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        log.info("请求被拒绝 {}: {}", type, e.getMessage());
        return ResponseEntity.status(status).body(Result.error(type.getCode(), e.getMessage()));
    }

    // 地址格式错误等
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Result<Void>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Result.error(HttpStatus.BAD_REQUEST.value(), e.getMessage()));
    }
}
