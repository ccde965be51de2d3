package com.sutdahub.gameservice.common;

import com.sutdahub.gameservice.common.error.SutdaException;
import com.sutdahub.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
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
     * 处理引擎业务异常：按 ErrorCode 映射 HTTP 状态。
     * 400：参数不合法 / 余额不足；404：对局或玩家不存在；409：回合 / 状态 / 并发冲突。
     * @param e 业务异常
     * @return 对应状态码，响应体携带业务错误码与消息
     */
    @ExceptionHandler(SutdaException.class)
    public ResponseEntity<ApiResponse<Object>> business(SutdaException e) {
        int status = e.getCode().httpStatus();
        log.debug("业务异常: code={}, msg={}", e.getCode(), e.getMessage());
        return ResponseEntity.status(status).body(ApiResponse.error(status, e.getCode().name(), e.getMessage()));
    }

    /**
     * 处理 @Valid 请求体校验失败。
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> invalidBody(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(msg));
    }

    /**
     * 请求体无法解析（JSON 格式错误、未知枚举值等）。
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> unreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest("请求体格式错误"));
    }

    /**
     * 处理参数不合法异常（IllegalArgumentException）。
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 兜底：MVC 自带的请求类异常保留其状态码；
     * 其余未预期异常记录堆栈，响应体不暴露内部信息。
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> unexpected(Exception e) {
        if (e instanceof ErrorResponse er) {
            int status = er.getStatusCode().value();
            return ResponseEntity.status(status).body(ApiResponse.error(status, "REQUEST", e.getMessage()));
        }
        log.error("未处理异常", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.serverError("服务器内部错误"));
    }
}
