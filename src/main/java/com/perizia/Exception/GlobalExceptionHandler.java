package com.perizia.Exception;

import cn.dev33.satoken.exception.NotLoginException;
import cn.dev33.satoken.exception.NotRoleException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import top.continew.starter.core.exception.BusinessException;

import java.util.stream.Collectors;

/**
 * 全局异常处理器
 *
 * @author perizia
 * @since 2025-03-02
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
        log.warn("业务异常: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * 任务端点身份校验失败，按 401/403 返回，队列据此停止重试
     */
    @ExceptionHandler(TaskAuthException.class)
    public ResponseEntity<ErrorResponse> handleTaskAuthException(TaskAuthException e) {
        log.warn("任务回调鉴权失败: status={}, reason={}", e.getStatus().value(), e.getMessage());
        return build(e.getStatus(), e.getMessage());
    }

    @ExceptionHandler(NotLoginException.class)
    public ResponseEntity<ErrorResponse> handleNotLoginException(NotLoginException e) {
        log.warn("未登录异常: {}", e.getMessage());
        String message = switch (e.getType()) {
            case NotLoginException.NOT_TOKEN -> "未提供认证令牌";
            case NotLoginException.INVALID_TOKEN -> "认证令牌无效";
            case NotLoginException.TOKEN_TIMEOUT -> "认证令牌已过期";
            default -> "请先登录";
        };
        return build(HttpStatus.UNAUTHORIZED, message);
    }

    @ExceptionHandler(NotRoleException.class)
    public ResponseEntity<ErrorResponse> handleNotRoleException(NotRoleException e) {
        log.warn("无角色权限: {}", e.getRole());
        return build(HttpStatus.FORBIDDEN, "无权访问");
    }

    /**
     * 参数校验与绑定异常（MethodArgumentNotValidException 是其子类）
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ErrorResponse> handleBindException(BindException e) {
        String message = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        log.warn("参数校验异常: {}", message);
        return build(HttpStatus.BAD_REQUEST, message);
    }

    /**
     * 请求体无法解析，重试也不会成功
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleNotReadable(HttpMessageNotReadableException e) {
        log.warn("请求体格式错误: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "请求体格式错误");
    }

    /**
     * 协调类错误，调用方可整体重试
     */
    @ExceptionHandler(CoordinationException.class)
    public ResponseEntity<ErrorResponse> handleCoordinationException(CoordinationException e) {
        log.warn("并发冲突: {}", e.getMessage(), e);
        return build(HttpStatus.CONFLICT, e.getMessage());
    }

    /**
     * 同步调用模型失败
     */
    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<ErrorResponse> handleGenerationException(GenerationException e) {
        log.error("模型生成失败: {}", e.getMessage(), e);
        return build(HttpStatus.BAD_GATEWAY, "报告生成失败,请稍后重试");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("系统异常: {}", e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "系统异常,请稍后重试");
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(status.value(), message));
    }
}
