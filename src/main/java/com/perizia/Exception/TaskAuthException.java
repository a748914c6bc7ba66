package com.perizia.Exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 任务回调身份校验失败
 *
 * @author perizia
 * @since 2025-03-03
 */
@Getter
public class TaskAuthException extends RuntimeException {

    private final HttpStatus status;

    public TaskAuthException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public static TaskAuthException unauthorized(String message) {
        return new TaskAuthException(HttpStatus.UNAUTHORIZED, message);
    }

    public static TaskAuthException forbidden(String message) {
        return new TaskAuthException(HttpStatus.FORBIDDEN, message);
    }
}
