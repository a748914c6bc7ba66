package com.perizia.Exception;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 统一错误响应体
 *
 * @author perizia
 * @since 2025-03-02
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private int code;

    private String message;

    private long timestamp;

    public static ErrorResponse of(int code, String message) {
        return new ErrorResponse(code, message, System.currentTimeMillis());
    }
}
