package com.perizia.Exception;

import com.perizia.model.enums.ExtractionErrorType;
import lombok.Getter;

/**
 * 文档抽取失败，携带面向用户的错误分类
 *
 * @author perizia
 * @since 2025-03-03
 */
@Getter
public class ExtractionException extends RuntimeException {

    private final ExtractionErrorType errorType;

    public ExtractionException(ExtractionErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public ExtractionException(ExtractionErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }
}
