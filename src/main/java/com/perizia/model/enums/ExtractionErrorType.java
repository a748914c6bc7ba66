package com.perizia.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 文档抽取错误分类（面向用户）
 *
 * @author perizia
 * @since 2025-03-03
 */
@Getter
@AllArgsConstructor
public enum ExtractionErrorType {

    CORRUPT_FILE("文件已损坏或无法读取"),

    UNSUPPORTED_TYPE("不支持的文件类型"),

    OVERSIZED("文件过大，超出处理上限"),

    ENCODING("文件编码无法识别"),

    GENERIC("文档处理失败，请稍后重试");

    private final String userMessage;
}
