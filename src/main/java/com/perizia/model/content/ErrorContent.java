package com.perizia.model.content;

import com.perizia.model.enums.ExtractionErrorType;

/**
 * 文档内部某一部分无法处理（如邮件附件过大），整体文档仍可成功
 *
 * @param filename  来源文件名
 * @param errorType 错误分类
 * @param message   面向用户的说明
 */
public record ErrorContent(String filename, ExtractionErrorType errorType, String message) implements ExtractedContent {
}
