package com.perizia.service.llm;

/**
 * 报告生成结果
 *
 * @param text  生成的报告文本
 * @param usage 用量
 */
public record GenerationResult(String text, TokenUsage usage) {
}
