package com.perizia.service.llm;

/**
 * 提供方原始返回，用量字段可能缺失
 *
 * @param text              生成文本
 * @param inputTokens       输入 Token 数
 * @param outputTokens      输出 Token 数
 * @param cachedInputTokens 命中缓存的输入 Token 数
 */
public record LlmResponse(String text, Integer inputTokens, Integer outputTokens, Integer cachedInputTokens) {

    public static LlmResponse ofText(String text) {
        return new LlmResponse(text, null, null, null);
    }
}
