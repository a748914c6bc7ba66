package com.perizia.service.llm;

/**
 * Token 用量，缺失字段按 0 处理
 *
 * @param inputTokens       输入 Token 数
 * @param outputTokens      输出 Token 数
 * @param cachedInputTokens 命中缓存的输入 Token 数
 * @param model             实际生成文本的模型
 */
public record TokenUsage(int inputTokens, int outputTokens, int cachedInputTokens, String model) {

    public static TokenUsage from(LlmResponse response, String model) {
        if (response == null) {
            return new TokenUsage(0, 0, 0, model);
        }
        return new TokenUsage(
            orZero(response.inputTokens()),
            orZero(response.outputTokens()),
            orZero(response.cachedInputTokens()),
            model);
    }

    public int totalTokens() {
        return inputTokens + outputTokens;
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : Math.max(value, 0);
    }
}
