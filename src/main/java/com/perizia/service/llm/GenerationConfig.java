package com.perizia.service.llm;

/**
 * 单次模型调用的参数
 *
 * @param cacheRef        提示词缓存引用，为空表示不使用缓存
 * @param temperature     温度
 * @param maxOutputTokens 最大输出 Token 数
 */
public record GenerationConfig(String cacheRef, Double temperature, Integer maxOutputTokens) {

    public boolean hasCache() {
        return cacheRef != null;
    }
}
