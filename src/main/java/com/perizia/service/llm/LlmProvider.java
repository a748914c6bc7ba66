package com.perizia.service.llm;

import com.perizia.Exception.LlmProviderException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 模型提供方
 * 所有方法失败时抛出 {@link LlmProviderException}
 *
 * @author perizia
 * @since 2025-03-06
 */
public interface LlmProvider {

    LlmResponse generate(String model, List<PromptPart> parts, GenerationConfig config);

    /**
     * 为系统指令创建提示词缓存
     *
     * @return 缓存引用，提供方不支持缓存时为空
     */
    Optional<String> createCache(String model, String systemInstruction, Duration ttl);

    /**
     * 通过侧通道上传大文件，返回提供方文件引用
     */
    String uploadFile(String storageRef, String mimeType);

    void deleteFile(String fileRef);
}
