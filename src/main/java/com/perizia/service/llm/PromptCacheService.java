package com.perizia.service.llm;

import com.perizia.Exception.LlmProviderException;
import com.perizia.config.LlmProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 系统指令的提示词缓存
 * 每个模型持有一个缓存引用，过期或被判定失效后重建；创建失败时按"无缓存"处理
 *
 * @author perizia
 * @since 2025-03-06
 */
@Slf4j
@Service
public class PromptCacheService {

    private record CacheEntry(String model, String ref, Instant expiresAt) {
    }

    private final LlmProvider provider;

    private final LlmProperties llmProperties;

    private final Clock clock;

    private final AtomicReference<CacheEntry> current = new AtomicReference<>();

    public PromptCacheService(LlmProvider provider, LlmProperties llmProperties, Clock clock) {
        this.provider = provider;
        this.llmProperties = llmProperties;
        this.clock = clock;
    }

    /**
     * 取得模型可用的缓存引用，必要时创建
     */
    public Optional<String> getOrCreate(String model, String systemInstruction) {
        Instant now = clock.instant();
        CacheEntry entry = current.get();
        if (entry != null && entry.model().equals(model) && now.isBefore(entry.expiresAt())) {
            return Optional.of(entry.ref());
        }
        synchronized (this) {
            entry = current.get();
            if (entry != null && entry.model().equals(model) && now.isBefore(entry.expiresAt())) {
                return Optional.of(entry.ref());
            }
            try {
                Optional<String> ref = provider.createCache(model, systemInstruction, llmProperties.getCacheTtl());
                ref.ifPresentOrElse(
                    r -> {
                        // 提前一分钟视为过期，避免调用途中缓存失效
                        Instant expiresAt = now.plus(llmProperties.getCacheTtl()).minusSeconds(60);
                        current.set(new CacheEntry(model, r, expiresAt));
                        log.info("提示词缓存已创建: model={}, ref={}, expiresAt={}", model, r, expiresAt);
                    },
                    () -> current.set(null));
                return ref;
            } catch (LlmProviderException e) {
                log.warn("提示词缓存创建失败，本次不使用缓存: model={}, code={}", model, e.getCode(), e);
                current.set(null);
                return Optional.empty();
            }
        }
    }

    /**
     * 缓存被提供方拒绝后调用，下次重建
     */
    public void invalidate(String ref) {
        CacheEntry entry = current.get();
        if (entry != null && entry.ref().equals(ref) && current.compareAndSet(entry, null)) {
            log.info("提示词缓存已失效: ref={}", ref);
        }
    }
}
