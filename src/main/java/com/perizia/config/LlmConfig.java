package com.perizia.config;

import com.perizia.service.llm.RetryPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 模型调用相关 Bean
 *
 * @author perizia
 * @since 2025-03-06
 */
@Configuration
public class LlmConfig {

    /**
     * 提供方调用的重试策略，只重试瞬时错误
     */
    @Bean
    public RetryPolicy providerRetryPolicy(LlmProperties llmProperties) {
        return RetryPolicy.transientProviderErrors(
            llmProperties.getRetryAttempts(),
            llmProperties.getRetryInitialInterval(),
            llmProperties.getRetryMaxInterval());
    }
}
