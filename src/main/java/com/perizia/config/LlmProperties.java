package com.perizia.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 报告生成模型配置
 *
 * @author perizia
 * @since 2025-03-06
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "llm")
public class LlmProperties {

    /**
     * 主模型
     */
    private String model = "gpt-4o";

    /**
     * 主模型过载时切换的备用模型，留空表示不切换
     */
    private String fallbackModel = "gpt-4o-mini";

    /**
     * 初步报告使用的模型
     */
    private String preliminaryModel = "gpt-4o-mini";

    /**
     * 温度(0.0-2.0)
     */
    private Double temperature = 0.5;

    /**
     * 最大输出 Token 数
     */
    private Integer maxTokens = 16000;

    /**
     * 单次调用(含重试)内的最大尝试次数
     */
    private Integer retryAttempts = 3;

    /**
     * 首次重试等待
     */
    private Duration retryInitialInterval = Duration.ofSeconds(2);

    /**
     * 重试等待上限
     */
    private Duration retryMaxInterval = Duration.ofSeconds(10);

    /**
     * 提示词缓存有效期
     */
    private Duration cacheTtl = Duration.ofDays(2);
}
