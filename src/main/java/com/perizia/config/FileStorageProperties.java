package com.perizia.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 文件存储配置
 *
 * @author perizia
 * @since 2025-03-02
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "file.storage")
public class FileStorageProperties {

    /**
     * 本地存储基础路径
     */
    private String basePath = "./storage";

    /**
     * 签名下载链接的对外地址
     */
    private String publicBaseUrl = "http://localhost:8080";

    /**
     * 签名下载链接的 HMAC 密钥
     */
    private String signingSecret;

    /**
     * 报告下载链接有效期
     */
    private Duration downloadUrlTtl = Duration.ofMinutes(15);
}
