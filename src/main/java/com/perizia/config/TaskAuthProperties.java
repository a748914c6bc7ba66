package com.perizia.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 任务回调身份令牌配置
 *
 * @author perizia
 * @since 2025-03-03
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "task.auth")
public class TaskAuthProperties {

    /**
     * HS256 签名密钥
     */
    private String secret;

    /**
     * 令牌受众，即本服务任务端点的地址
     */
    private String audience = "perizia-tasks";

    /**
     * 本服务投递任务时使用的身份
     */
    private String issuerIdentity = "perizia-worker";

    /**
     * 允许调用任务端点的服务身份
     */
    private List<String> allowedIdentities = new ArrayList<>(List.of("perizia-worker"));

    /**
     * 签发令牌的有效期
     */
    private Duration tokenTtl = Duration.ofMinutes(30);
}
