package com.perizia.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Duration;

/**
 * 模型 HTTP 客户端超时配置
 * 整份报告一次生成，读取超时需要覆盖最长的一次调用
 *
 * @author perizia
 * @since 2025-03-06
 */
@Slf4j
@Configuration
public class OpenAiHttpClientConfig {

    @Value("${llm.connect-timeout:30s}")
    private Duration connectTimeout;

    @Value("${llm.read-timeout:600s}")
    private Duration readTimeout;

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        log.info("配置模型 HTTP 客户端超时: 连接超时={}, 读取超时={}", connectTimeout, readTimeout);
        return restClientBuilder -> restClientBuilder.requestFactory(clientHttpRequestFactory());
    }

    private ClientHttpRequestFactory clientHttpRequestFactory() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        return factory;
    }
}
