package com.perizia.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 案件流水线配置
 *
 * @author perizia
 * @since 2025-03-03
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /**
     * 任务执行模式：local 本进程线程池执行，queue 投递到 RabbitMQ
     */
    private String taskMode = "local";

    /**
     * 本地模式线程池大小
     */
    private Integer localWorkers = 4;

    /**
     * 单个 worker 同时进行的抽取数
     */
    private Integer extractionConcurrency = 3;

    /**
     * 单个 worker 同时进行的模型调用数
     */
    private Integer generationConcurrency = 5;

    /**
     * 发件箱每批领取的消息数
     */
    private Integer outboxBatchSize = 10;

    /**
     * 卡住案件的判定超时
     */
    private Duration zombieTimeout = Duration.ofHours(2);

    /**
     * 是否定时执行僵尸案件清理，关闭时只能由管理员手动触发
     */
    private Boolean zombieSweepEnabled = false;

    /**
     * 抽取限制
     */
    private Extraction extraction = new Extraction();

    @Data
    public static class Extraction {

        /**
         * 单文件大小上限(MB)
         */
        private Integer maxFileSizeMb = 50;

        /**
         * 抽取文本最大长度
         */
        private Integer maxTextLength = 4_000_000;
    }
}
