package com.perizia.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * 定时任务与本地任务线程池配置
 *
 * @author perizia
 * @since 2025-03-04
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {

    public static final String PIPELINE_TASK_EXECUTOR = "pipelineTaskExecutor";

    /**
     * 本地模式执行任务的线程池，每个任务在自己的线程上开启自己的事务和连接
     */
    @Bean(name = PIPELINE_TASK_EXECUTOR)
    public ThreadPoolTaskExecutor pipelineTaskExecutor(PipelineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getLocalWorkers());
        executor.setMaxPoolSize(properties.getLocalWorkers());
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
