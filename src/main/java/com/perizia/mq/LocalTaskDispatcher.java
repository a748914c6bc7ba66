package com.perizia.mq;

import com.perizia.config.SchedulingConfig;
import com.perizia.model.dto.TaskPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

/**
 * 本地任务执行
 * 任务在线程池中执行，每个任务在自己的线程上开启事务，不与调用方共享数据库连接
 *
 * @author perizia
 * @since 2025-03-03
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "pipeline.task-mode", havingValue = "local", matchIfMissing = true)
public class LocalTaskDispatcher implements TaskDispatcher {

    private final TaskExecutor executor;

    /**
     * 处理器依赖本调度器（抽取完成后触发生成），延迟获取以避免循环依赖
     */
    private final ObjectProvider<TaskHandlerRegistry> handlerRegistry;

    public LocalTaskDispatcher(@Qualifier(SchedulingConfig.PIPELINE_TASK_EXECUTOR) TaskExecutor executor,
                               ObjectProvider<TaskHandlerRegistry> handlerRegistry) {
        this.executor = executor;
        this.handlerRegistry = handlerRegistry;
    }

    @Override
    public void enqueue(String taskName, TaskPayload payload) {
        TaskDispatcher.checkTaskName(taskName, payload);
        executor.execute(() -> {
            try {
                handlerRegistry.getObject().execute(payload);
            } catch (RuntimeException e) {
                // 本地模式没有队列重试，由定时发件箱和僵尸案件清理兜底
                log.error("本地任务执行失败: task={}, payload={}", taskName, payload, e);
            }
        });
        log.info("任务已提交到本地线程池: task={}, payload={}", taskName, payload);
    }
}
