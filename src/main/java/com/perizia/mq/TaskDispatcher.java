package com.perizia.mq;

import com.perizia.model.dto.TaskPayload;

/**
 * 任务投递
 * local 模式在本进程线程池执行，queue 模式投递到 RabbitMQ，由配置 pipeline.task-mode 选择实现
 *
 * @author perizia
 * @since 2025-03-03
 */
public interface TaskDispatcher {

    /**
     * 投递任务，不阻塞调用方；queue 模式下投递失败直接抛出
     *
     * @param taskName 任务名称，须与载荷类型一致
     * @param payload  任务载荷
     */
    void enqueue(String taskName, TaskPayload payload);

    /**
     * 校验任务名称与载荷一致
     */
    static void checkTaskName(String taskName, TaskPayload payload) {
        if (payload == null || !payload.taskName().equals(taskName)) {
            throw new IllegalArgumentException("任务名称与载荷不一致: taskName=" + taskName
                + ", payload=" + (payload == null ? null : payload.getClass().getSimpleName()));
        }
    }
}
