package com.perizia.service;

import com.perizia.model.dto.TaskPayload;

/**
 * 发件箱主题处理器
 *
 * @author perizia
 * @since 2025-03-04
 */
public interface OutboxHandler {

    /**
     * 负责的主题
     */
    String topic();

    /**
     * 处理消息，失败时抛出异常
     */
    void handle(TaskPayload payload);
}
