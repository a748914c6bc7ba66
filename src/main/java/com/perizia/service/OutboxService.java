package com.perizia.service;

import com.perizia.model.dto.TaskPayload;

/**
 * 发件箱写入，须在触发状态变更的事务内调用
 *
 * @author perizia
 * @since 2025-03-04
 */
public interface OutboxService {

    /**
     * 写入一条待处理消息
     *
     * @param topic    主题
     * @param tenantId 租户ID，系统级消息为空
     * @param payload  消息体
     * @return 消息ID
     */
    Long enqueue(String topic, Long tenantId, TaskPayload payload);

    /**
     * 写入报告生成消息
     */
    Long enqueueGeneration(Long caseId, Long tenantId);

    TaskPayload readPayload(String json);
}
