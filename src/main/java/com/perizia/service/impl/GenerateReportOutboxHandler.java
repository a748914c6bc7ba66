package com.perizia.service.impl;

import com.perizia.model.dto.GenerateReportPayload;
import com.perizia.model.dto.TaskNames;
import com.perizia.model.dto.TaskPayload;
import com.perizia.mq.TaskDispatcher;
import com.perizia.service.OutboxHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * generate-report 主题：投递报告生成任务
 *
 * @author perizia
 * @since 2025-03-04
 */
@Component
@RequiredArgsConstructor
public class GenerateReportOutboxHandler implements OutboxHandler {

    private final TaskDispatcher taskDispatcher;

    @Override
    public String topic() {
        return TaskNames.GENERATE_REPORT;
    }

    @Override
    public void handle(TaskPayload payload) {
        if (!(payload instanceof GenerateReportPayload)) {
            throw new IllegalArgumentException("generate-report 消息体类型错误: " + payload);
        }
        taskDispatcher.enqueue(TaskNames.GENERATE_REPORT, payload);
    }
}
