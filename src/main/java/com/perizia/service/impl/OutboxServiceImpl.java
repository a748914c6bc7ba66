package com.perizia.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perizia.mapper.OutboxMessageMapper;
import com.perizia.model.dto.GenerateReportPayload;
import com.perizia.model.dto.TaskNames;
import com.perizia.model.dto.TaskPayload;
import com.perizia.model.entity.OutboxMessageDO;
import com.perizia.service.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 发件箱写入实现
 *
 * @author perizia
 * @since 2025-03-04
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxServiceImpl implements OutboxService {

    private final OutboxMessageMapper outboxMessageMapper;

    private final ObjectMapper objectMapper;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Long enqueue(String topic, Long tenantId, TaskPayload payload) {
        OutboxMessageDO message = OutboxMessageDO.pending(topic, tenantId, writePayload(payload));
        outboxMessageMapper.insert(message);
        log.info("写入发件箱消息: id={}, topic={}, tenantId={}", message.getId(), topic, tenantId);
        return message.getId();
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Long enqueueGeneration(Long caseId, Long tenantId) {
        return enqueue(TaskNames.GENERATE_REPORT, tenantId, new GenerateReportPayload(caseId, tenantId));
    }

    @Override
    public TaskPayload readPayload(String json) {
        try {
            return objectMapper.readValue(json, TaskPayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("发件箱消息体无法解析: " + e.getOriginalMessage(), e);
        }
    }

    private String writePayload(TaskPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("发件箱消息体序列化失败", e);
        }
    }
}
