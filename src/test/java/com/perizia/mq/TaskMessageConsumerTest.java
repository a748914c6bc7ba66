package com.perizia.mq;

import com.perizia.Exception.TaskAuthException;
import com.perizia.model.dto.GenerateReportPayload;
import com.perizia.model.dto.ProcessDocumentPayload;
import com.perizia.model.dto.TaskMessage;
import com.perizia.model.dto.TaskNames;
import com.perizia.model.dto.TaskPayload;
import com.perizia.service.TaskAuthService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskMessageConsumerTest {

    private TaskAuthService taskAuthService;

    private TaskHandlerRegistry registry;

    private TaskMessageConsumer consumer;

    @BeforeEach
    void setUp() {
        taskAuthService = mock(TaskAuthService.class);
        registry = mock(TaskHandlerRegistry.class);
        consumer = new TaskMessageConsumer(taskAuthService, registry);
        when(taskAuthService.verifyBearer("Bearer ok")).thenReturn("pipeline");
    }

    private static TaskMessage message(String taskName, TaskPayload payload) {
        return TaskMessage.builder()
            .taskName(taskName)
            .payload(payload)
            .enqueuedAt(0L)
            .build();
    }

    @Test
    void authenticatedMessageIsExecuted() {
        ProcessDocumentPayload payload = new ProcessDocumentPayload(11L, 7L);

        consumer.onMessage(message(TaskNames.PROCESS_DOCUMENT, payload), "Bearer ok");

        verify(registry).execute(payload);
    }

    @Test
    void unauthenticatedMessageIsRejectedWithoutRequeue() {
        when(taskAuthService.verifyBearer(null)).thenThrow(TaskAuthException.unauthorized("缺少令牌"));

        assertThatThrownBy(() -> consumer.onMessage(message(TaskNames.PROCESS_DOCUMENT, new ProcessDocumentPayload(11L, 7L)), null))
            .isInstanceOf(AmqpRejectAndDontRequeueException.class)
            .hasCauseInstanceOf(TaskAuthException.class);
        verify(registry, never()).execute(any());
    }

    @Test
    void payloadNotMatchingTaskNameIsRejected() {
        assertThatThrownBy(() -> consumer.onMessage(message(TaskNames.PROCESS_DOCUMENT, new GenerateReportPayload(1L, 7L)), "Bearer ok"))
            .isInstanceOf(AmqpRejectAndDontRequeueException.class);
        assertThatThrownBy(() -> consumer.onMessage(message(TaskNames.PROCESS_DOCUMENT, null), "Bearer ok"))
            .isInstanceOf(AmqpRejectAndDontRequeueException.class);
        verify(registry, never()).execute(any());
    }

    @Test
    void handlerFailurePropagatesForContainerRetry() {
        GenerateReportPayload payload = new GenerateReportPayload(1L, 7L);
        doThrow(new IllegalStateException("db down")).when(registry).execute(payload);

        assertThatThrownBy(() -> consumer.onMessage(message(TaskNames.GENERATE_REPORT, payload), "Bearer ok"))
            .isInstanceOf(IllegalStateException.class);
    }
}
