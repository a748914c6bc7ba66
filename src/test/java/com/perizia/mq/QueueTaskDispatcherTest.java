package com.perizia.mq;

import com.perizia.config.RabbitMQConfig;
import com.perizia.model.dto.GenerateReportPayload;
import com.perizia.model.dto.ProcessDocumentPayload;
import com.perizia.model.dto.TaskMessage;
import com.perizia.model.dto.TaskNames;
import com.perizia.service.TaskAuthService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessagePostProcessor;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class QueueTaskDispatcherTest {

    private RabbitTemplate rabbitTemplate;

    private QueueTaskDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        rabbitTemplate = mock(RabbitTemplate.class);
        TaskAuthService taskAuthService = mock(TaskAuthService.class);
        when(taskAuthService.issueToken()).thenReturn("svc-token");
        dispatcher = new QueueTaskDispatcher(rabbitTemplate, taskAuthService,
            Clock.fixed(Instant.parse("2025-03-03T08:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void publishesTaskWithServiceTokenHeader() {
        ProcessDocumentPayload payload = new ProcessDocumentPayload(11L, 7L);

        dispatcher.enqueue(TaskNames.PROCESS_DOCUMENT, payload);

        ArgumentCaptor<TaskMessage> message = ArgumentCaptor.forClass(TaskMessage.class);
        ArgumentCaptor<MessagePostProcessor> postProcessor = ArgumentCaptor.forClass(MessagePostProcessor.class);
        verify(rabbitTemplate).convertAndSend(eq(RabbitMQConfig.TASK_QUEUE), message.capture(), postProcessor.capture());
        assertThat(message.getValue().getTaskName()).isEqualTo(TaskNames.PROCESS_DOCUMENT);
        assertThat(message.getValue().getPayload()).isEqualTo(payload);
        assertThat(message.getValue().getEnqueuedAt()).isEqualTo(Instant.parse("2025-03-03T08:00:00Z").toEpochMilli());

        Message amqpMessage = postProcessor.getValue().postProcessMessage(new Message(new byte[0], new MessageProperties()));
        assertThat((String) amqpMessage.getMessageProperties().getHeader(QueueTaskDispatcher.AUTHORIZATION_HEADER))
            .isEqualTo("Bearer svc-token");
    }

    @Test
    void brokerFailurePropagatesToCaller() {
        doThrow(new AmqpException("connection refused"))
            .when(rabbitTemplate).convertAndSend(anyString(), any(TaskMessage.class), any(MessagePostProcessor.class));

        assertThatThrownBy(() -> dispatcher.enqueue(TaskNames.GENERATE_REPORT, new GenerateReportPayload(1L, 7L)))
            .isInstanceOf(AmqpException.class);
    }

    @Test
    void mismatchedTaskNameIsNeverPublished() {
        assertThatThrownBy(() -> dispatcher.enqueue(TaskNames.GENERATE_REPORT, new ProcessDocumentPayload(11L, 7L)))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(rabbitTemplate);
    }
}
