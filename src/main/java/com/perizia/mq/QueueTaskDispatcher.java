package com.perizia.mq;

import com.perizia.config.RabbitMQConfig;
import com.perizia.model.dto.TaskMessage;
import com.perizia.model.dto.TaskPayload;
import com.perizia.service.TaskAuthService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 任务投递到 RabbitMQ
 * 消息头携带服务身份令牌，消费方校验后才执行；投递失败的 AmqpException 直接抛给调用方
 *
 * @author perizia
 * @since 2025-03-03
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pipeline.task-mode", havingValue = "queue")
public class QueueTaskDispatcher implements TaskDispatcher {

    public static final String AUTHORIZATION_HEADER = "Authorization";

    private final RabbitTemplate rabbitTemplate;

    private final TaskAuthService taskAuthService;

    private final Clock clock;

    @Override
    public void enqueue(String taskName, TaskPayload payload) {
        TaskDispatcher.checkTaskName(taskName, payload);
        TaskMessage message = TaskMessage.builder()
            .taskName(taskName)
            .payload(payload)
            .enqueuedAt(clock.millis())
            .build();
        String token = taskAuthService.issueToken();
        rabbitTemplate.convertAndSend(RabbitMQConfig.TASK_QUEUE, message, m -> {
            m.getMessageProperties().setHeader(AUTHORIZATION_HEADER, "Bearer " + token);
            return m;
        });
        log.info("发送任务到队列: task={}, payload={}", taskName, payload);
    }
}
