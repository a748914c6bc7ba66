package com.perizia.mq;

import com.perizia.Exception.TaskAuthException;
import com.perizia.config.RabbitMQConfig;
import com.perizia.model.dto.TaskMessage;
import com.perizia.service.TaskAuthService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Component;

/**
 * 任务队列消费者
 * 处理失败的异常抛回容器，按 spring.rabbitmq.listener.simple.retry 有限重试后进入死信队列
 *
 * @author perizia
 * @since 2025-03-03
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pipeline.task-mode", havingValue = "queue")
public class TaskMessageConsumer {

    private final TaskAuthService taskAuthService;

    private final TaskHandlerRegistry handlerRegistry;

    @RabbitListener(queues = RabbitMQConfig.TASK_QUEUE)
    public void onMessage(TaskMessage message,
                          @Header(name = QueueTaskDispatcher.AUTHORIZATION_HEADER, required = false) String authorization) {
        try {
            String caller = taskAuthService.verifyBearer(authorization);
            log.debug("任务消息身份校验通过: caller={}, task={}", caller, message.getTaskName());
        } catch (TaskAuthException e) {
            log.warn("拒绝未授权的任务消息: task={}, status={}, reason={}",
                message.getTaskName(), e.getStatus().value(), e.getMessage());
            throw new AmqpRejectAndDontRequeueException("任务消息鉴权失败: " + e.getMessage(), e);
        }
        if (message.getPayload() == null || !message.getPayload().taskName().equals(message.getTaskName())) {
            throw new AmqpRejectAndDontRequeueException("任务消息格式错误: task=" + message.getTaskName());
        }
        log.info("收到任务消息: task={}, enqueuedAt={}", message.getTaskName(), message.getEnqueuedAt());
        handlerRegistry.execute(message.getPayload());
    }
}
