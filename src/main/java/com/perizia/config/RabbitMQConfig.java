package com.perizia.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ 配置类，仅 queue 模式启用
 *
 * @author perizia
 * @since 2025-03-03
 */
@Configuration
@EnableRabbit
@ConditionalOnProperty(name = "pipeline.task-mode", havingValue = "queue")
public class RabbitMQConfig {

    /**
     * 任务队列
     */
    public static final String TASK_QUEUE = "perizia.tasks";

    /**
     * 重试用尽或鉴权失败的任务进入死信队列
     */
    public static final String TASK_DEAD_LETTER_QUEUE = "perizia.tasks.dead";

    @Bean
    public Queue taskQueue() {
        return QueueBuilder.durable(TASK_QUEUE)
            .deadLetterExchange("")
            .deadLetterRoutingKey(TASK_DEAD_LETTER_QUEUE)
            .build();
    }

    @Bean
    public Queue taskDeadLetterQueue() {
        return new Queue(TASK_DEAD_LETTER_QUEUE, true);
    }

    /**
     * 消息转换器 - 使用JSON格式，载荷按 task 字段还原为具体类型
     */
    @Bean
    public MessageConverter messageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }
}
