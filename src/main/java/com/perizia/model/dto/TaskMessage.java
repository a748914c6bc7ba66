package com.perizia.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 投递到任务队列的消息
 *
 * @author perizia
 * @since 2025-03-03
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskMessage implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 任务名称
     */
    private String taskName;

    /**
     * 任务载荷
     */
    private TaskPayload payload;

    /**
     * 入队时间(epoch 毫秒)
     */
    private Long enqueuedAt;
}
