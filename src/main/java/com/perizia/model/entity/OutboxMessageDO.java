package com.perizia.model.entity;

import com.baomidou.mybatisplus.annotation.*;
import com.perizia.model.enums.OutboxStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 事务发件箱消息
 * 与触发它的状态变更在同一事务内写入，只由发件箱处理器修改，从不删除
 *
 * @author perizia
 * @since 2025-03-04
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("outbox_messages")
public class OutboxMessageDO implements Serializable {

    private static final long serialVersionUID = 1L;

    @TableId(type = IdType.ASSIGN_ID)
    private Long id;

    /**
     * 主题，如 generate-report
     */
    private String topic;

    /**
     * 租户ID（系统级消息为空）
     */
    private Long tenantId;

    /**
     * 消息体(JSON)
     */
    private String payload;

    private OutboxStatus status;

    private Integer retryCount;

    /**
     * 最近一次处理失败的错误
     */
    private String errorLog;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createTime;

    private LocalDateTime processedAt;

    public static OutboxMessageDO pending(String topic, Long tenantId, String payload) {
        return OutboxMessageDO.builder()
            .topic(topic)
            .tenantId(tenantId)
            .payload(payload)
            .status(OutboxStatus.PENDING)
            .retryCount(0)
            .createTime(LocalDateTime.now())
            .build();
    }
}
