package com.perizia.model.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 训练样本对：AI 草稿版本 与 人工定稿版本
 *
 * @author perizia
 * @since 2025-03-06
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("ml_training_pairs")
public class TrainingPairDO {

    @TableId(type = IdType.ASSIGN_ID)
    private Long id;

    private Long caseId;

    private Long tenantId;

    private Long aiVersionId;

    private Long finalVersionId;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createTime;
}
