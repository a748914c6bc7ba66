package com.perizia.model.entity;

import com.baomidou.mybatisplus.annotation.*;
import com.perizia.model.enums.CaseStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 理赔案件实体
 *
 * @author perizia
 * @since 2025-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("cases")
public class CaseDO implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 案件ID
     */
    @TableId(type = IdType.ASSIGN_ID)
    private Long id;

    /**
     * 租户ID
     */
    private Long tenantId;

    /**
     * 客户引用（委托方）
     */
    private String clientRef;

    /**
     * 案件编号，如 PR-20250302-0042
     */
    private String referenceCode;

    /**
     * 案件状态
     */
    private CaseStatus status;

    /**
     * 创建时间
     */
    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createTime;

    /**
     * 更新时间
     */
    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updateTime;

    /**
     * 是否删除（软删除，从不物理删除）
     */
    @TableLogic
    private Integer isDeleted;
}
