package com.perizia.model.entity;

import com.baomidou.mybatisplus.annotation.*;
import com.perizia.model.enums.VersionSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 报告版本实体
 * (case_id, version_number) 唯一，版本号只增不复用
 *
 * @author perizia
 * @since 2025-03-06
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("report_versions")
public class ReportVersionDO implements Serializable {

    private static final long serialVersionUID = 1L;

    @TableId(type = IdType.ASSIGN_ID)
    private Long id;

    private Long caseId;

    private Long tenantId;

    /**
     * 版本号，从 1 开始
     */
    private Integer versionNumber;

    /**
     * 是否为定稿版本
     */
    private Boolean isFinal;

    private VersionSource source;

    /**
     * AI 原始输出文本（人工定稿版本为空）
     */
    private String aiRawOutput;

    /**
     * 报告文件存储路径
     */
    private String artifactRef;

    /**
     * 生成初步报告时所用文档集合的摘要，文档变化后初步报告需要重新生成
     */
    private String documentHash;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createTime;
}
