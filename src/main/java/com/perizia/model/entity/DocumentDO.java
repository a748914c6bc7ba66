package com.perizia.model.entity;

import com.baomidou.mybatisplus.annotation.*;
import com.perizia.model.enums.ExtractionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 案件文档实体
 *
 * @author perizia
 * @since 2025-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("case_documents")
public class DocumentDO implements Serializable {

    private static final long serialVersionUID = 1L;

    @TableId(type = IdType.ASSIGN_ID)
    private Long id;

    private Long caseId;

    private Long tenantId;

    /**
     * 原始文件名
     */
    private String filename;

    /**
     * 对象存储路径
     */
    private String storageRef;

    private String mimeType;

    /**
     * 文件大小(字节)
     */
    private Long fileSize;

    /**
     * AI 抽取状态
     */
    private ExtractionStatus aiStatus;

    /**
     * 抽取结果(JSON，ExtractedContent 列表)
     */
    private String extractedContent;

    /**
     * 面向用户的错误信息
     */
    private String errorMessage;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createTime;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updateTime;
}
