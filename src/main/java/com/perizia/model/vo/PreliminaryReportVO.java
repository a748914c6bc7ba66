package com.perizia.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 初步报告
 *
 * @author perizia
 * @since 2025-03-10
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "初步报告")
public class PreliminaryReportVO {

    @Schema(description = "版本ID，尚未生成时为空")
    private Long versionId;

    @Schema(description = "版本号")
    private Integer versionNumber;

    @Schema(description = "报告正文(Markdown)")
    private String content;

    @Schema(description = "创建时间")
    private LocalDateTime createTime;

    @Schema(description = "本次请求是否新生成，false 表示返回的是已有报告")
    private Boolean generated;

    @Schema(description = "当前是否可以生成(没有处理中的文档)")
    private Boolean canGenerate;

    @Schema(description = "处理中的文档数")
    private Long pendingDocuments;
}
