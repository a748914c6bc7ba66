package com.perizia.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 报告版本 VO
 *
 * @author perizia
 * @since 2025-03-05
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "报告版本")
public class ReportVersionVO {

    @Schema(description = "版本ID")
    private Long id;

    @Schema(description = "版本号")
    private Integer versionNumber;

    @Schema(description = "是否定稿")
    private Boolean isFinal;

    @Schema(description = "来源: ai-draft / preliminary / final")
    private String source;

    @Schema(description = "创建时间")
    private LocalDateTime createTime;
}
