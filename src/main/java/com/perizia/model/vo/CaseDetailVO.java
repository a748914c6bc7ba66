package com.perizia.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 案件详情 VO
 *
 * @author perizia
 * @since 2025-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "案件详情")
public class CaseDetailVO {

    @Schema(description = "案件")
    private CaseVO caseInfo;

    @Schema(description = "文档列表")
    private List<DocumentVO> documents;

    @Schema(description = "报告版本列表")
    private List<ReportVersionVO> versions;
}
