package com.perizia.service.llm;

import com.perizia.model.content.ExtractedContent;

import java.util.List;

/**
 * 一个案件的报告生成请求
 *
 * @param caseId    案件ID
 * @param tenantId  租户ID
 * @param materials 抽取成功的文档内容
 */
public record GenerationRequest(Long caseId, Long tenantId, List<ExtractedContent> materials) {

    public GenerationRequest {
        materials = List.copyOf(materials);
    }
}
