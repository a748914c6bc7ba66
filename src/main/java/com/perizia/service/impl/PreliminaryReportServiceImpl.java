package com.perizia.service.impl;

import cn.hutool.core.util.StrUtil;
import cn.hutool.crypto.SecureUtil;
import cn.hutool.http.HtmlUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perizia.Exception.GenerationException;
import com.perizia.Exception.LlmProviderException;
import com.perizia.config.LlmProperties;
import com.perizia.mapper.CaseMapper;
import com.perizia.mapper.DocumentMapper;
import com.perizia.mapper.ReportVersionMapper;
import com.perizia.model.content.ExtractedContent;
import com.perizia.model.content.TextContent;
import com.perizia.model.entity.CaseDO;
import com.perizia.model.entity.DocumentDO;
import com.perizia.model.entity.ReportVersionDO;
import com.perizia.model.enums.CaseStatus;
import com.perizia.model.enums.ExtractionStatus;
import com.perizia.model.enums.VersionSource;
import com.perizia.model.vo.PreliminaryReportVO;
import com.perizia.service.PreliminaryReportService;
import com.perizia.service.VersionManagerService;
import com.perizia.service.llm.GenerationConfig;
import com.perizia.service.llm.LlmProvider;
import com.perizia.service.llm.LlmResponse;
import com.perizia.service.llm.PromptPart;
import com.perizia.service.llm.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import top.continew.starter.core.exception.BusinessException;

import java.util.ArrayList;
import java.util.List;

/**
 * 初步报告实现
 * 只使用文本材料，单模型调用，不走缓存与备用模型；模型调用期间不持有案件锁
 *
 * @author perizia
 * @since 2025-03-10
 */
@Slf4j
@Service
public class PreliminaryReportServiceImpl implements PreliminaryReportService {

    /**
     * 单个文件送入模型的最大字符数
     */
    static final int MAX_CHARS_PER_DOCUMENT = 15000;

    private static final double TEMPERATURE = 0.5;

    private static final int MAX_OUTPUT_TOKENS = 8000;

    private final CaseMapper caseMapper;

    private final DocumentMapper documentMapper;

    private final ReportVersionMapper reportVersionMapper;

    private final VersionManagerService versionManagerService;

    private final LlmProvider llmProvider;

    private final LlmProperties llmProperties;

    private final RetryPolicy retryPolicy;

    private final ObjectMapper objectMapper;

    private final String systemPrompt;

    public PreliminaryReportServiceImpl(CaseMapper caseMapper,
                                        DocumentMapper documentMapper,
                                        ReportVersionMapper reportVersionMapper,
                                        VersionManagerService versionManagerService,
                                        LlmProvider llmProvider,
                                        LlmProperties llmProperties,
                                        RetryPolicy providerRetryPolicy,
                                        ObjectMapper objectMapper,
                                        @Qualifier("preliminaryReportPrompt") String systemPrompt) {
        this.caseMapper = caseMapper;
        this.documentMapper = documentMapper;
        this.reportVersionMapper = reportVersionMapper;
        this.versionManagerService = versionManagerService;
        this.llmProvider = llmProvider;
        this.llmProperties = llmProperties;
        this.retryPolicy = providerRetryPolicy;
        this.objectMapper = objectMapper;
        this.systemPrompt = systemPrompt;
    }

    @Override
    public PreliminaryReportVO getPreliminaryReport(Long caseId, Long tenantId) {
        getCase(caseId, tenantId);
        long pending = documentMapper.countNonTerminal(caseId, tenantId);
        ReportVersionDO latest = reportVersionMapper.selectLatestBySource(caseId, tenantId, VersionSource.PRELIMINARY);
        PreliminaryReportVO vo = latest == null ? new PreliminaryReportVO() : toVO(latest, false);
        vo.setCanGenerate(pending == 0);
        vo.setPendingDocuments(pending);
        return vo;
    }

    @Override
    public PreliminaryReportVO generatePreliminaryReport(Long caseId, Long tenantId, boolean force) {
        CaseDO caseDO = getCase(caseId, tenantId);
        if (caseDO.getStatus() == CaseStatus.CLOSED) {
            throw new BusinessException("案件已定稿关闭");
        }
        long pending = documentMapper.countNonTerminal(caseId, tenantId);
        if (pending > 0) {
            throw new BusinessException("仍有 " + pending + " 个文档在处理中，请稍后再生成");
        }

        List<DocumentDO> documents = documentMapper.selectByCaseAndStatus(caseId, tenantId, ExtractionStatus.SUCCESS);
        String documentHash = documentHash(documents);
        if (!force) {
            ReportVersionDO existing = reportVersionMapper.selectLatestBySource(caseId, tenantId, VersionSource.PRELIMINARY);
            if (existing != null && documentHash.equals(existing.getDocumentHash())) {
                log.info("文档未变化，返回已有初步报告: caseId={}, version={}", caseId, existing.getVersionNumber());
                return toVO(existing, false);
            }
        }
        if (documents.isEmpty()) {
            throw new BusinessException("没有抽取成功的文档，无法生成初步报告");
        }

        String model = llmProperties.getPreliminaryModel();
        List<PromptPart> parts = buildPrompt(caseDO, documents);
        GenerationConfig config = new GenerationConfig(null, TEMPERATURE, MAX_OUTPUT_TOKENS);
        log.info("开始生成初步报告: caseId={}, documents={}, model={}", caseId, documents.size(), model);

        LlmResponse response;
        try {
            response = retryPolicy.execute("生成初步报告 model=" + model,
                () -> llmProvider.generate(model, parts, config));
        } catch (LlmProviderException e) {
            throw new GenerationException("初步报告生成失败: caseId=" + caseId + ", code=" + e.getCode(), e);
        }
        if (response == null || StrUtil.isBlank(response.text())) {
            throw new GenerationException("模型返回空内容: caseId=" + caseId + ", model=" + model);
        }

        ReportVersionDO version = versionManagerService.createPreliminaryVersion(caseId, tenantId, response.text(), documentHash);
        log.info("初步报告生成完成: caseId={}, version={}, length={}", caseId, version.getVersionNumber(), response.text().length());
        return toVO(version, true);
    }

    /**
     * 抽取成功的文档ID排序后拼接取 SHA-256，文档增删后摘要随之变化
     */
    static String documentHash(List<DocumentDO> documents) {
        String joined = documents.stream()
            .map(d -> String.valueOf(d.getId()))
            .sorted()
            .reduce((a, b) -> a + "|" + b)
            .orElse("");
        return SecureUtil.sha256(joined);
    }

    private List<PromptPart> buildPrompt(CaseDO caseDO, List<DocumentDO> documents) {
        List<PromptPart> parts = new ArrayList<>();
        parts.add(PromptPart.text(systemPrompt + "\n\n"));
        parts.add(PromptPart.text("<confirmed_data>\n"
            + "案件编号: " + HtmlUtil.escape(StrUtil.blankToDefault(caseDO.getReferenceCode(), "未载明")) + "\n"
            + "委托方参考号: " + HtmlUtil.escape(StrUtil.blankToDefault(caseDO.getClientRef(), "未载明")) + "\n"
            + "</confirmed_data>\n\n"));

        StringBuilder evidence = new StringBuilder("<case_documents>\n");
        for (DocumentDO document : documents) {
            for (TextContent text : readText(document)) {
                if (StrUtil.isBlank(text.text())) {
                    continue;
                }
                evidence.append("<document filename=\"").append(HtmlUtil.escape(text.filename())).append("\">\n")
                    .append(StrUtil.maxLength(text.text(), MAX_CHARS_PER_DOCUMENT))
                    .append("\n</document>\n");
            }
        }
        evidence.append("</case_documents>");
        parts.add(PromptPart.text(evidence.toString()));
        return parts;
    }

    /**
     * 视觉材料和处理失败的条目不进入初步报告
     */
    private List<TextContent> readText(DocumentDO document) {
        try {
            List<ExtractedContent> contents = objectMapper.readValue(document.getExtractedContent(), ExtractedContent.LIST_TYPE);
            return contents.stream()
                .filter(TextContent.class::isInstance)
                .map(TextContent.class::cast)
                .toList();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("文档抽取结果无法读取，不纳入初步报告: documentId={}", document.getId(), e);
            return List.of();
        }
    }

    private CaseDO getCase(Long caseId, Long tenantId) {
        CaseDO caseDO = caseMapper.selectById(caseId);
        if (caseDO == null || !caseDO.getTenantId().equals(tenantId)) {
            throw new BusinessException("案件不存在");
        }
        return caseDO;
    }

    private PreliminaryReportVO toVO(ReportVersionDO version, boolean generated) {
        return PreliminaryReportVO.builder()
            .versionId(version.getId())
            .versionNumber(version.getVersionNumber())
            .content(version.getAiRawOutput())
            .createTime(version.getCreateTime())
            .generated(generated)
            .canGenerate(true)
            .pendingDocuments(0L)
            .build();
    }
}
