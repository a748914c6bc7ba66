package com.perizia.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perizia.Exception.CoordinationException;
import com.perizia.mapper.CaseMapper;
import com.perizia.mapper.DocumentMapper;
import com.perizia.mapper.ReportVersionMapper;
import com.perizia.model.content.ErrorContent;
import com.perizia.model.content.ExtractedContent;
import com.perizia.model.entity.CaseDO;
import com.perizia.model.entity.DocumentDO;
import com.perizia.model.entity.ReportVersionDO;
import com.perizia.model.enums.CaseStatus;
import com.perizia.model.enums.ExtractionErrorType;
import com.perizia.model.enums.ExtractionStatus;
import com.perizia.model.enums.VersionSource;
import com.perizia.service.BlobStore;
import com.perizia.service.ReportGenerationService;
import com.perizia.service.ReportRenderService;
import com.perizia.service.VersionManagerService;
import com.perizia.service.llm.GenerationOrchestrator;
import com.perizia.service.llm.GenerationRequest;
import com.perizia.service.llm.GenerationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * 报告生成任务实现
 * <ol>
 *     <li>锁定案件：处理重复投递、恢复已上传但未入库的报告、校验文档状态、收集抽取成功的内容</li>
 *     <li>释放锁后调用模型、渲染 DOCX 并上传</li>
 *     <li>由版本管理写入 AI 初稿版本，案件回到 OPEN</li>
 * </ol>
 *
 * @author perizia
 * @since 2025-03-06
 */
@Slf4j
@Service
public class ReportGenerationServiceImpl implements ReportGenerationService {

    private static final String ARTIFACT_PATH = "reports/%d/%d/v1_ai_draft.docx";

    /**
     * 锁内准备好的生成输入
     */
    private record PreparedGeneration(String title, String artifactPath, List<ExtractedContent> materials) {
    }

    private final CaseMapper caseMapper;

    private final DocumentMapper documentMapper;

    private final ReportVersionMapper reportVersionMapper;

    private final VersionManagerService versionManagerService;

    private final GenerationOrchestrator generationOrchestrator;

    private final ReportRenderService reportRenderService;

    private final BlobStore blobStore;

    private final ObjectMapper objectMapper;

    private final TransactionTemplate transactionTemplate;

    public ReportGenerationServiceImpl(CaseMapper caseMapper,
                                       DocumentMapper documentMapper,
                                       ReportVersionMapper reportVersionMapper,
                                       VersionManagerService versionManagerService,
                                       GenerationOrchestrator generationOrchestrator,
                                       ReportRenderService reportRenderService,
                                       BlobStore blobStore,
                                       ObjectMapper objectMapper,
                                       PlatformTransactionManager transactionManager) {
        this.caseMapper = caseMapper;
        this.documentMapper = documentMapper;
        this.reportVersionMapper = reportVersionMapper;
        this.versionManagerService = versionManagerService;
        this.generationOrchestrator = generationOrchestrator;
        this.reportRenderService = reportRenderService;
        this.blobStore = blobStore;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public void generateReport(Long caseId, Long tenantId) {
        PreparedGeneration prepared = transactionTemplate.execute(status -> prepare(caseId, tenantId));
        if (prepared == null) {
            return;
        }

        try {
            GenerationResult result = generationOrchestrator.generate(
                new GenerationRequest(caseId, tenantId, prepared.materials()));
            // 模型调用期间不持锁，重复投递的任务可能已先写入初稿，不再覆盖其报告文件
            if (reportVersionMapper.existsBySource(caseId, tenantId, VersionSource.AI_DRAFT)) {
                log.warn("AI 初稿已由其他任务写入，丢弃本次结果: caseId={}", caseId);
                return;
            }
            byte[] artifact = reportRenderService.render(prepared.title(), result.text());
            String artifactRef = blobStore.put(artifact, prepared.artifactPath());
            ReportVersionDO version = versionManagerService.createDraftVersion(caseId, tenantId, result.text(), artifactRef);
            log.info("AI 初稿生成完成: caseId={}, version={}, model={}, totalTokens={}",
                caseId, version.getVersionNumber(), result.usage().model(), result.usage().totalTokens());
        } catch (CoordinationException | DataAccessException e) {
            // 交给任务队列整体重试
            throw e;
        } catch (RuntimeException e) {
            log.error("报告生成失败，案件置为 ERROR: caseId={}", caseId, e);
            caseMapper.updateStatus(caseId, tenantId, CaseStatus.ERROR);
        }
    }

    /**
     * @return 无需生成时为 null
     */
    private PreparedGeneration prepare(Long caseId, Long tenantId) {
        CaseDO caseDO = caseMapper.selectByIdForUpdate(caseId, tenantId);
        if (caseDO == null) {
            log.warn("案件不存在，忽略生成任务: caseId={}, tenantId={}", caseId, tenantId);
            return null;
        }
        if (caseDO.getStatus() == CaseStatus.CLOSED) {
            log.info("案件已关闭，忽略生成任务: caseId={}", caseId);
            return null;
        }

        // 重复投递
        if (reportVersionMapper.existsBySource(caseId, tenantId, VersionSource.AI_DRAFT)) {
            log.info("AI 初稿已存在，忽略重复的生成任务: caseId={}", caseId);
            if (caseDO.getStatus() != CaseStatus.OPEN) {
                caseMapper.updateStatus(caseId, tenantId, CaseStatus.OPEN);
            }
            return null;
        }

        String artifactPath = String.format(ARTIFACT_PATH, tenantId, caseId);
        if (recoverOrphanedArtifact(caseId, tenantId, artifactPath)) {
            return null;
        }

        List<DocumentDO> documents = documentMapper.selectByCase(caseId, tenantId);
        List<DocumentDO> pending = documents.stream().filter(d -> !d.getAiStatus().isTerminal()).toList();
        if (!pending.isEmpty()) {
            // 退回 PROCESSING，剩余文档完成后由汇聚判定再次触发
            log.info("仍有文档未处理完成，暂不生成: caseId={}, pending={}", caseId, pending.size());
            caseMapper.updateStatus(caseId, tenantId, CaseStatus.PROCESSING);
            return null;
        }
        List<DocumentDO> succeeded = documents.stream()
            .filter(d -> d.getAiStatus() == ExtractionStatus.SUCCESS)
            .toList();
        if (succeeded.isEmpty()) {
            log.error("没有抽取成功的文档，无法生成报告: caseId={}", caseId);
            caseMapper.updateStatus(caseId, tenantId, CaseStatus.ERROR);
            return null;
        }

        if (caseDO.getStatus() != CaseStatus.GENERATING) {
            caseMapper.updateStatus(caseId, tenantId, CaseStatus.GENERATING);
        }
        log.info("开始生成报告: caseId={}, succeeded={}, failedOrSkipped={}",
            caseId, succeeded.size(), documents.size() - succeeded.size());
        return new PreparedGeneration(caseDO.getReferenceCode(), artifactPath, collectMaterials(succeeded));
    }

    /**
     * 报告文件已上传但版本记录未写入（上次在入库前中断），直接补写版本，不再调用模型
     */
    private boolean recoverOrphanedArtifact(Long caseId, Long tenantId, String artifactPath) {
        boolean exists;
        try {
            exists = blobStore.exists(artifactPath);
        } catch (RuntimeException e) {
            log.warn("无法检查已有报告文件，继续生成: caseId={}, path={}", caseId, artifactPath, e);
            return false;
        }
        if (!exists) {
            return false;
        }
        log.warn("发现未入库的报告文件，补写版本记录: caseId={}, path={}", caseId, artifactPath);
        // 原始生成文本已丢失，不作为训练样本
        versionManagerService.createDraftVersion(caseId, tenantId, null, artifactPath);
        return true;
    }

    private List<ExtractedContent> collectMaterials(List<DocumentDO> documents) {
        List<ExtractedContent> materials = new ArrayList<>();
        for (DocumentDO document : documents) {
            try {
                materials.addAll(objectMapper.readValue(document.getExtractedContent(), ExtractedContent.LIST_TYPE));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("文档抽取结果无法读取: documentId={}", document.getId(), e);
                materials.add(new ErrorContent(document.getFilename(), ExtractionErrorType.GENERIC, "抽取结果无法读取"));
            }
        }
        return materials;
    }
}
