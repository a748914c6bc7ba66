package com.perizia.service.impl;

import cn.hutool.core.date.DatePattern;
import cn.hutool.core.io.file.FileNameUtil;
import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.RandomUtil;
import cn.hutool.core.util.StrUtil;
import com.perizia.config.FileStorageProperties;
import com.perizia.config.PipelineProperties;
import com.perizia.mapper.CaseMapper;
import com.perizia.mapper.DocumentMapper;
import com.perizia.mapper.ReportVersionMapper;
import com.perizia.model.dto.CaseCreateDTO;
import com.perizia.model.dto.ProcessDocumentPayload;
import com.perizia.model.dto.TaskNames;
import com.perizia.model.entity.CaseDO;
import com.perizia.model.entity.DocumentDO;
import com.perizia.model.entity.ReportVersionDO;
import com.perizia.model.enums.CaseStatus;
import com.perizia.model.enums.ExtractionStatus;
import com.perizia.model.enums.VersionSource;
import com.perizia.model.vo.CaseDetailVO;
import com.perizia.model.vo.CaseVO;
import com.perizia.model.vo.DocumentVO;
import com.perizia.model.vo.DownloadUrlVO;
import com.perizia.model.vo.ReportVersionVO;
import com.perizia.mq.TaskDispatcher;
import com.perizia.service.BlobStore;
import com.perizia.service.CaseService;
import com.perizia.service.FanInCoordinatorService;
import com.perizia.service.OutboxProcessorService;
import com.perizia.service.OutboxService;
import com.perizia.service.VersionManagerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.multipart.MultipartFile;
import top.continew.starter.core.exception.BusinessException;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * 案件服务实现
 *
 * @author perizia
 * @since 2025-03-02
 */
@Slf4j
@Service
public class CaseServiceImpl implements CaseService {

    private static final String DOCUMENT_PATH = "cases/%d/%d/%s.%s";

    private static final String FINAL_ARTIFACT_PATH = "reports/%d/%d/final_%s.docx";

    private final CaseMapper caseMapper;

    private final DocumentMapper documentMapper;

    private final ReportVersionMapper reportVersionMapper;

    private final BlobStore blobStore;

    private final TaskDispatcher taskDispatcher;

    private final OutboxService outboxService;

    private final OutboxProcessorService outboxProcessorService;

    private final FanInCoordinatorService fanInCoordinatorService;

    private final VersionManagerService versionManagerService;

    private final PipelineProperties pipelineProperties;

    private final FileStorageProperties fileStorageProperties;

    private final Clock clock;

    /**
     * 提交回调里的数据库写入使用独立事务
     */
    private final TransactionTemplate requiresNew;

    public CaseServiceImpl(CaseMapper caseMapper,
                           DocumentMapper documentMapper,
                           ReportVersionMapper reportVersionMapper,
                           BlobStore blobStore,
                           TaskDispatcher taskDispatcher,
                           OutboxService outboxService,
                           OutboxProcessorService outboxProcessorService,
                           FanInCoordinatorService fanInCoordinatorService,
                           VersionManagerService versionManagerService,
                           PipelineProperties pipelineProperties,
                           FileStorageProperties fileStorageProperties,
                           Clock clock,
                           PlatformTransactionManager transactionManager) {
        this.caseMapper = caseMapper;
        this.documentMapper = documentMapper;
        this.reportVersionMapper = reportVersionMapper;
        this.blobStore = blobStore;
        this.taskDispatcher = taskDispatcher;
        this.outboxService = outboxService;
        this.outboxProcessorService = outboxProcessorService;
        this.fanInCoordinatorService = fanInCoordinatorService;
        this.versionManagerService = versionManagerService;
        this.pipelineProperties = pipelineProperties;
        this.fileStorageProperties = fileStorageProperties;
        this.clock = clock;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public CaseVO openCase(CaseCreateDTO dto, Long tenantId) {
        String referenceCode = StrUtil.isBlank(dto.getReferenceCode())
            ? generateReferenceCode()
            : dto.getReferenceCode().trim();

        CaseDO caseDO = CaseDO.builder()
            .tenantId(tenantId)
            .clientRef(dto.getClientRef().trim())
            .referenceCode(referenceCode)
            .status(CaseStatus.OPEN)
            .build();
        caseMapper.insert(caseDO);

        log.info("新建案件: caseId={}, tenantId={}, referenceCode={}", caseDO.getId(), tenantId, referenceCode);
        return toCaseVO(caseDO);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public DocumentVO registerDocument(Long caseId, Long tenantId, MultipartFile file) {
        String extension = validateFile(file);

        CaseDO caseDO = lockCase(caseId, tenantId);
        if (caseDO.getStatus() == CaseStatus.CLOSED) {
            throw new BusinessException("案件已定稿关闭，不能再上传文档");
        }
        if (caseDO.getStatus() == CaseStatus.GENERATING) {
            throw new BusinessException("报告生成中，请稍后再上传");
        }

        String path = String.format(DOCUMENT_PATH, tenantId, caseId, IdUtil.fastSimpleUUID(), extension);
        String storageRef = blobStore.put(readBytes(file), path);

        DocumentDO document = DocumentDO.builder()
            .caseId(caseId)
            .tenantId(tenantId)
            .filename(file.getOriginalFilename())
            .storageRef(storageRef)
            .mimeType(file.getContentType())
            .fileSize(file.getSize())
            .aiStatus(ExtractionStatus.PENDING)
            .build();
        documentMapper.insert(document);

        Long documentId = document.getId();
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                dispatchExtraction(documentId, tenantId);
            }

            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_ROLLED_BACK) {
                    deleteQuietly(storageRef);
                }
            }
        });

        log.info("文档已登记: caseId={}, documentId={}, filename={}", caseId, documentId, document.getFilename());
        return toDocumentVO(document);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public int processCase(Long caseId, Long tenantId) {
        CaseDO caseDO = lockCase(caseId, tenantId);
        switch (caseDO.getStatus()) {
            case PROCESSING -> {
                log.info("案件正在派发中，忽略重复请求: caseId={}", caseId);
                return 0;
            }
            case GENERATING -> throw new BusinessException("报告生成中，请稍后再试");
            case CLOSED -> throw new BusinessException("案件已定稿关闭");
            default -> {
            }
        }

        List<DocumentDO> documents = documentMapper.selectByCase(caseId, tenantId);
        if (documents.isEmpty()) {
            caseMapper.updateStatus(caseId, tenantId, CaseStatus.ERROR);
            log.warn("案件没有文档，置为 ERROR: caseId={}", caseId);
            return 0;
        }

        // PROCESSING 的文档也重新投递：执行它的进程可能已经退出，抽取任务可重复执行
        List<Long> toDispatch = documents.stream()
            .filter(d -> d.getAiStatus() != ExtractionStatus.SUCCESS)
            .map(DocumentDO::getId)
            .toList();
        for (DocumentDO document : documents) {
            if (document.getAiStatus() != ExtractionStatus.SUCCESS && document.getAiStatus() != ExtractionStatus.PENDING) {
                document.setAiStatus(ExtractionStatus.PENDING);
                document.setErrorMessage(null);
                documentMapper.updateById(document);
            }
        }
        caseMapper.updateStatus(caseId, tenantId, CaseStatus.PROCESSING);

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                toDispatch.forEach(documentId -> dispatchExtraction(documentId, tenantId));
                try {
                    // 派发结束，之后由汇聚判定推进状态
                    requiresNew.executeWithoutResult(status ->
                        caseMapper.compareAndSetStatus(caseId, tenantId, CaseStatus.PROCESSING, CaseStatus.OPEN));
                    if (toDispatch.isEmpty()) {
                        fanInCoordinatorService.checkCompletion(caseId, tenantId);
                    }
                } catch (RuntimeException e) {
                    log.warn("派发后的状态推进失败，等待卡住案件清理: caseId={}", caseId, e);
                }
            }
        });

        log.info("案件派发抽取任务: caseId={}, documents={}, dispatched={}", caseId, documents.size(), toDispatch.size());
        return toDispatch.size();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void retryGeneration(Long caseId, Long tenantId) {
        CaseDO caseDO = lockCase(caseId, tenantId);
        if (caseDO.getStatus() != CaseStatus.ERROR && caseDO.getStatus() != CaseStatus.OPEN) {
            throw new BusinessException("当前案件状态不能重新生成: " + caseDO.getStatus());
        }
        if (reportVersionMapper.existsBySource(caseId, tenantId, VersionSource.AI_DRAFT)) {
            throw new BusinessException("案件已有 AI 初稿");
        }
        if (documentMapper.countNonTerminal(caseId, tenantId) > 0) {
            throw new BusinessException("仍有文档在处理中");
        }
        if (documentMapper.countByStatus(caseId, tenantId, ExtractionStatus.SUCCESS) == 0) {
            throw new BusinessException("没有抽取成功的文档，请先上传有效文档");
        }

        caseMapper.updateStatus(caseId, tenantId, CaseStatus.GENERATING);
        Long messageId = outboxService.enqueueGeneration(caseId, tenantId);

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                try {
                    outboxProcessorService.processMessage(messageId);
                } catch (RuntimeException e) {
                    log.warn("生成消息即时分发失败，等待定时任务处理: caseId={}, messageId={}", caseId, messageId, e);
                }
            }
        });
        log.info("手动重试报告生成: caseId={}, previousStatus={}, messageId={}", caseId, caseDO.getStatus(), messageId);
    }

    @Override
    public ReportVersionVO finalizeCase(Long caseId, Long tenantId, MultipartFile file) {
        String extension = validateFile(file);
        if (!"docx".equals(extension)) {
            throw new BusinessException("定稿文件须为 docx 格式");
        }
        CaseDO caseDO = getCase(caseId, tenantId);
        if (caseDO.getStatus() == CaseStatus.CLOSED) {
            throw new BusinessException("案件已定稿关闭");
        }

        String path = String.format(FINAL_ARTIFACT_PATH, tenantId, caseId, IdUtil.fastSimpleUUID());
        String artifactRef = blobStore.put(readBytes(file), path);
        try {
            ReportVersionDO version = versionManagerService.finalizeCase(caseId, tenantId, artifactRef);
            return toVersionVO(version);
        } catch (RuntimeException e) {
            deleteQuietly(artifactRef);
            throw e;
        }
    }

    @Override
    public CaseDetailVO getCaseDetail(Long caseId, Long tenantId) {
        CaseDO caseDO = getCase(caseId, tenantId);
        return CaseDetailVO.builder()
            .caseInfo(toCaseVO(caseDO))
            .documents(documentMapper.selectByCase(caseId, tenantId).stream().map(this::toDocumentVO).toList())
            .versions(reportVersionMapper.selectByCase(caseId, tenantId).stream().map(this::toVersionVO).toList())
            .build();
    }

    @Override
    public DownloadUrlVO getDownloadUrl(Long caseId, Long versionId, Long tenantId) {
        ReportVersionDO version = reportVersionMapper.selectById(versionId);
        if (version == null || !version.getCaseId().equals(caseId) || !version.getTenantId().equals(tenantId)) {
            throw new BusinessException("报告版本不存在");
        }
        if (StrUtil.isBlank(version.getArtifactRef())) {
            throw new BusinessException("该版本没有报告文件");
        }
        Duration ttl = fileStorageProperties.getDownloadUrlTtl();
        return new DownloadUrlVO(blobStore.signedUrl(version.getArtifactRef(), ttl), ttl.toSeconds());
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void deleteCase(Long caseId, Long tenantId) {
        CaseDO caseDO = lockCase(caseId, tenantId);
        if (caseDO.getStatus().isInFlight()) {
            throw new BusinessException("案件正在处理中，不能删除");
        }
        caseMapper.deleteById(caseId);
        log.info("案件已删除: caseId={}, tenantId={}", caseId, tenantId);
    }

    private void dispatchExtraction(Long documentId, Long tenantId) {
        try {
            taskDispatcher.enqueue(TaskNames.PROCESS_DOCUMENT, new ProcessDocumentPayload(documentId, tenantId));
        } catch (RuntimeException e) {
            // 文档保持 PENDING，可通过重新派发恢复
            log.error("投递抽取任务失败: documentId={}", documentId, e);
        }
    }

    private CaseDO lockCase(Long caseId, Long tenantId) {
        CaseDO caseDO = caseMapper.selectByIdForUpdate(caseId, tenantId);
        if (caseDO == null) {
            throw new BusinessException("案件不存在");
        }
        return caseDO;
    }

    private CaseDO getCase(Long caseId, Long tenantId) {
        CaseDO caseDO = caseMapper.selectById(caseId);
        if (caseDO == null || !caseDO.getTenantId().equals(tenantId)) {
            throw new BusinessException("案件不存在");
        }
        return caseDO;
    }

    /**
     * @return 小写扩展名
     */
    private String validateFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new BusinessException("文件不能为空");
        }
        long maxSize = pipelineProperties.getExtraction().getMaxFileSizeMb() * 1024L * 1024L;
        if (file.getSize() > maxSize) {
            throw new BusinessException("文件大小超过限制: " + pipelineProperties.getExtraction().getMaxFileSizeMb() + "MB");
        }
        String filename = file.getOriginalFilename();
        if (StrUtil.isBlank(filename)) {
            throw new BusinessException("文件名不能为空");
        }
        String extension = FileNameUtil.extName(filename);
        if (StrUtil.isBlank(extension)) {
            throw new BusinessException("无法识别的文件类型：文件缺少扩展名");
        }
        return extension.toLowerCase();
    }

    private byte[] readBytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new BusinessException("读取上传文件失败: " + e.getMessage());
        }
    }

    private void deleteQuietly(String ref) {
        try {
            blobStore.delete(ref);
        } catch (RuntimeException e) {
            log.warn("清理存储对象失败: ref={}", ref, e);
        }
    }

    private String generateReferenceCode() {
        return "PR-" + LocalDate.now(clock).format(DatePattern.PURE_DATE_FORMATTER) + "-" + RandomUtil.randomNumbers(4);
    }

    private CaseVO toCaseVO(CaseDO caseDO) {
        return CaseVO.builder()
            .id(caseDO.getId())
            .clientRef(caseDO.getClientRef())
            .referenceCode(caseDO.getReferenceCode())
            .status(caseDO.getStatus().name())
            .createTime(caseDO.getCreateTime())
            .build();
    }

    private DocumentVO toDocumentVO(DocumentDO document) {
        return DocumentVO.builder()
            .id(document.getId())
            .filename(document.getFilename())
            .mimeType(document.getMimeType())
            .fileSize(document.getFileSize())
            .aiStatus(document.getAiStatus().name())
            .errorMessage(document.getErrorMessage())
            .createTime(document.getCreateTime())
            .build();
    }

    private ReportVersionVO toVersionVO(ReportVersionDO version) {
        return ReportVersionVO.builder()
            .id(version.getId())
            .versionNumber(version.getVersionNumber())
            .isFinal(version.getIsFinal())
            .source(version.getSource().getTag())
            .createTime(version.getCreateTime())
            .build();
    }
}
