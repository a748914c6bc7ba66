package com.perizia.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perizia.config.PipelineProperties;
import com.perizia.mapper.DocumentMapper;
import com.perizia.model.content.ExtractedContent;
import com.perizia.model.entity.DocumentDO;
import com.perizia.model.enums.ExtractionErrorType;
import com.perizia.model.enums.ExtractionStatus;
import com.perizia.service.DocumentExtractionService;
import com.perizia.service.ExtractionErrorClassifier;
import com.perizia.service.ExtractionWorkerService;
import com.perizia.service.FanInCoordinatorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Semaphore;

/**
 * 文档抽取 worker 实现
 * 抽取在固定大小的信号量内进行，限制同一 worker 上同时占用的内存和磁盘
 *
 * @author perizia
 * @since 2025-03-03
 */
@Slf4j
@Service
public class ExtractionWorkerServiceImpl implements ExtractionWorkerService {

    /**
     * 错误信息列长度上限
     */
    private static final int MAX_ERROR_LENGTH = 1000;

    private final DocumentMapper documentMapper;

    private final DocumentExtractionService extractionService;

    private final FanInCoordinatorService fanInCoordinatorService;

    private final ObjectMapper objectMapper;

    private final Semaphore extractionGate;

    public ExtractionWorkerServiceImpl(DocumentMapper documentMapper,
                                       DocumentExtractionService extractionService,
                                       FanInCoordinatorService fanInCoordinatorService,
                                       ObjectMapper objectMapper,
                                       PipelineProperties pipelineProperties) {
        this.documentMapper = documentMapper;
        this.extractionService = extractionService;
        this.fanInCoordinatorService = fanInCoordinatorService;
        this.objectMapper = objectMapper;
        this.extractionGate = new Semaphore(pipelineProperties.getExtractionConcurrency(), true);
    }

    @Override
    public void processDocument(Long documentId, Long tenantId) {
        DocumentDO document = documentMapper.selectOne(new LambdaQueryWrapper<DocumentDO>()
            .eq(DocumentDO::getId, documentId)
            .eq(DocumentDO::getTenantId, tenantId));
        if (document == null) {
            log.warn("文档不存在，忽略抽取任务: documentId={}, tenantId={}", documentId, tenantId);
            return;
        }

        // 重复投递：不再抽取，只补一次汇聚判定
        if (document.getAiStatus() == ExtractionStatus.SUCCESS) {
            log.info("文档已抽取成功，跳过: documentId={}", documentId);
            fanInCoordinatorService.checkCompletion(document.getCaseId(), tenantId);
            return;
        }

        updateStatus(document, ExtractionStatus.PROCESSING, null, null);

        try {
            extractionGate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("等待抽取名额时被中断: documentId=" + documentId, e);
        }
        ExtractionStatus status;
        String content = null;
        String errorMessage = null;
        try {
            List<ExtractedContent> contents = extractionService.extract(
                document.getStorageRef(), document.getMimeType(), document.getFilename());
            if (contents.isEmpty()) {
                status = ExtractionStatus.SKIPPED;
            } else {
                status = ExtractionStatus.SUCCESS;
                content = toJson(contents);
            }
        } catch (RuntimeException e) {
            ExtractionErrorType type = ExtractionErrorClassifier.classify(e);
            log.warn("文档抽取失败: documentId={}, type={}, reason={}", documentId, type, e.getMessage(), e);
            status = ExtractionStatus.ERROR;
            errorMessage = truncate(type.getUserMessage());
        } catch (StackOverflowError | LinkageError e) {
            // 解析库在畸形文件上的错误只影响当前文档；其余 Error 向上抛出，文档停在 PROCESSING，由重新派发恢复
            log.error("文档解析异常终止: documentId={}", documentId, e);
            status = ExtractionStatus.ERROR;
            errorMessage = truncate(ExtractionErrorType.GENERIC.getUserMessage());
        } finally {
            extractionGate.release();
        }

        // 数据库异常不属于抽取失败，直接抛给任务队列
        updateStatus(document, status, content, errorMessage);
        log.info("文档抽取结束: documentId={}, status={}", documentId, status);

        fanInCoordinatorService.checkCompletion(document.getCaseId(), tenantId);
    }

    private void updateStatus(DocumentDO document, ExtractionStatus status, String content, String errorMessage) {
        documentMapper.update(null, new LambdaUpdateWrapper<DocumentDO>()
            .eq(DocumentDO::getId, document.getId())
            .eq(DocumentDO::getTenantId, document.getTenantId())
            .set(DocumentDO::getAiStatus, status)
            .set(DocumentDO::getExtractedContent, content)
            .set(DocumentDO::getErrorMessage, errorMessage));
        document.setAiStatus(status);
    }

    private String toJson(List<ExtractedContent> contents) {
        try {
            return objectMapper.writerFor(ExtractedContent.LIST_TYPE).writeValueAsString(contents);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("抽取结果序列化失败", e);
        }
    }

    private static String truncate(String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
