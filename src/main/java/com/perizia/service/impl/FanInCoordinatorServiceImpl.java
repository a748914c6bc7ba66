package com.perizia.service.impl;

import com.perizia.mapper.CaseMapper;
import com.perizia.mapper.DocumentMapper;
import com.perizia.model.entity.CaseDO;
import com.perizia.model.enums.CaseStatus;
import com.perizia.model.enums.ExtractionStatus;
import com.perizia.service.FanInCoordinatorService;
import com.perizia.service.OutboxProcessorService;
import com.perizia.service.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 文档汇聚判定实现
 * 计数与状态切换在同一个案件行锁内完成，并发的完成信号只会有一个写出生成消息
 *
 * @author perizia
 * @since 2025-03-04
 */
@Slf4j
@Service
public class FanInCoordinatorServiceImpl implements FanInCoordinatorService {

    private final CaseMapper caseMapper;

    private final DocumentMapper documentMapper;

    private final OutboxService outboxService;

    private final OutboxProcessorService outboxProcessorService;

    private final TransactionTemplate transactionTemplate;

    public FanInCoordinatorServiceImpl(CaseMapper caseMapper,
                                       DocumentMapper documentMapper,
                                       OutboxService outboxService,
                                       OutboxProcessorService outboxProcessorService,
                                       PlatformTransactionManager transactionManager) {
        this.caseMapper = caseMapper;
        this.documentMapper = documentMapper;
        this.outboxService = outboxService;
        this.outboxProcessorService = outboxProcessorService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        // 可能在外层事务的提交回调中调用，必须开启新事务
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public void checkCompletion(Long caseId, Long tenantId) {
        Long messageId = transactionTemplate.execute(status -> flipIfComplete(caseId, tenantId));
        if (messageId == null) {
            return;
        }
        // 已提交，立即分发失败也会由定时任务补发
        try {
            outboxProcessorService.processMessage(messageId);
        } catch (RuntimeException e) {
            log.warn("生成消息即时分发失败，等待定时任务处理: caseId={}, messageId={}", caseId, messageId, e);
        }
    }

    /**
     * @return 写入的发件箱消息ID，未触发生成时为 null
     */
    private Long flipIfComplete(Long caseId, Long tenantId) {
        CaseDO caseDO = caseMapper.selectByIdForUpdate(caseId, tenantId);
        if (caseDO == null) {
            log.warn("案件不存在，忽略汇聚判定: caseId={}, tenantId={}", caseId, tenantId);
            return null;
        }
        if (caseDO.getStatus() == CaseStatus.GENERATING) {
            log.info("案件已在生成中，忽略重复的完成信号: caseId={}", caseId);
            return null;
        }
        if (caseDO.getStatus() == CaseStatus.CLOSED) {
            log.info("案件已关闭，忽略完成信号: caseId={}", caseId);
            return null;
        }

        long pending = documentMapper.countNonTerminal(caseId, tenantId);
        if (pending > 0) {
            log.debug("仍有文档未处理完成: caseId={}, pending={}", caseId, pending);
            return null;
        }

        long succeeded = documentMapper.countByStatus(caseId, tenantId, ExtractionStatus.SUCCESS);
        if (succeeded == 0) {
            caseMapper.updateStatus(caseId, tenantId, CaseStatus.ERROR);
            log.warn("案件没有任何抽取成功的文档，不触发生成: caseId={}", caseId);
            return null;
        }

        caseMapper.updateStatus(caseId, tenantId, CaseStatus.GENERATING);
        Long messageId = outboxService.enqueueGeneration(caseId, tenantId);
        log.info("全部文档处理完成，触发报告生成: caseId={}, succeeded={}, messageId={}", caseId, succeeded, messageId);
        return messageId;
    }
}
