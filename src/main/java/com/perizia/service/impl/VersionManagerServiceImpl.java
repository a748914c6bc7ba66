package com.perizia.service.impl;

import com.perizia.Exception.CoordinationException;
import com.perizia.mapper.CaseMapper;
import com.perizia.mapper.ReportVersionMapper;
import com.perizia.mapper.TrainingPairMapper;
import com.perizia.model.entity.CaseDO;
import com.perizia.model.entity.ReportVersionDO;
import com.perizia.model.entity.TrainingPairDO;
import com.perizia.model.enums.CaseStatus;
import com.perizia.model.enums.VersionSource;
import com.perizia.service.VersionManagerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import top.continew.starter.core.exception.BusinessException;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 报告版本管理实现
 * 版本号 = 锁内读取的 max(version_number) + 1，(case_id, version_number) 另有唯一约束兜底
 *
 * @author perizia
 * @since 2025-03-05
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VersionManagerServiceImpl implements VersionManagerService {

    private final CaseMapper caseMapper;

    private final ReportVersionMapper reportVersionMapper;

    private final TrainingPairMapper trainingPairMapper;

    private final Clock clock;

    @Override
    @Transactional(rollbackFor = Exception.class)
    public ReportVersionDO createDraftVersion(Long caseId, Long tenantId, String text, String artifactRef) {
        CaseDO caseDO = lockCase(caseId, tenantId);

        // 重复投递的生成任务可能都走到这里，以锁内的检查为准
        ReportVersionDO existing = reportVersionMapper.selectLatestBySource(caseId, tenantId, VersionSource.AI_DRAFT);
        if (existing != null) {
            log.warn("AI 初稿已存在，忽略重复写入: caseId={}, version={}", caseId, existing.getVersionNumber());
            reopen(caseDO);
            return existing;
        }

        ReportVersionDO version = insertVersion(caseId, tenantId, text, artifactRef, VersionSource.AI_DRAFT, false, null);
        reopen(caseDO);
        log.info("新建 AI 初稿: caseId={}, version={}", caseId, version.getVersionNumber());
        return version;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public ReportVersionDO createPreliminaryVersion(Long caseId, Long tenantId, String text, String documentHash) {
        CaseDO caseDO = lockCase(caseId, tenantId);
        if (caseDO.getStatus() == CaseStatus.CLOSED) {
            throw new BusinessException("案件已定稿关闭");
        }
        ReportVersionDO version = insertVersion(caseId, tenantId, text, null, VersionSource.PRELIMINARY, false, documentHash);
        log.info("新建初步报告: caseId={}, version={}", caseId, version.getVersionNumber());
        return version;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public ReportVersionDO finalizeCase(Long caseId, Long tenantId, String finalArtifactRef) {
        CaseDO caseDO = lockCase(caseId, tenantId);
        if (caseDO.getStatus() == CaseStatus.CLOSED) {
            throw new BusinessException("案件已定稿关闭");
        }
        if (caseDO.getStatus().isInFlight()) {
            throw new BusinessException("案件正在处理中，暂不能定稿");
        }

        ReportVersionDO finalVersion = insertVersion(caseId, tenantId, null, finalArtifactRef, VersionSource.HUMAN_FINAL, true, null);

        ReportVersionDO draft = reportVersionMapper.selectLatestDraft(caseId, tenantId);
        if (draft != null) {
            TrainingPairDO pair = TrainingPairDO.builder()
                .caseId(caseId)
                .tenantId(tenantId)
                .aiVersionId(draft.getId())
                .finalVersionId(finalVersion.getId())
                .createTime(LocalDateTime.now(clock))
                .build();
            trainingPairMapper.insert(pair);
            log.info("生成训练样本对: caseId={}, aiVersion={}, finalVersion={}",
                caseId, draft.getVersionNumber(), finalVersion.getVersionNumber());
        } else {
            log.info("案件没有 AI 初稿，跳过训练样本对: caseId={}", caseId);
        }

        caseMapper.updateStatus(caseId, tenantId, CaseStatus.CLOSED);
        log.info("案件已定稿关闭: caseId={}, finalVersion={}", caseId, finalVersion.getVersionNumber());
        return finalVersion;
    }

    private CaseDO lockCase(Long caseId, Long tenantId) {
        CaseDO caseDO;
        try {
            caseDO = caseMapper.selectByIdForUpdate(caseId, tenantId);
        } catch (PessimisticLockingFailureException e) {
            throw new CoordinationException("获取案件锁失败: caseId=" + caseId, e);
        }
        if (caseDO == null) {
            throw new BusinessException("案件不存在");
        }
        return caseDO;
    }

    private void reopen(CaseDO caseDO) {
        if (caseDO.getStatus() != CaseStatus.CLOSED && caseDO.getStatus() != CaseStatus.OPEN) {
            caseMapper.updateStatus(caseDO.getId(), caseDO.getTenantId(), CaseStatus.OPEN);
        }
    }

    private ReportVersionDO insertVersion(Long caseId, Long tenantId, String text, String artifactRef,
                                          VersionSource source, boolean isFinal, String documentHash) {
        int next = reportVersionMapper.selectMaxVersionNumber(caseId, tenantId) + 1;
        ReportVersionDO version = ReportVersionDO.builder()
            .caseId(caseId)
            .tenantId(tenantId)
            .versionNumber(next)
            .isFinal(isFinal)
            .source(source)
            .aiRawOutput(text)
            .artifactRef(artifactRef)
            .documentHash(documentHash)
            .createTime(LocalDateTime.now(clock))
            .build();
        try {
            reportVersionMapper.insert(version);
        } catch (DuplicateKeyException e) {
            throw new CoordinationException("版本号冲突: caseId=" + caseId + ", version=" + next, e);
        }
        return version;
    }
}
