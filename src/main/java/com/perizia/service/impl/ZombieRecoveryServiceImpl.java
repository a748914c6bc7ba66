package com.perizia.service.impl;

import com.perizia.mapper.CaseMapper;
import com.perizia.model.enums.CaseStatus;
import com.perizia.service.ZombieRecoveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * 僵尸案件清理实现
 * 只把案件放回 OPEN 让用户重新发起，不尝试接续中断的工作
 *
 * @author perizia
 * @since 2025-03-05
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ZombieRecoveryServiceImpl implements ZombieRecoveryService {

    private static final Set<CaseStatus> STUCK_STATUSES = EnumSet.of(CaseStatus.PROCESSING, CaseStatus.GENERATING);

    private final CaseMapper caseMapper;

    private final Clock clock;

    @Override
    @Transactional(rollbackFor = Exception.class)
    public int rescue(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("超时时间必须为正: " + timeout);
        }
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(timeout);
        int rescued = caseMapper.resetStuckCases(cutoff, STUCK_STATUSES, CaseStatus.OPEN);
        if (rescued > 0) {
            log.warn("已重置卡住的案件: count={}, timeout={}, cutoff={}", rescued, timeout, cutoff);
        } else {
            log.info("没有卡住的案件: timeout={}, cutoff={}", timeout, cutoff);
        }
        return rescued;
    }
}
