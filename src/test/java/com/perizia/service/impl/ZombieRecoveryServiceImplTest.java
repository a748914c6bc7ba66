package com.perizia.service.impl;

import com.perizia.mapper.CaseMapper;
import com.perizia.model.entity.CaseDO;
import com.perizia.model.enums.CaseStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ZombieRecoveryServiceImplTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 5, 12, 0);

    private CaseMapper caseMapper;

    private ZombieRecoveryServiceImpl service;

    private List<CaseDO> cases;

    @BeforeEach
    void setUp() {
        caseMapper = mock(CaseMapper.class);
        service = new ZombieRecoveryServiceImpl(caseMapper, Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));

        cases = List.of(
            caseCreated(1L, CaseStatus.PROCESSING, NOW.minusHours(3)),
            caseCreated(2L, CaseStatus.GENERATING, NOW.minusHours(1)),
            caseCreated(3L, CaseStatus.GENERATING, NOW.minusHours(5)),
            caseCreated(4L, CaseStatus.ERROR, NOW.minusHours(6)),
            caseCreated(5L, CaseStatus.CLOSED, NOW.minusDays(2)));

        // 按 SQL 语义在内存中执行
        when(caseMapper.resetStuckCases(any(), any(), any())).thenAnswer(invocation -> {
            LocalDateTime cutoff = invocation.getArgument(0);
            Collection<CaseStatus> stuck = invocation.getArgument(1);
            CaseStatus target = invocation.getArgument(2);
            int updated = 0;
            for (CaseDO c : cases) {
                if (c.getCreateTime().isBefore(cutoff) && stuck.contains(c.getStatus())) {
                    c.setStatus(target);
                    updated++;
                }
            }
            return updated;
        });
    }

    private static CaseDO caseCreated(Long id, CaseStatus status, LocalDateTime createTime) {
        return CaseDO.builder().id(id).tenantId(7L).status(status).createTime(createTime).build();
    }

    @Test
    void resetsOnlyStuckCasesOlderThanTimeout() {
        int rescued = service.rescue(Duration.ofHours(2));

        assertThat(rescued).isEqualTo(2);
        assertThat(cases).extracting(CaseDO::getStatus).containsExactly(
            CaseStatus.OPEN,
            CaseStatus.GENERATING,
            CaseStatus.OPEN,
            CaseStatus.ERROR,
            CaseStatus.CLOSED);
    }

    @Test
    void nothingToRescueReturnsZero() {
        assertThat(service.rescue(Duration.ofHours(12))).isZero();
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThatThrownBy(() -> service.rescue(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.rescue(Duration.ofMinutes(-5))).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(caseMapper);
    }
}
