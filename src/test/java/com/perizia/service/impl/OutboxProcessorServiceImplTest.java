package com.perizia.service.impl;

import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perizia.mapper.OutboxMessageMapper;
import com.perizia.model.dto.GenerateReportPayload;
import com.perizia.model.dto.TaskNames;
import com.perizia.model.dto.TaskPayload;
import com.perizia.model.entity.OutboxMessageDO;
import com.perizia.model.enums.OutboxStatus;
import com.perizia.service.OutboxHandler;
import com.perizia.support.MybatisPlusTestSupport;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("unchecked")
class OutboxProcessorServiceImplTest {

    private OutboxMessageMapper mapper;

    private final List<TaskPayload> handled = new ArrayList<>();

    private PlatformTransactionManager txManager;

    private OutboxProcessorServiceImpl processor;

    @BeforeAll
    static void initTableInfo() {
        MybatisPlusTestSupport.initTableInfo(OutboxMessageDO.class);
    }

    @BeforeEach
    void setUp() {
        mapper = mock(OutboxMessageMapper.class);
        OutboxHandler handler = new OutboxHandler() {
            @Override
            public String topic() {
                return TaskNames.GENERATE_REPORT;
            }

            @Override
            public void handle(TaskPayload payload) {
                if (((GenerateReportPayload) payload).caseId() == 13L) {
                    throw new IllegalStateException("broker unavailable");
                }
                handled.add(payload);
            }
        };
        txManager = mock(PlatformTransactionManager.class);
        processor = new OutboxProcessorServiceImpl(mapper, new OutboxServiceImpl(mapper, new ObjectMapper()),
            List.of(handler), txManager,
            Clock.fixed(Instant.parse("2025-03-04T10:00:00Z"), ZoneOffset.UTC));
    }

    private static OutboxMessageDO message(long id, long caseId, int retryCount) {
        OutboxMessageDO message = OutboxMessageDO.pending(TaskNames.GENERATE_REPORT, 7L,
            "{\"task\":\"generate-report\",\"caseId\":" + caseId + ",\"tenantId\":7}");
        message.setId(id);
        message.setRetryCount(retryCount);
        return message;
    }

    @Test
    void oneFailingMessageDoesNotAbortTheBatch() {
        when(mapper.selectPendingForUpdateSkipLocked(10)).thenReturn(List.of(
            message(1L, 13L, 2),
            message(2L, 21L, 0)));

        int processed = processor.processBatch(10);

        assertThat(processed).isEqualTo(1);
        assertThat(handled).containsExactly(new GenerateReportPayload(21L, 7L));

        ArgumentCaptor<LambdaUpdateWrapper<OutboxMessageDO>> captor = ArgumentCaptor.forClass(LambdaUpdateWrapper.class);
        verify(mapper, times(2)).update(isNull(), captor.capture());
        // 失败消息重试次数 +1 并记录错误，仍为 PENDING
        assertThat(MybatisPlusTestSupport.paramValues(captor.getAllValues().get(0)))
            .contains(3)
            .anyMatch(v -> v instanceof String s && s.contains("broker unavailable"))
            .doesNotContain(OutboxStatus.PROCESSED);
        assertThat(MybatisPlusTestSupport.paramValues(captor.getAllValues().get(1)))
            .contains(OutboxStatus.PROCESSED);
    }

    @Test
    void emptyBatchProcessesNothing() {
        when(mapper.selectPendingForUpdateSkipLocked(5)).thenReturn(List.of());

        assertThat(processor.processBatch(5)).isZero();
    }

    @Test
    void unknownTopicStaysPending() {
        OutboxMessageDO unknown = message(3L, 21L, 0);
        unknown.setTopic("send-email");
        when(mapper.selectPendingByIdForUpdateSkipLocked(3L)).thenReturn(unknown);

        assertThat(processor.processMessage(3L)).isFalse();
        assertThat(handled).isEmpty();
    }

    @Test
    void messageClaimedElsewhereIsSkipped() {
        when(mapper.selectPendingByIdForUpdateSkipLocked(4L)).thenReturn(null);

        assertThat(processor.processMessage(4L)).isFalse();
    }

    @Test
    void batchRunsInItsOwnTransaction() {
        when(mapper.selectPendingForUpdateSkipLocked(10)).thenReturn(List.of());

        processor.processBatch(10);

        ArgumentCaptor<TransactionDefinition> captor = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(txManager).getTransaction(captor.capture());
        assertThat(captor.getValue().getPropagationBehavior()).isEqualTo(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }
}
