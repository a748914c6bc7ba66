package com.perizia.service.impl;

import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.perizia.mapper.OutboxMessageMapper;
import com.perizia.model.entity.OutboxMessageDO;
import com.perizia.model.enums.OutboxStatus;
import com.perizia.service.OutboxHandler;
import com.perizia.service.OutboxProcessorService;
import com.perizia.service.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 发件箱处理器实现
 * 消息在领取它的事务内分发并回写状态，行锁持有到事务结束，其他处理器会跳过这些行
 *
 * @author perizia
 * @since 2025-03-04
 */
@Slf4j
@Service
public class OutboxProcessorServiceImpl implements OutboxProcessorService {

    private static final int MAX_ERROR_LOG_LENGTH = 2000;

    private final OutboxMessageMapper outboxMessageMapper;

    private final OutboxService outboxService;

    private final Map<String, OutboxHandler> handlers;

    private final TransactionTemplate transactionTemplate;

    private final Clock clock;

    public OutboxProcessorServiceImpl(OutboxMessageMapper outboxMessageMapper,
                                      OutboxService outboxService,
                                      List<OutboxHandler> handlers,
                                      PlatformTransactionManager transactionManager,
                                      Clock clock) {
        this.outboxMessageMapper = outboxMessageMapper;
        this.outboxService = outboxService;
        this.handlers = handlers.stream().collect(Collectors.toMap(OutboxHandler::topic, Function.identity()));
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        // 可能在外层事务的提交回调中调用，必须开启新事务
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    @Override
    public int processBatch(int limit) {
        Integer processed = transactionTemplate.execute(status -> {
            List<OutboxMessageDO> batch = outboxMessageMapper.selectPendingForUpdateSkipLocked(limit);
            if (batch.isEmpty()) {
                return 0;
            }
            log.info("领取发件箱消息: count={}", batch.size());
            int ok = 0;
            for (OutboxMessageDO message : batch) {
                if (dispatch(message)) {
                    ok++;
                }
            }
            return ok;
        });
        return processed == null ? 0 : processed;
    }

    @Override
    public boolean processMessage(Long messageId) {
        Boolean processed = transactionTemplate.execute(status -> {
            OutboxMessageDO message = outboxMessageMapper.selectPendingByIdForUpdateSkipLocked(messageId);
            if (message == null) {
                log.debug("发件箱消息已被领取或已处理: messageId={}", messageId);
                return false;
            }
            return dispatch(message);
        });
        return Boolean.TRUE.equals(processed);
    }

    /**
     * 分发单条消息；处理器异常只记录，不向外抛出
     */
    private boolean dispatch(OutboxMessageDO message) {
        RuntimeException failure = null;
        try {
            OutboxHandler handler = handlers.get(message.getTopic());
            if (handler == null) {
                throw new IllegalStateException("没有处理该主题的处理器: " + message.getTopic());
            }
            handler.handle(outboxService.readPayload(message.getPayload()));
        } catch (RuntimeException e) {
            failure = e;
        }

        if (failure == null) {
            outboxMessageMapper.update(null, new LambdaUpdateWrapper<OutboxMessageDO>()
                .eq(OutboxMessageDO::getId, message.getId())
                .set(OutboxMessageDO::getStatus, OutboxStatus.PROCESSED)
                .set(OutboxMessageDO::getProcessedAt, LocalDateTime.now(clock)));
            log.info("发件箱消息处理成功: id={}, topic={}", message.getId(), message.getTopic());
            return true;
        }

        int retryCount = (message.getRetryCount() == null ? 0 : message.getRetryCount()) + 1;
        outboxMessageMapper.update(null, new LambdaUpdateWrapper<OutboxMessageDO>()
            .eq(OutboxMessageDO::getId, message.getId())
            .set(OutboxMessageDO::getRetryCount, retryCount)
            .set(OutboxMessageDO::getErrorLog, StrUtil.maxLength(String.valueOf(failure), MAX_ERROR_LOG_LENGTH)));
        log.warn("发件箱消息处理失败，保留待重试: id={}, topic={}, retryCount={}",
            message.getId(), message.getTopic(), retryCount, failure);
        return false;
    }
}
