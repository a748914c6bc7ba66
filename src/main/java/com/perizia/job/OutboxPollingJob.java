package com.perizia.job;

import com.perizia.config.PipelineProperties;
import com.perizia.service.OutboxProcessorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 定时处理发件箱，补发即时分发失败或进程崩溃后遗留的消息
 *
 * @author perizia
 * @since 2025-03-04
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxPollingJob {

    private final OutboxProcessorService outboxProcessorService;

    private final PipelineProperties pipelineProperties;

    /**
     * 本实例内防止重叠执行，跨实例由 SKIP LOCKED 分摊
     */
    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${pipeline.outbox-poll-interval:PT30S}",
               initialDelayString = "${pipeline.outbox-poll-initial-delay:PT10S}")
    public void poll() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            int processed = outboxProcessorService.processBatch(pipelineProperties.getOutboxBatchSize());
            if (processed > 0) {
                log.info("定时处理发件箱完成: processed={}", processed);
            }
        } catch (RuntimeException e) {
            log.error("定时处理发件箱失败", e);
        } finally {
            running.set(false);
        }
    }
}
