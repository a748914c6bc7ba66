package com.perizia.job;

import com.perizia.config.PipelineProperties;
import com.perizia.service.ZombieRecoveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时清理卡住的案件，默认关闭
 *
 * @author perizia
 * @since 2025-03-05
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pipeline.zombie-sweep-enabled", havingValue = "true")
public class ZombieSweepJob {

    private final ZombieRecoveryService zombieRecoveryService;

    private final PipelineProperties pipelineProperties;

    @Scheduled(fixedDelayString = "${pipeline.zombie-sweep-interval:PT15M}")
    public void sweep() {
        try {
            zombieRecoveryService.rescue(pipelineProperties.getZombieTimeout());
        } catch (RuntimeException e) {
            log.error("定时清理卡住案件失败", e);
        }
    }
}
