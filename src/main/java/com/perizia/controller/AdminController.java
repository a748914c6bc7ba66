package com.perizia.controller;

import cn.dev33.satoken.annotation.SaCheckRole;
import com.perizia.config.PipelineProperties;
import com.perizia.model.vo.RescueResultVO;
import com.perizia.service.OutboxProcessorService;
import com.perizia.service.ZombieRecoveryService;
import com.perizia.service.llm.ProviderFileCleanupQueue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 运维接口
 *
 * @author perizia
 * @since 2025-03-05
 */
@Slf4j
@Tag(name = "运维管理", description = "僵尸案件清理、发件箱补发")
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@SaCheckRole("admin")
public class AdminController {

    private final ZombieRecoveryService zombieRecoveryService;

    private final OutboxProcessorService outboxProcessorService;

    private final ProviderFileCleanupQueue cleanupQueue;

    private final PipelineProperties pipelineProperties;

    @Operation(summary = "清理僵尸案件", description = "把超时仍处于 PROCESSING / GENERATING 的案件重置为 OPEN")
    @PostMapping("/zombies/rescue")
    public RescueResultVO rescueZombies(
            @Parameter(description = "超时(分钟)，为空时使用 pipeline.zombie-timeout")
            @RequestParam(value = "timeoutMinutes", required = false) Long timeoutMinutes) {
        Duration timeout = timeoutMinutes == null
            ? pipelineProperties.getZombieTimeout()
            : Duration.ofMinutes(timeoutMinutes);
        int rescued = zombieRecoveryService.rescue(timeout);
        log.info("手动清理僵尸案件: timeout={}, rescued={}", timeout, rescued);
        return new RescueResultVO(rescued, timeout.toMinutes());
    }

    @Operation(summary = "处理一批发件箱消息")
    @PostMapping("/outbox/process")
    public Map<String, Integer> processOutbox(
            @Parameter(description = "批大小") @RequestParam(value = "limit", required = false) Integer limit) {
        int batch = limit == null ? pipelineProperties.getOutboxBatchSize() : limit;
        return Map.of("processed", outboxProcessorService.processBatch(batch));
    }

    @Operation(summary = "查看清理失败的模型端临时文件")
    @GetMapping("/provider-files/dead-letters")
    public List<String> providerFileDeadLetters() {
        return cleanupQueue.deadLetters();
    }
}
